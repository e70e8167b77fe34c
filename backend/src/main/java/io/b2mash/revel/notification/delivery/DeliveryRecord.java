package io.b2mash.revel.notification.delivery;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Tracks delivery of one notification over one channel. There is at most one row per
 * (notification, channel); every attempt mutates the same row.
 */
@Entity
@Table(
    name = "notification_deliveries",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_delivery_notification_channel",
            columnNames = {"notification_id", "channel"}))
public class DeliveryRecord {

  private static final int MAX_ERROR_LENGTH = 2000;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "notification_id", nullable = false)
  private UUID notificationId;

  @Enumerated(EnumType.STRING)
  @Column(name = "channel", nullable = false, length = 20)
  private DeliveryChannel channel;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private DeliveryStatus status;

  @Column(name = "retry_count", nullable = false)
  private int retryCount;

  @Column(name = "retryable", nullable = false)
  private boolean retryable;

  @Column(name = "attempted_at")
  private Instant attemptedAt;

  @Column(name = "delivered_at")
  private Instant deliveredAt;

  @Column(name = "error_message", columnDefinition = "TEXT")
  private String errorMessage;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> metadata = new HashMap<>();

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected DeliveryRecord() {}

  public DeliveryRecord(UUID notificationId, DeliveryChannel channel) {
    this.notificationId = notificationId;
    this.channel = channel;
    this.status = DeliveryStatus.PENDING;
    this.retryCount = 0;
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  /** Starts a new attempt. {@code retryCount} counts attempts, including the first one. */
  public void beginAttempt(Instant now) {
    this.attemptedAt = now;
    this.retryCount++;
  }

  public void markSent(Instant now, Map<String, Object> deliveryMetadata) {
    this.status = DeliveryStatus.SENT;
    this.deliveredAt = now;
    this.errorMessage = null;
    this.retryable = false;
    if (deliveryMetadata != null) {
      this.metadata.putAll(deliveryMetadata);
    }
  }

  public void markFailed(String errorMessage, boolean retryable) {
    this.status = DeliveryStatus.FAILED;
    this.errorMessage = truncate(errorMessage);
    this.retryable = retryable;
    this.metadata.put("error_class", retryable ? "TRANSIENT" : "PERMANENT");
  }

  /** Held back by a local throttle before any send; the attempt count stays as it was. */
  public void markDeferred(String reason) {
    this.status = DeliveryStatus.FAILED;
    this.errorMessage = truncate(reason);
    this.retryable = true;
    this.metadata.put("error_class", "THROTTLED");
  }

  public void markSkipped(String reason) {
    this.status = DeliveryStatus.SKIPPED;
    this.retryable = false;
    this.metadata.put("skip_reason", reason);
  }

  public boolean isSent() {
    return status == DeliveryStatus.SENT;
  }

  /** A permanent failure, or a transient one that has used up its attempts. */
  public boolean isTerminallyFailed(int maxAttempts) {
    return status == DeliveryStatus.FAILED && (!retryable || retryCount >= maxAttempts);
  }

  public UUID getId() {
    return id;
  }

  public UUID getNotificationId() {
    return notificationId;
  }

  public DeliveryChannel getChannel() {
    return channel;
  }

  public DeliveryStatus getStatus() {
    return status;
  }

  public int getRetryCount() {
    return retryCount;
  }

  public boolean isRetryable() {
    return retryable;
  }

  public Instant getAttemptedAt() {
    return attemptedAt;
  }

  public Instant getDeliveredAt() {
    return deliveredAt;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  private static String truncate(String message) {
    if (message == null || message.length() <= MAX_ERROR_LENGTH) {
      return message;
    }
    return message.substring(0, MAX_ERROR_LENGTH);
  }
}
