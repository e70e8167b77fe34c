package io.b2mash.revel.notification.preference;

import io.b2mash.revel.notification.NotificationType;
import io.b2mash.revel.notification.delivery.DeliveryChannel;
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
import java.time.Instant;
import java.time.LocalTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One row per user. Resolution rules: {@code silenceAll} wins over everything, a per-type override
 * can only disable or narrow, and a type without an override inherits the global channel set.
 */
@Entity
@Table(name = "notification_preferences")
public class NotificationPreference {

  public static final LocalTime DEFAULT_DIGEST_SEND_TIME = LocalTime.of(9, 0);

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, unique = true)
  private UUID userId;

  @Column(name = "silence_all", nullable = false)
  private boolean silenceAll;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "enabled_channels", nullable = false, columnDefinition = "jsonb")
  private Set<DeliveryChannel> enabledChannels = new LinkedHashSet<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "digest_frequency", nullable = false, length = 20)
  private DigestFrequency digestFrequency;

  @Column(name = "digest_send_time", nullable = false)
  private LocalTime digestSendTime;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "type_settings", nullable = false, columnDefinition = "jsonb")
  private Map<NotificationType, NotificationTypeSetting> typeSettings = new HashMap<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected NotificationPreference() {}

  public NotificationPreference(UUID userId, Collection<DeliveryChannel> enabledChannels) {
    this.userId = userId;
    this.silenceAll = false;
    this.enabledChannels = new LinkedHashSet<>(enabledChannels);
    this.digestFrequency = DigestFrequency.IMMEDIATE;
    this.digestSendTime = DEFAULT_DIGEST_SEND_TIME;
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

  public boolean isChannelEnabled(DeliveryChannel channel) {
    return !silenceAll && enabledChannels.contains(channel);
  }

  public boolean isNotificationTypeEnabled(NotificationType type) {
    if (silenceAll) {
      return false;
    }
    var setting = typeSettings.get(type);
    return setting == null || setting.enabled();
  }

  /** Channels the user accepts for this type, already intersected with the global channel set. */
  public Set<DeliveryChannel> getChannelsForNotificationType(NotificationType type) {
    if (!isNotificationTypeEnabled(type) || enabledChannels.isEmpty()) {
      return EnumSet.noneOf(DeliveryChannel.class);
    }
    var result = EnumSet.copyOf(enabledChannels);
    var setting = typeSettings.get(type);
    if (setting != null && !setting.channels().isEmpty()) {
      result.retainAll(setting.channels());
    }
    return result;
  }

  public void putTypeSetting(NotificationType type, NotificationTypeSetting setting) {
    typeSettings.put(type, setting);
  }

  public void disableChannel(DeliveryChannel channel) {
    enabledChannels.remove(channel);
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public boolean isSilenceAll() {
    return silenceAll;
  }

  public void setSilenceAll(boolean silenceAll) {
    this.silenceAll = silenceAll;
  }

  public Set<DeliveryChannel> getEnabledChannels() {
    return enabledChannels;
  }

  public void setEnabledChannels(Collection<DeliveryChannel> enabledChannels) {
    this.enabledChannels = new LinkedHashSet<>(enabledChannels);
  }

  public DigestFrequency getDigestFrequency() {
    return digestFrequency;
  }

  public void setDigestFrequency(DigestFrequency digestFrequency) {
    this.digestFrequency = digestFrequency;
  }

  public LocalTime getDigestSendTime() {
    return digestSendTime;
  }

  public void setDigestSendTime(LocalTime digestSendTime) {
    this.digestSendTime = digestSendTime;
  }

  public Map<NotificationType, NotificationTypeSetting> getTypeSettings() {
    return typeSettings;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
