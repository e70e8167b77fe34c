package io.b2mash.revel.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A single notification addressed to one user. Title and body start out empty and are filled in
 * when the notification is dispatched, in the recipient's language.
 */
@Entity
@Table(name = "notifications")
public class Notification {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 50)
  private NotificationType type;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "context", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> context = new HashMap<>();

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "body", nullable = false, columnDefinition = "TEXT")
  private String body;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "read_at")
  private Instant readAt;

  @Column(name = "archived_at")
  private Instant archivedAt;

  protected Notification() {}

  public Notification(NotificationType type, UUID userId, Map<String, Object> context) {
    this.type = type;
    this.userId = userId;
    this.context = new HashMap<>(context);
    this.title = "";
    this.body = "";
    this.createdAt = Instant.now();
  }

  /** Stores the in-app rendering produced at dispatch time. */
  public void applyRendering(String title, String body) {
    this.title = title != null ? title : "";
    this.body = body != null ? body : "";
  }

  public void markRead(Instant when) {
    if (this.readAt == null) {
      this.readAt = when;
    }
  }

  public void markUnread() {
    this.readAt = null;
  }

  public void archive(Instant when) {
    this.archivedAt = when;
  }

  public boolean isRead() {
    return readAt != null;
  }

  public boolean isRendered() {
    return !title.isEmpty();
  }

  public UUID getId() {
    return id;
  }

  public NotificationType getType() {
    return type;
  }

  public UUID getUserId() {
    return userId;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  public String getTitle() {
    return title;
  }

  public String getBody() {
    return body;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getReadAt() {
    return readAt;
  }

  public Instant getArchivedAt() {
    return archivedAt;
  }
}
