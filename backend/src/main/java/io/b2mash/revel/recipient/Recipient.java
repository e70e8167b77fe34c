package io.b2mash.revel.recipient;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/** Local projection of a user account, holding what delivery needs to know about the user. */
@Entity
@Table(name = "notification_recipients")
public class Recipient {

  @Id
  @Column(name = "user_id")
  private UUID userId;

  @Column(name = "email", length = 320)
  private String email;

  @Column(name = "email_verified", nullable = false)
  private boolean emailVerified;

  @Column(name = "display_name", length = 255)
  private String displayName;

  @Column(name = "locale", nullable = false, length = 20)
  private String locale;

  @Column(name = "time_zone", length = 60)
  private String timeZone;

  @Column(name = "guest", nullable = false)
  private boolean guest;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Recipient() {}

  public Recipient(
      UUID userId,
      String email,
      boolean emailVerified,
      String displayName,
      String locale,
      String timeZone,
      boolean guest) {
    this.userId = userId;
    this.email = email;
    this.emailVerified = emailVerified;
    this.displayName = displayName;
    this.locale = locale != null && !locale.isBlank() ? locale : "en";
    this.timeZone = timeZone;
    this.guest = guest;
    this.createdAt = Instant.now();
  }

  public void updateContact(String email, boolean emailVerified, String displayName) {
    this.email = email;
    this.emailVerified = emailVerified;
    this.displayName = displayName;
  }

  public void updateLocalization(String locale, String timeZone) {
    this.locale = locale != null && !locale.isBlank() ? locale : "en";
    this.timeZone = timeZone;
  }

  /** True when the address exists and has been verified. */
  public boolean hasDeliverableEmail() {
    return emailVerified && email != null && !email.isBlank();
  }

  public Locale toLocale() {
    return Locale.forLanguageTag(locale);
  }

  public Optional<ZoneId> zoneId() {
    if (timeZone == null || timeZone.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(ZoneId.of(timeZone));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }

  /** Display name, falling back to the local part of the email address. */
  public String greetingName() {
    if (displayName != null && !displayName.isBlank()) {
      return displayName;
    }
    if (email != null && email.contains("@")) {
      return email.substring(0, email.indexOf('@'));
    }
    return "";
  }

  public UUID getUserId() {
    return userId;
  }

  public String getEmail() {
    return email;
  }

  public boolean isEmailVerified() {
    return emailVerified;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getLocale() {
    return locale;
  }

  public String getTimeZone() {
    return timeZone;
  }

  public boolean isGuest() {
    return guest;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
