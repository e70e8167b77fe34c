package io.b2mash.revel.integration.email;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Audit row for every outbound email, successful or not. */
@Entity
@Table(name = "email_delivery_log")
public class EmailDeliveryLog {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "recipient_email", nullable = false, length = 320)
  private String recipientEmail;

  @Column(name = "template_name", nullable = false, length = 100)
  private String templateName;

  @Column(name = "reference_type", nullable = false, length = 30)
  private String referenceType;

  @Column(name = "reference_id")
  private UUID referenceId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private EmailDeliveryStatus status;

  @Column(name = "provider_message_id", length = 200)
  private String providerMessageId;

  @Column(name = "provider_slug", nullable = false, length = 50)
  private String providerSlug;

  @Column(name = "error_message", columnDefinition = "TEXT")
  private String errorMessage;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected EmailDeliveryLog() {}

  public EmailDeliveryLog(
      String recipientEmail,
      String templateName,
      String referenceType,
      UUID referenceId,
      EmailDeliveryStatus status,
      String providerMessageId,
      String providerSlug,
      String errorMessage) {
    this.recipientEmail = recipientEmail;
    this.templateName = templateName;
    this.referenceType = referenceType;
    this.referenceId = referenceId;
    this.status = status;
    this.providerMessageId = providerMessageId;
    this.providerSlug = providerSlug;
    this.errorMessage = errorMessage;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getRecipientEmail() {
    return recipientEmail;
  }

  public String getTemplateName() {
    return templateName;
  }

  public String getReferenceType() {
    return referenceType;
  }

  public UUID getReferenceId() {
    return referenceId;
  }

  public EmailDeliveryStatus getStatus() {
    return status;
  }

  public String getProviderMessageId() {
    return providerMessageId;
  }

  public String getProviderSlug() {
    return providerSlug;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
