package io.b2mash.revel.integration.email;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Provider-agnostic email payload: recipient, subject, HTML and plain-text bodies, attachments,
 * and string metadata. Metadata keys {@code List-Unsubscribe} and {@code List-Unsubscribe-Post}
 * are written as headers.
 */
public record EmailMessage(
    String to,
    String subject,
    String htmlBody,
    String plainTextBody,
    String replyTo,
    List<EmailAttachment> attachments,
    Map<String, String> metadata) {

  /** Requires a recipient and a subject. */
  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    attachments = attachments != null ? List.copyOf(attachments) : List.of();
    metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
  }

  /**
   * Builds a message carrying tracking metadata and, when an unsubscribe URL is given, one-click
   * unsubscribe headers (RFC 8058).
   */
  public static EmailMessage forNotification(
      String to,
      String subject,
      String htmlBody,
      String plainTextBody,
      List<EmailAttachment> attachments,
      String referenceType,
      String referenceId,
      String oneClickUnsubscribeUrl) {
    Objects.requireNonNull(referenceType, "referenceType");
    Objects.requireNonNull(referenceId, "referenceId");
    var metadata = new LinkedHashMap<String, String>();
    metadata.put("referenceType", referenceType);
    metadata.put("referenceId", referenceId);
    if (oneClickUnsubscribeUrl != null) {
      metadata.put("List-Unsubscribe", "<" + oneClickUnsubscribeUrl + ">");
      metadata.put("List-Unsubscribe-Post", "List-Unsubscribe=One-Click");
    }
    return new EmailMessage(to, subject, htmlBody, plainTextBody, null, attachments, metadata);
  }
}
