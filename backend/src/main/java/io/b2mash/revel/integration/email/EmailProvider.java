package io.b2mash.revel.integration.email;

/** Port for sending emails through an external transport. */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "noop"). */
  String providerId();

  /** Sends a message with its attachments. Never throws for transport failures. */
  SendResult sendEmail(EmailMessage message);
}
