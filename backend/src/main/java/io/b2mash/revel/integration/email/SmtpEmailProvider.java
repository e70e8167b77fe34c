package io.b2mash.revel.integration.email;

import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * SMTP-based email provider that sends emails via {@link JavaMailSender}. Only active when {@code
 * spring.mail.host} is configured.
 */
@Component
@ConditionalOnProperty(name = "spring.mail.host")
public class SmtpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SmtpEmailProvider.class);

  private final JavaMailSender mailSender;
  private final String senderAddress;

  public SmtpEmailProvider(
      JavaMailSender mailSender,
      @Value("${revel.email.sender-address:notifications@revel.local}") String senderAddress) {
    this.mailSender = mailSender;
    this.senderAddress = senderAddress;
  }

  @Override
  public String providerId() {
    return "smtp";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    try {
      MimeMessage mimeMessage = mailSender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
      populateMessage(helper, message);
      for (var attachment : message.attachments()) {
        helper.addAttachment(
            attachment.filename(),
            new ByteArrayResource(attachment.content()),
            attachment.contentType());
      }
      mailSender.send(mimeMessage);
      String messageId = mimeMessage.getMessageID();
      log.debug("SMTP email sent to {} with Message-ID: {}", message.to(), messageId);
      return SendResult.sent(messageId);
    } catch (MailException | MessagingException e) {
      boolean retryable = isRetryable(e);
      log.error(
          "Failed to send SMTP email to {} (retryable={}): {}",
          message.to(),
          retryable,
          e.getMessage());
      return retryable
          ? SendResult.transientFailure(e.getMessage())
          : SendResult.permanentFailure(e.getMessage());
    }
  }

  /**
   * Rejected recipient addresses and malformed messages are permanent; connection, timeout and
   * authentication problems are worth another attempt.
   */
  static boolean isRetryable(Exception e) {
    if (e instanceof MailParseException || e instanceof MailPreparationException) {
      return false;
    }
    Throwable cause = e;
    while (cause != null) {
      if (cause instanceof SendFailedException sendFailed) {
        var invalid = sendFailed.getInvalidAddresses();
        if (invalid != null && invalid.length > 0) {
          return false;
        }
      }
      cause = cause.getCause();
    }
    return true;
  }

  private void populateMessage(MimeMessageHelper helper, EmailMessage message)
      throws MessagingException {
    if (message.htmlBody() == null && message.plainTextBody() == null) {
      throw new IllegalArgumentException(
          "Email must have at least one of htmlBody or plainTextBody");
    }
    helper.setFrom(senderAddress);
    helper.setTo(message.to());
    helper.setSubject(message.subject());
    if (message.htmlBody() != null && message.plainTextBody() != null) {
      helper.setText(message.plainTextBody(), message.htmlBody());
    } else if (message.htmlBody() != null) {
      helper.setText(message.htmlBody(), true);
    } else {
      helper.setText(message.plainTextBody(), false);
    }
    if (message.replyTo() != null) {
      helper.setReplyTo(message.replyTo());
    }

    // List-Unsubscribe headers from message metadata (RFC 8058)
    MimeMessage mimeMessage = helper.getMimeMessage();
    String listUnsubscribe = message.metadata().get("List-Unsubscribe");
    if (listUnsubscribe != null) {
      mimeMessage.setHeader("List-Unsubscribe", listUnsubscribe);
    }
    String listUnsubscribePost = message.metadata().get("List-Unsubscribe-Post");
    if (listUnsubscribePost != null) {
      mimeMessage.setHeader("List-Unsubscribe-Post", listUnsubscribePost);
    }
  }
}
