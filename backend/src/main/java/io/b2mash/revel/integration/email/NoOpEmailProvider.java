package io.b2mash.revel.integration.email;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

/**
 * No-op email provider used as a fallback when no SMTP configuration is present. Logs email details
 * instead of sending them.
 */
@Component
@ConditionalOnMissingBean(SmtpEmailProvider.class)
public class NoOpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpEmailProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    log.info(
        "NoOp email: would send to {} with subject '{}' and {} attachment(s)",
        message.to(),
        message.subject(),
        message.attachments().size());
    return SendResult.sent("NOOP-" + UUID.randomUUID());
  }
}
