package io.b2mash.revel.integration.email;

import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class EmailDeliveryLogService {

  private final EmailDeliveryLogRepository repository;

  public EmailDeliveryLogService(EmailDeliveryLogRepository repository) {
    this.repository = repository;
  }

  @Transactional
  public EmailDeliveryLog record(
      String referenceType,
      UUID referenceId,
      String templateName,
      String recipientEmail,
      String providerSlug,
      SendResult result) {
    var status = result.success() ? EmailDeliveryStatus.SENT : EmailDeliveryStatus.FAILED;
    var log =
        new EmailDeliveryLog(
            recipientEmail,
            templateName,
            referenceType,
            referenceId,
            status,
            result.providerMessageId(),
            providerSlug,
            result.errorMessage());
    return repository.save(log);
  }
}
