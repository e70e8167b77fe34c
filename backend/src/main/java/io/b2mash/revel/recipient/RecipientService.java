package io.b2mash.revel.recipient;

import io.b2mash.revel.exception.ResourceNotFoundException;
import io.b2mash.revel.notification.preference.NotificationPreferenceService;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps the recipient projection in sync with the accounts module. Registering a new recipient
 * also creates its notification preferences, which is the only point where the guest preset is
 * applied.
 */
@Service
public class RecipientService {

  private static final Logger log = LoggerFactory.getLogger(RecipientService.class);

  private final RecipientRepository recipientRepository;
  private final NotificationPreferenceService preferenceService;

  public RecipientService(
      RecipientRepository recipientRepository, NotificationPreferenceService preferenceService) {
    this.recipientRepository = recipientRepository;
    this.preferenceService = preferenceService;
  }

  @Transactional
  public Recipient registerRecipient(RegisterRecipientCommand command) {
    var existing = recipientRepository.findById(command.userId());
    if (existing.isPresent()) {
      var recipient = existing.get();
      recipient.updateContact(command.email(), command.emailVerified(), command.displayName());
      recipient.updateLocalization(command.locale(), command.timeZone());
      return recipientRepository.save(recipient);
    }

    var recipient =
        recipientRepository.save(
            new Recipient(
                command.userId(),
                command.email(),
                command.emailVerified(),
                command.displayName(),
                command.locale(),
                command.timeZone(),
                command.guest()));
    preferenceService.createDefaults(recipient.getUserId(), recipient.isGuest());
    log.info("Registered recipient userId={} guest={}", recipient.getUserId(), recipient.isGuest());
    return recipient;
  }

  @Transactional(readOnly = true)
  public Recipient getRecipient(UUID userId) {
    return recipientRepository
        .findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("Recipient", userId));
  }

  public record RegisterRecipientCommand(
      UUID userId,
      String email,
      boolean emailVerified,
      String displayName,
      String locale,
      String timeZone,
      boolean guest) {}
}
