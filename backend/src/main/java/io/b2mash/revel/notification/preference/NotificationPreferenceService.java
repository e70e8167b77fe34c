package io.b2mash.revel.notification.preference;

import io.b2mash.revel.notification.NotificationType;
import io.b2mash.revel.notification.delivery.DeliveryChannel;
import io.b2mash.revel.recipient.Recipient;
import io.b2mash.revel.recipient.RecipientRepository;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Resolves which channels a user accepts, creating default preferences on first use. */
@Service
public class NotificationPreferenceService {

  private static final Logger log = LoggerFactory.getLogger(NotificationPreferenceService.class);

  public static final List<DeliveryChannel> DEFAULT_CHANNELS =
      List.of(DeliveryChannel.IN_APP, DeliveryChannel.EMAIL);

  private final NotificationPreferenceRepository preferenceRepository;
  private final RecipientRepository recipientRepository;

  public NotificationPreferenceService(
      NotificationPreferenceRepository preferenceRepository,
      RecipientRepository recipientRepository) {
    this.preferenceRepository = preferenceRepository;
    this.recipientRepository = recipientRepository;
  }

  @Transactional
  public NotificationPreference getOrCreate(UUID userId) {
    return preferenceRepository
        .findByUserId(userId)
        .orElseGet(
            () -> {
              boolean guest =
                  recipientRepository.findById(userId).map(Recipient::isGuest).orElse(false);
              return createDefaults(userId, guest);
            });
  }

  /**
   * Creates the initial preferences for a user. Guests get {@link GuestPreferencePreset} baked
   * into their per-type overrides. Existing preferences are returned unchanged.
   */
  @Transactional
  public NotificationPreference createDefaults(UUID userId, boolean guest) {
    var existing = preferenceRepository.findByUserId(userId);
    if (existing.isPresent()) {
      return existing.get();
    }
    var preference = new NotificationPreference(userId, DEFAULT_CHANNELS);
    if (guest) {
      GuestPreferencePreset.applyTo(preference);
    }
    log.info("Created notification preferences for userId={} guest={}", userId, guest);
    return preferenceRepository.save(preference);
  }

  @Transactional
  public boolean isChannelEnabled(UUID userId, DeliveryChannel channel) {
    return getOrCreate(userId).isChannelEnabled(channel);
  }

  @Transactional
  public boolean isNotificationTypeEnabled(UUID userId, NotificationType type) {
    return getOrCreate(userId).isNotificationTypeEnabled(type);
  }

  @Transactional
  public Set<DeliveryChannel> getChannelsForNotificationType(UUID userId, NotificationType type) {
    return getOrCreate(userId).getChannelsForNotificationType(type);
  }

  @Transactional
  public PreferenceView getPreferences(UUID userId) {
    return PreferenceView.from(getOrCreate(userId));
  }

  @Transactional
  public PreferenceView updatePreferences(UUID userId, PreferenceUpdate update) {
    var preference = getOrCreate(userId);
    if (update.silenceAll() != null) {
      preference.setSilenceAll(update.silenceAll());
    }
    if (update.enabledChannels() != null) {
      preference.setEnabledChannels(update.enabledChannels());
    }
    if (update.digestFrequency() != null) {
      preference.setDigestFrequency(update.digestFrequency());
    }
    if (update.digestSendTime() != null) {
      preference.setDigestSendTime(update.digestSendTime());
    }
    if (update.typeSettings() != null) {
      update.typeSettings().forEach(preference::putTypeSetting);
    }
    var saved = preferenceRepository.save(preference);
    log.info("Updated notification preferences for userId={}", userId);
    return PreferenceView.from(saved);
  }

  @Transactional
  public void disableChannel(UUID userId, DeliveryChannel channel) {
    var preference = getOrCreate(userId);
    preference.disableChannel(channel);
    preferenceRepository.save(preference);
  }

  @Transactional(readOnly = true)
  public List<NotificationPreference> findDigestSubscribers() {
    return preferenceRepository.findByDigestFrequencyNot(DigestFrequency.IMMEDIATE);
  }
}
