package io.b2mash.revel.notification.preference;

import io.b2mash.revel.notification.NotificationType;
import io.b2mash.revel.notification.delivery.DeliveryChannel;
import java.time.LocalTime;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

public record PreferenceView(
    UUID userId,
    boolean silenceAll,
    Set<DeliveryChannel> enabledChannels,
    DigestFrequency digestFrequency,
    LocalTime digestSendTime,
    Map<NotificationType, NotificationTypeSetting> typeSettings) {

  public static PreferenceView from(NotificationPreference preference) {
    return new PreferenceView(
        preference.getUserId(),
        preference.isSilenceAll(),
        Set.copyOf(preference.getEnabledChannels()),
        preference.getDigestFrequency(),
        preference.getDigestSendTime(),
        Map.copyOf(preference.getTypeSettings()));
  }
}
