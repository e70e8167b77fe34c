package io.b2mash.revel.notification.preference;

import io.b2mash.revel.notification.NotificationType;
import io.b2mash.revel.notification.delivery.DeliveryChannel;
import java.time.LocalTime;
import java.util.Map;
import java.util.Set;

/** Partial preference change. Null fields are left untouched. */
public record PreferenceUpdate(
    Boolean silenceAll,
    Set<DeliveryChannel> enabledChannels,
    DigestFrequency digestFrequency,
    LocalTime digestSendTime,
    Map<NotificationType, NotificationTypeSetting> typeSettings) {}
