package io.b2mash.revel.notification.channel;

import java.util.UUID;

/** Published once a notification is visible in the user's inbox. */
public record InAppNotificationDeliveredEvent(UUID notificationId, UUID userId) {}
