package io.b2mash.revel.notification;

import java.util.Map;
import java.util.UUID;

/** One entry of a bulk creation. */
public record NotificationRequest(
    NotificationType type, UUID userId, Map<String, Object> context) {}
