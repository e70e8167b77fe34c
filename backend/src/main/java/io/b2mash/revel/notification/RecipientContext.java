package io.b2mash.revel.notification;

import java.util.Map;
import java.util.UUID;

/** A user to notify together with the context their notification is rendered from. */
public record RecipientContext(UUID userId, Map<String, Object> context) {}
