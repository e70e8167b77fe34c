package io.b2mash.revel.integration.email;

import java.time.Instant;
import java.util.UUID;

public record UnsubscribePayload(UUID userId, Instant expiresAt) {}
