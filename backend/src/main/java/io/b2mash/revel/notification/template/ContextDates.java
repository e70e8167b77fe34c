package io.b2mash.revel.notification.template;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Reads date values out of notification contexts, where they arrive as ISO-8601 strings. Values
 * without an offset are taken as UTC.
 */
final class ContextDates {

  private ContextDates() {}

  static Optional<Instant> parse(Object value) {
    if (value instanceof Instant instant) {
      return Optional.of(instant);
    }
    if (value instanceof OffsetDateTime offsetDateTime) {
      return Optional.of(offsetDateTime.toInstant());
    }
    if (value instanceof ZonedDateTime zonedDateTime) {
      return Optional.of(zonedDateTime.toInstant());
    }
    if (!(value instanceof CharSequence text) || text.toString().isBlank()) {
      return Optional.empty();
    }
    try {
      var parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              text.toString().trim(), ZonedDateTime::from, LocalDateTime::from);
      if (parsed instanceof ZonedDateTime zoned) {
        return Optional.of(zoned.toInstant());
      }
      return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
