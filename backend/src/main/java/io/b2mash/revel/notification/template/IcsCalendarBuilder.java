package io.b2mash.revel.notification.template;

import io.b2mash.revel.integration.email.EmailAttachment;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Builds an iCalendar (RFC 5545) attachment for the event referenced by a notification. */
@Component
public class IcsCalendarBuilder {

  static final String FILE_NAME = "event.ics";
  static final String CONTENT_TYPE = "text/calendar; charset=UTF-8; method=PUBLISH";

  private static final Duration DEFAULT_EVENT_LENGTH = Duration.ofHours(2);
  private static final DateTimeFormatter ICS_UTC =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

  /** Empty when the context has no parseable {@code event_start}. */
  public Optional<EmailAttachment> build(RenderContext context) {
    var start = ContextDates.parse(context.variables().get("event_start"));
    if (start.isEmpty()) {
      return Optional.empty();
    }
    Instant end =
        ContextDates.parse(context.variables().get("event_end"))
            .filter(candidate -> candidate.isAfter(start.get()))
            .orElse(start.get().plus(DEFAULT_EVENT_LENGTH));

    var lines = new ArrayList<String>();
    lines.add("BEGIN:VCALENDAR");
    lines.add("VERSION:2.0");
    lines.add("PRODID:-//Revel//Notifications//EN");
    lines.add("CALSCALE:GREGORIAN");
    lines.add("METHOD:PUBLISH");
    lines.add("BEGIN:VEVENT");
    lines.add("UID:" + context.string("event_id") + "@revel");
    lines.add("DTSTAMP:" + ICS_UTC.format(context.notification().getCreatedAt()));
    lines.add("DTSTART:" + ICS_UTC.format(start.get()));
    lines.add("DTEND:" + ICS_UTC.format(end));
    lines.add("SUMMARY:" + escape(context.string("event_name")));
    if (!context.string("event_location").isEmpty()) {
      lines.add("LOCATION:" + escape(context.string("event_location")));
    }
    if (!context.string("event_url").isEmpty()) {
      lines.add("URL:" + context.string("event_url"));
    }
    lines.add("END:VEVENT");
    lines.add("END:VCALENDAR");

    byte[] content = (String.join("\r\n", lines) + "\r\n").getBytes(StandardCharsets.UTF_8);
    return Optional.of(new EmailAttachment(FILE_NAME, content, CONTENT_TYPE));
  }

  static String escape(String text) {
    return text.replace("\\", "\\\\")
        .replace(";", "\\;")
        .replace(",", "\\,")
        .replace("\r\n", "\\n")
        .replace("\n", "\\n");
  }
}
