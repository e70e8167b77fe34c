package io.b2mash.revel.notification.template;

import io.b2mash.revel.integration.email.EmailAttachment;
import io.b2mash.revel.notification.NotificationType;
import java.util.Map;

/** Adds an {@code event.ics} attachment to the email when the event start is known. */
public class CalendarNotificationTemplate extends StandardNotificationTemplate {

  public CalendarNotificationTemplate(
      NotificationType type, TemplateToolkit toolkit, String... titleArgumentKeys) {
    super(type, toolkit, titleArgumentKeys);
  }

  @Override
  public Map<String, EmailAttachment> getEmailAttachments(RenderContext context) {
    return toolkit
        .calendar()
        .build(context)
        .map(attachment -> Map.of(attachment.filename(), attachment))
        .orElse(Map.of());
  }
}
