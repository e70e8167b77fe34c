package io.b2mash.revel.notification.template;

import io.b2mash.revel.template.MarkdownRenderer;

/** Rendering services shared by all notification templates. */
public record TemplateToolkit(
    NotificationTextRenderer text,
    EmailTemplateRenderer email,
    MarkdownRenderer markdown,
    IcsCalendarBuilder calendar) {}
