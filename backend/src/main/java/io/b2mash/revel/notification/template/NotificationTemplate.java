package io.b2mash.revel.notification.template;

import io.b2mash.revel.integration.email.EmailAttachment;
import io.b2mash.revel.notification.NotificationType;
import java.util.Map;
import java.util.Optional;

/**
 * Rendering strategy for one notification type across the in-app, email and Telegram channels.
 * Implementations are stateless and registered once in the {@link TemplateRegistry}.
 */
public interface NotificationTemplate {

  NotificationType type();

  String getInAppTitle(RenderContext context);

  /** Markdown body shown in the inbox. */
  String getInAppBody(RenderContext context);

  String getEmailSubject(RenderContext context);

  String getEmailTextBody(RenderContext context);

  /** HTML body; empty means the email is sent as plain text only. */
  default Optional<String> getEmailHtmlBody(RenderContext context) {
    return Optional.empty();
  }

  /** Attachments keyed by file name. */
  default Map<String, EmailAttachment> getEmailAttachments(RenderContext context) {
    return Map.of();
  }

  /** Markdown body for Telegram; converted and sanitized by the Telegram channel. */
  default String getTelegramBody(RenderContext context) {
    return "**" + getInAppTitle(context) + "**\n\n" + getInAppBody(context);
  }
}
