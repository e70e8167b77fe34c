package io.b2mash.revel.notification.template;

import io.b2mash.revel.notification.NotificationType;
import java.util.Locale;
import java.util.Optional;

/**
 * Base template driven by conventions: titles and subjects come from the message bundle under
 * {@code notification.<type>.title|subject}, the in-app body from {@code
 * templates/notifications/in-app/<type>.md}. Email bodies reuse the in-app body.
 */
public abstract class AbstractNotificationTemplate implements NotificationTemplate {

  private final NotificationType type;
  protected final TemplateToolkit toolkit;
  private final String resourceName;

  protected AbstractNotificationTemplate(NotificationType type, TemplateToolkit toolkit) {
    this.type = type;
    this.toolkit = toolkit;
    this.resourceName = type.name().toLowerCase(Locale.ROOT);
  }

  @Override
  public NotificationType type() {
    return type;
  }

  /** Positional arguments for the title and subject messages. */
  protected abstract Object[] titleArguments(RenderContext context);

  protected String titleKey(RenderContext context) {
    return messageKey("title");
  }

  protected final String messageKey(String suffix) {
    return "notification." + resourceName + "." + suffix;
  }

  @Override
  public String getInAppTitle(RenderContext context) {
    return toolkit.text().message(titleKey(context), titleArguments(context), context.locale());
  }

  @Override
  public String getInAppBody(RenderContext context) {
    return toolkit
        .text()
        .render("in-app/" + resourceName + ".md", context.variables(), context.locale());
  }

  @Override
  public String getEmailSubject(RenderContext context) {
    String title = getInAppTitle(context);
    return toolkit
        .text()
        .message(messageKey("subject"), titleArguments(context), title, context.locale());
  }

  @Override
  public String getEmailTextBody(RenderContext context) {
    var emailContext =
        context.with("title", getInAppTitle(context)).with("body", getInAppBody(context));
    return toolkit
        .text()
        .render("email/notification.txt", emailContext.variables(), context.locale());
  }

  @Override
  public Optional<String> getEmailHtmlBody(RenderContext context) {
    String contentHtml = toolkit.markdown().toHtml(getInAppBody(context));
    var layoutContext =
        context.with("subject", getEmailSubject(context)).with("title", getInAppTitle(context));
    return Optional.of(
        toolkit.email().renderLayout(contentHtml, layoutContext.variables(), context.locale()));
  }
}
