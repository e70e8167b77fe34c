package io.b2mash.revel.notification.template;

import io.b2mash.revel.template.LenientStandardDialect;
import java.util.Locale;
import java.util.Map;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Renders plain-text and markdown notification resources from {@code templates/notifications/}
 * and resolves localized titles and subjects from the {@code notifications/messages} bundle.
 */
@Component
public class NotificationTextRenderer {

  private final TemplateEngine textEngine;
  private final MessageSource messageSource;

  public NotificationTextRenderer(MessageSource messageSource) {
    this.messageSource = messageSource;
    this.textEngine = createTextEngine();
  }

  /**
   * @param templateName path below {@code templates/notifications/}, e.g. {@code
   *     in-app/ticket_created.md}
   */
  public String render(String templateName, Map<String, Object> variables, Locale locale) {
    var ctx = new Context(locale);
    variables.forEach(ctx::setVariable);
    return textEngine.process(templateName, ctx).strip();
  }

  public String message(String code, Object[] args, Locale locale) {
    return messageSource.getMessage(code, args, locale);
  }

  public String message(String code, Object[] args, String defaultMessage, Locale locale) {
    return messageSource.getMessage(code, args, defaultMessage, locale);
  }

  private static TemplateEngine createTextEngine() {
    var engine = new TemplateEngine();
    engine.setDialect(new LenientStandardDialect());

    var resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/notifications/");
    resolver.setTemplateMode(TemplateMode.TEXT);
    resolver.setCharacterEncoding("UTF-8");
    resolver.setCacheable(true);

    engine.setTemplateResolver(resolver);
    return engine;
  }
}
