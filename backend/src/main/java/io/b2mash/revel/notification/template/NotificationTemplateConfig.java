package io.b2mash.revel.notification.template;

import io.b2mash.revel.template.MarkdownRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NotificationTemplateConfig {

  private static final Logger log = LoggerFactory.getLogger(NotificationTemplateConfig.class);

  @Bean
  TemplateToolkit templateToolkit(
      NotificationTextRenderer textRenderer,
      EmailTemplateRenderer emailRenderer,
      MarkdownRenderer markdownRenderer,
      IcsCalendarBuilder calendarBuilder) {
    return new TemplateToolkit(textRenderer, emailRenderer, markdownRenderer, calendarBuilder);
  }

  @Bean
  TemplateRegistry templateRegistry(TemplateToolkit toolkit) {
    var registry = new TemplateRegistry();
    NotificationTemplateCatalog.standardTemplates(toolkit).forEach(registry::register);

    var missing = registry.unregisteredTypes();
    if (!missing.isEmpty()) {
      log.warn("No notification template registered for types={}", missing);
    }
    return registry;
  }
}
