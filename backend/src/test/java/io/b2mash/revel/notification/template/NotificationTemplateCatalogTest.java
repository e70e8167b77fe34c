package io.b2mash.revel.notification.template;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.revel.notification.Notification;
import io.b2mash.revel.notification.NotificationType;
import io.b2mash.revel.recipient.Recipient;
import io.b2mash.revel.template.MarkdownRenderer;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.support.ResourceBundleMessageSource;

class NotificationTemplateCatalogTest {

  private static final UUID USER_ID = UUID.randomUUID();

  private TemplateRegistry registry;

  @BeforeEach
  void setUp() {
    var messageSource = new ResourceBundleMessageSource();
    messageSource.setBasename("notifications/messages");
    messageSource.setDefaultEncoding("UTF-8");
    messageSource.setFallbackToSystemLocale(false);
    var toolkit =
        new TemplateToolkit(
            new NotificationTextRenderer(messageSource),
            new EmailTemplateRenderer(),
            new MarkdownRenderer(),
            new IcsCalendarBuilder());
    registry = new TemplateRegistry();
    NotificationTemplateCatalog.standardTemplates(toolkit).forEach(registry::register);
  }

  @Test
  void everyTypeHasATemplate() {
    assertThat(registry.unregisteredTypes()).isEmpty();
  }

  @Test
  void everyTypeRendersAnInAppTitle() {
    for (NotificationType type : NotificationType.values()) {
      var context = context(type, Map.of());
      assertThat(registry.getTemplate(type).getInAppTitle(context)).as(type.name()).isNotBlank();
    }
  }

  @Test
  void ticketCreatedRendersAllChannels() {
    var variables = new LinkedHashMap<String, Object>();
    variables.put("event_id", "e-1");
    variables.put("event_name", "Summer Gala");
    variables.put("event_start", "2026-06-20T18:00:00Z");
    variables.put("event_start_formatted", "Saturday, June 20, 2026 at 6:00 PM UTC");
    variables.put("event_location", "Town Hall");
    variables.put("tier_name", "General");
    variables.put("quantity", 2);
    variables.put("recipient_name", "Ada");
    var context = context(NotificationType.TICKET_CREATED, variables);
    var template = registry.getTemplate(NotificationType.TICKET_CREATED);

    assertThat(template.getInAppTitle(context)).isEqualTo("Your ticket for Summer Gala");
    assertThat(template.getEmailSubject(context))
        .isEqualTo("Your ticket for Summer Gala is confirmed");
    assertThat(template.getInAppBody(context))
        .contains("**Summer Gala**")
        .contains("Saturday, June 20, 2026 at 6:00 PM UTC")
        .contains("General x 2");
    assertThat(template.getEmailTextBody(context))
        .startsWith("Hi Ada,")
        .contains("Your ticket for Summer Gala");
    assertThat(template.getEmailHtmlBody(context))
        .hasValueSatisfying(
            html -> assertThat(html).contains("<strong>Summer Gala</strong>").contains("Hi Ada,"));
    assertThat(template.getEmailAttachments(context)).containsOnlyKeys("event.ics");
    assertThat(template.getTelegramBody(context)).startsWith("**Your ticket for Summer Gala**");
  }

  @Test
  void subjectFallsBackToTitle() {
    var context = context(NotificationType.EVENT_CANCELLED, Map.of("event_name", "Picnic"));
    var template = registry.getTemplate(NotificationType.EVENT_CANCELLED);

    assertThat(template.getEmailSubject(context)).isEqualTo("Picnic was cancelled");
  }

  @Test
  void questionnaireTitleDependsOnOutcome() {
    var template = registry.getTemplate(NotificationType.QUESTIONNAIRE_EVALUATION_RESULT);

    var accepted =
        context(
            NotificationType.QUESTIONNAIRE_EVALUATION_RESULT,
            Map.of("questionnaire_name", "Intake", "evaluation_status", "ACCEPTED"));
    var unknown =
        context(
            NotificationType.QUESTIONNAIRE_EVALUATION_RESULT,
            Map.of("questionnaire_name", "Intake", "evaluation_status", "ESCALATED"));

    assertThat(template.getInAppTitle(accepted))
        .isEqualTo("Your submission for Intake was accepted");
    assertThat(template.getInAppTitle(unknown))
        .isEqualTo("Your submission for Intake was reviewed");
  }

  @Test
  void calendarAttachmentNeedsEventStart() {
    var context = context(NotificationType.RSVP_CONFIRMATION, Map.of("event_name", "Picnic"));

    var template = registry.getTemplate(NotificationType.RSVP_CONFIRMATION);

    assertThat(template.getEmailAttachments(context)).isEmpty();
  }

  private static RenderContext context(NotificationType type, Map<String, Object> variables) {
    var notification = new Notification(type, USER_ID, variables);
    var recipient = new Recipient(USER_ID, "ada@example.com", true, "Ada", "en", null, false);
    return new RenderContext(notification, recipient, Locale.ENGLISH, ZoneId.of("UTC"), variables);
  }
}
