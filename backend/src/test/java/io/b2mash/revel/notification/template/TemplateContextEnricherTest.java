package io.b2mash.revel.notification.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.b2mash.revel.config.NotificationProperties;
import io.b2mash.revel.integration.email.UnsubscribeService;
import io.b2mash.revel.notification.Notification;
import io.b2mash.revel.notification.NotificationType;
import io.b2mash.revel.recipient.Recipient;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TemplateContextEnricherTest {

  private static final UUID USER_ID = UUID.randomUUID();

  private UnsubscribeService unsubscribeService;
  private TemplateContextEnricher enricher;

  @BeforeEach
  void setUp() {
    unsubscribeService = mock(UnsubscribeService.class);
    var properties =
        new NotificationProperties(
            "https://app.revel.test/", "https://api.revel.test", 0, null, null, null, null);
    enricher = new TemplateContextEnricher(properties, unsubscribeService);
  }

  @Test
  void formatsDatesInRecipientZone() {
    var recipient =
        new Recipient(USER_ID, "ada@example.com", true, "Ada", "en", "Europe/Berlin", false);
    var notification =
        new Notification(
            NotificationType.EVENT_REMINDER,
            USER_ID,
            Map.of("event_id", "e-1", "event_start", "2026-06-20T18:00:00Z"));

    var context = enricher.enrich(notification, recipient);

    assertThat(context.zone()).isEqualTo(ZoneId.of("Europe/Berlin"));
    assertThat(context.locale()).isEqualTo(Locale.ENGLISH);
    assertThat(context.string("event_start_formatted"))
        .startsWith("Saturday, June 20, 2026 at 8:00");
    assertThat(context.string("event_start_short")).startsWith("Jun 20, 2026 at 8:00");
  }

  @Test
  void keepsCallerSuppliedFormattedValue() {
    var notification =
        new Notification(
            NotificationType.EVENT_REMINDER,
            USER_ID,
            Map.of(
                "event_start", "2026-06-20T18:00:00Z",
                "event_start_formatted", "tomorrow evening"));

    var context = enricher.enrich(notification, null);

    assertThat(context.string("event_start_formatted")).isEqualTo("tomorrow evening");
    assertThat(context.variables()).doesNotContainKey("event_start_short");
  }

  @Test
  void addsDeepLinksWithoutTrailingSlash() {
    var notification =
        new Notification(
            NotificationType.MEMBERSHIP_GRANTED,
            USER_ID,
            Map.of("event_id", "e-1", "organization_id", "o-9"));

    var context = enricher.enrich(notification, null);

    assertThat(context.variables())
        .containsEntry("frontend_url", "https://app.revel.test")
        .containsEntry("event_url", "https://app.revel.test/events/e-1")
        .containsEntry("organization_url", "https://app.revel.test/org/o-9")
        .containsEntry("preferences_url", "https://app.revel.test/account/notifications")
        .containsEntry("notification_type", "MEMBERSHIP_GRANTED")
        .doesNotContainKey("recipient");
  }

  @Test
  void callerSuppliedUrlsWin() {
    var notification =
        new Notification(
            NotificationType.EVENT_OPEN,
            USER_ID,
            Map.of("event_id", "e-1", "event_url", "https://custom.test/e-1"));

    var context = enricher.enrich(notification, null);

    assertThat(context.string("event_url")).isEqualTo("https://custom.test/e-1");
  }

  @Test
  void addsRecipientAndSignedUnsubscribeLinks() {
    when(unsubscribeService.isConfigured()).thenReturn(true);
    when(unsubscribeService.generateToken(USER_ID)).thenReturn("tok");
    var recipient = new Recipient(USER_ID, "grace@example.com", true, null, "de", null, false);
    var notification = new Notification(NotificationType.TICKET_CREATED, USER_ID, Map.of());

    var context = enricher.enrich(notification, recipient);

    assertThat(context.locale()).isEqualTo(Locale.GERMAN);
    assertThat(context.zone()).isEqualTo(ZoneId.of("UTC"));
    assertThat(context.variables())
        .containsEntry("recipient_name", "grace")
        .containsEntry("unsubscribe_link", "https://app.revel.test/unsubscribe?token=tok")
        .containsEntry(
            "one_click_unsubscribe_url",
            "https://api.revel.test/api/notifications/unsubscribe?token=tok");
    assertThat(context.variables().get("recipient"))
        .isEqualTo(Map.of("name", "grace", "email", "grace@example.com"));
  }

  @Test
  void skipsUnsubscribeLinksWithoutSecret() {
    when(unsubscribeService.isConfigured()).thenReturn(false);
    var recipient = new Recipient(USER_ID, "ada@example.com", true, "Ada", "en", null, false);

    var context =
        enricher.enrich(
            new Notification(NotificationType.TICKET_CREATED, USER_ID, Map.of()), recipient);

    assertThat(context.variables())
        .doesNotContainKey("unsubscribe_link")
        .doesNotContainKey("one_click_unsubscribe_url");
  }
}
