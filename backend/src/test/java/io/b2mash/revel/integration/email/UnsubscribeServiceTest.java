package io.b2mash.revel.integration.email;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.revel.config.NotificationProperties;
import io.b2mash.revel.exception.InvalidStateException;
import io.b2mash.revel.notification.delivery.DeliveryChannel;
import io.b2mash.revel.notification.preference.DigestFrequency;
import io.b2mash.revel.notification.preference.NotificationPreferenceService;
import io.b2mash.revel.notification.preference.PreferenceUpdate;
import io.b2mash.revel.notification.preference.PreferenceView;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UnsubscribeServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");
  private static final UUID USER_ID = UUID.fromString("7b0c7c1e-3f4a-4d8e-9a57-2f4f6b1d2c11");

  private NotificationPreferenceService preferenceService;
  private UnsubscribeService service;

  @BeforeEach
  void setUp() {
    preferenceService = mock(NotificationPreferenceService.class);
    service = serviceAt(NOW, "test-secret");
  }

  @Test
  void generateToken_has_payload_and_signature() {
    String token = service.generateToken(USER_ID);

    int separator = token.lastIndexOf(':');
    assertThat(separator).isPositive();
    String payload =
        new String(
            Base64.getUrlDecoder().decode(token.substring(0, separator)), StandardCharsets.UTF_8);
    long expectedExpiry = NOW.plus(Duration.ofDays(30)).getEpochSecond();
    assertThat(payload).isEqualTo(USER_ID + ":" + expectedExpiry);
  }

  @Test
  void verifyToken_round_trips_user_and_expiry() {
    var payload = service.verifyToken(service.generateToken(USER_ID));

    assertThat(payload.userId()).isEqualTo(USER_ID);
    assertThat(payload.expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
  }

  @Test
  void verifyToken_rejects_tampered_signature() {
    String token = service.generateToken(USER_ID);
    String tampered = token.substring(0, token.length() - 2) + "xx";

    assertThatThrownBy(() -> service.verifyToken(tampered))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void verifyToken_rejects_token_signed_with_other_secret() {
    String foreign = serviceAt(NOW, "another-secret").generateToken(USER_ID);

    assertThatThrownBy(() -> service.verifyToken(foreign))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void verifyToken_rejects_missing_separator_and_blank() {
    assertThatThrownBy(() -> service.verifyToken("no-separator-here"))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> service.verifyToken(" "))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> service.verifyToken(null))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void verifyToken_rejects_expired_token() {
    String token = service.generateToken(USER_ID);
    var later = serviceAt(NOW.plus(Duration.ofDays(31)), "test-secret");

    assertThatThrownBy(() -> later.verifyToken(token))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            ex -> assertThat(ex.getBody().getDetail()).isEqualTo("Unsubscribe link has expired"));
  }

  @Test
  void processUnsubscribe_disables_email_channel() {
    String html = service.processUnsubscribe(service.generateToken(USER_ID));

    verify(preferenceService).disableChannel(USER_ID, DeliveryChannel.EMAIL);
    assertThat(html).contains("You have been unsubscribed").contains("email notifications");
  }

  @Test
  void processUnsubscribe_with_bad_token_changes_nothing() {
    assertThatThrownBy(() -> service.processUnsubscribe("bogus:token"))
        .isInstanceOf(InvalidStateException.class);

    verifyNoInteractions(preferenceService);
  }

  @Test
  void confirmUnsubscribe_without_update_disables_email() {
    var view = emptyView();
    when(preferenceService.getPreferences(USER_ID)).thenReturn(view);

    var result = service.confirmUnsubscribe(service.generateToken(USER_ID), null);

    assertThat(result).isSameAs(view);
    verify(preferenceService).disableChannel(USER_ID, DeliveryChannel.EMAIL);
  }

  @Test
  void confirmUnsubscribe_applies_update() {
    var update =
        new PreferenceUpdate(null, null, DigestFrequency.WEEKLY, LocalTime.of(7, 0), Map.of());
    var view = emptyView();
    when(preferenceService.updatePreferences(USER_ID, update)).thenReturn(view);

    var result = service.confirmUnsubscribe(service.generateToken(USER_ID), update);

    assertThat(result).isSameAs(view);
    verify(preferenceService, never()).disableChannel(USER_ID, DeliveryChannel.EMAIL);
  }

  @Test
  void unconfigured_secret_rejects_generation() {
    var unconfigured = serviceAt(NOW, "");

    assertThat(unconfigured.isConfigured()).isFalse();
    assertThatThrownBy(() -> unconfigured.generateToken(USER_ID))
        .isInstanceOf(InvalidStateException.class);
  }

  private UnsubscribeService serviceAt(Instant now, String secret) {
    var properties =
        new NotificationProperties(
            null, null, 0, null, null, new NotificationProperties.Unsubscribe(secret, null), null);
    return new UnsubscribeService(
        properties, preferenceService, Clock.fixed(now, ZoneOffset.UTC));
  }

  private static PreferenceView emptyView() {
    return new PreferenceView(
        USER_ID, false, Set.of(), DigestFrequency.IMMEDIATE, LocalTime.of(9, 0), Map.of());
  }
}
