package io.b2mash.revel.integration.email;

import io.b2mash.revel.config.NotificationProperties;
import io.b2mash.revel.exception.InvalidStateException;
import io.b2mash.revel.notification.delivery.DeliveryChannel;
import io.b2mash.revel.notification.preference.NotificationPreferenceService;
import io.b2mash.revel.notification.preference.PreferenceUpdate;
import io.b2mash.revel.notification.preference.PreferenceView;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

/**
 * Issues and verifies signed, user-scoped unsubscribe tokens. A token is {@code
 * base64url(userId:expiresEpochSeconds) ":" base64url(hmacSha256(payload))}.
 */
@Service
public class UnsubscribeService {

  private static final Logger log = LoggerFactory.getLogger(UnsubscribeService.class);
  private static final String HMAC_ALGORITHM = "HmacSHA256";

  private final NotificationProperties.Unsubscribe settings;
  private final NotificationPreferenceService preferenceService;
  private final Clock clock;

  public UnsubscribeService(
      NotificationProperties properties,
      NotificationPreferenceService preferenceService,
      Clock clock) {
    this.settings = properties.unsubscribe();
    this.preferenceService = preferenceService;
    this.clock = clock;
  }

  public boolean isConfigured() {
    return !settings.secret().isBlank();
  }

  public String generateToken(UUID userId) {
    validateSecretConfigured();
    var encoder = Base64.getUrlEncoder().withoutPadding();
    long expiresAt = clock.instant().plus(settings.tokenLifetime()).getEpochSecond();
    byte[] payloadBytes = (userId + ":" + expiresAt).getBytes(StandardCharsets.UTF_8);
    byte[] hmac = computeHmac(payloadBytes);
    return encoder.encodeToString(payloadBytes) + ":" + encoder.encodeToString(hmac);
  }

  public UnsubscribePayload verifyToken(String token) {
    validateSecretConfigured();
    if (token == null || token.isBlank()) {
      throw new InvalidStateException("Invalid Token", "Missing unsubscribe token");
    }
    var decoder = Base64.getUrlDecoder();

    int separatorIndex = token.lastIndexOf(':');
    if (separatorIndex < 0) {
      throw new InvalidStateException("Invalid Token", "Malformed unsubscribe token");
    }

    byte[] payloadBytes;
    byte[] providedHmac;
    try {
      payloadBytes = decoder.decode(token.substring(0, separatorIndex));
      providedHmac = decoder.decode(token.substring(separatorIndex + 1));
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException("Invalid Token", "Malformed unsubscribe token");
    }

    if (!MessageDigest.isEqual(computeHmac(payloadBytes), providedHmac)) {
      throw new InvalidStateException("Invalid Token", "Invalid unsubscribe token");
    }

    String[] parts = new String(payloadBytes, StandardCharsets.UTF_8).split(":", 2);
    if (parts.length != 2) {
      throw new InvalidStateException("Invalid Token", "Malformed unsubscribe token payload");
    }

    UnsubscribePayload payload;
    try {
      payload =
          new UnsubscribePayload(
              UUID.fromString(parts[0]), Instant.ofEpochSecond(Long.parseLong(parts[1])));
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException("Invalid Token", "Malformed unsubscribe token payload");
    }

    if (!clock.instant().isBefore(payload.expiresAt())) {
      throw new InvalidStateException("Invalid Token", "Unsubscribe link has expired");
    }
    return payload;
  }

  /** One-click unsubscribe: turns email off for the token's user and returns a confirmation. */
  public String processUnsubscribe(String token) {
    var payload = verifyToken(token);
    preferenceService.disableChannel(payload.userId(), DeliveryChannel.EMAIL);
    log.info("Unsubscribed userId={} from email notifications", payload.userId());
    return buildConfirmationHtml("email notifications");
  }

  /**
   * Applies an explicit preference change authorised by the token. Without an update, email is
   * turned off as in the one-click flow.
   */
  public PreferenceView confirmUnsubscribe(String token, PreferenceUpdate update) {
    var payload = verifyToken(token);
    if (update == null) {
      preferenceService.disableChannel(payload.userId(), DeliveryChannel.EMAIL);
      return preferenceService.getPreferences(payload.userId());
    }
    var view = preferenceService.updatePreferences(payload.userId(), update);
    log.info("Updated preferences via unsubscribe link for userId={}", payload.userId());
    return view;
  }

  private byte[] computeHmac(byte[] data) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      var key = settings.secret().getBytes(StandardCharsets.UTF_8);
      mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
      return mac.doFinal(data);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to compute unsubscribe token HMAC", e);
    }
  }

  private void validateSecretConfigured() {
    if (!isConfigured()) {
      log.warn("Unsubscribe secret is not configured (revel.notifications.unsubscribe.secret)");
      throw new InvalidStateException(
          "Not Configured", "Unsubscribe functionality is not configured");
    }
  }

  private String buildConfirmationHtml(String what) {
    return """
        <!DOCTYPE html>
        <html>
        <head>
          <meta charset="UTF-8">
          <title>Unsubscribed</title>
          <style>
            body { font-family: sans-serif; max-width: 600px; margin: 80px auto; text-align: center; color: #333; }
            h1 { font-size: 1.5rem; margin-bottom: 1rem; }
            p  { color: #666; }
          </style>
        </head>
        <body>
          <h1>You have been unsubscribed</h1>
          <p>You will no longer receive <strong>%s</strong>.</p>
          <p>You can turn them back on at any time in your notification settings.</p>
        </body>
        </html>
        """
        .formatted(HtmlUtils.htmlEscape(what));
  }
}
