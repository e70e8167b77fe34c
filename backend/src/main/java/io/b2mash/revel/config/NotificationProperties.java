package io.b2mash.revel.config;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for notification delivery, bound from {@code revel.notifications.*}. Missing
 * values fall back to the defaults below.
 *
 * @param frontendBaseUrl base URL of the web app, used for deep links and the unsubscribe page
 * @param apiBaseUrl public base URL of this service, used for one-click unsubscribe headers
 * @param retentionDays notifications older than this many days are purged
 * @param delivery retry policy for channel deliveries
 * @param digest digest scheduling settings
 * @param unsubscribe signing settings for unsubscribe tokens
 * @param telegram Telegram Bot API settings
 */
@ConfigurationProperties(prefix = "revel.notifications")
public record NotificationProperties(
    String frontendBaseUrl,
    String apiBaseUrl,
    int retentionDays,
    Delivery delivery,
    Digest digest,
    Unsubscribe unsubscribe,
    Telegram telegram) {

  public NotificationProperties {
    frontendBaseUrl = stripTrailingSlash(frontendBaseUrl, "http://localhost:3000");
    apiBaseUrl = stripTrailingSlash(apiBaseUrl, "http://localhost:8080");
    retentionDays = retentionDays > 0 ? retentionDays : 90;
    delivery = delivery != null ? delivery : new Delivery(0, null, null, null);
    digest = digest != null ? digest : new Digest(null, null, null);
    unsubscribe = unsubscribe != null ? unsubscribe : new Unsubscribe(null, null);
    telegram = telegram != null ? telegram : new Telegram(null, null, 0);
  }

  /**
   * @param maxAttempts total attempts per delivery record before it stays FAILED
   * @param baseBackoff backoff unit; attempt n waits {@code baseBackoff * 2^n}
   * @param retrySweepWindow how far back the periodic sweep looks for failed records
   * @param retrySweepMinIdle how long a failed record must sit untouched before the sweep takes
   *     it; must exceed the longest scheduled retry delay
   */
  public record Delivery(
      int maxAttempts,
      Duration baseBackoff,
      Duration retrySweepWindow,
      Duration retrySweepMinIdle) {

    public Delivery {
      maxAttempts = maxAttempts > 0 ? maxAttempts : 3;
      baseBackoff = baseBackoff != null ? baseBackoff : Duration.ofMinutes(1);
      retrySweepWindow = retrySweepWindow != null ? retrySweepWindow : Duration.ofHours(24);
      retrySweepMinIdle = retrySweepMinIdle != null ? retrySweepMinIdle : Duration.ofHours(2);
    }
  }

  /**
   * @param window tolerance around the preferred send time
   * @param weeklyDay weekday on which weekly digests go out
   * @param defaultZone zone used for recipients without a time zone
   */
  public record Digest(Duration window, DayOfWeek weeklyDay, ZoneId defaultZone) {

    public Digest {
      window = window != null ? window : Duration.ofMinutes(30);
      weeklyDay = weeklyDay != null ? weeklyDay : DayOfWeek.MONDAY;
      defaultZone = defaultZone != null ? defaultZone : ZoneId.of("UTC");
    }
  }

  public record Unsubscribe(String secret, Duration tokenLifetime) {

    public Unsubscribe {
      secret = secret != null ? secret : "";
      tokenLifetime = tokenLifetime != null ? tokenLifetime : Duration.ofDays(30);
    }
  }

  public record Telegram(String botToken, String apiBaseUrl, int messagesPerSecond) {

    public Telegram {
      botToken = botToken != null ? botToken : "";
      apiBaseUrl = stripTrailingSlash(apiBaseUrl, "https://api.telegram.org");
      messagesPerSecond = messagesPerSecond > 0 ? messagesPerSecond : 20;
    }

    public boolean isConfigured() {
      return !botToken.isBlank();
    }
  }

  private static String stripTrailingSlash(String url, String fallback) {
    if (url == null || url.isBlank()) {
      return fallback;
    }
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
