package io.b2mash.revel.notification.preference;

import java.time.Duration;

public enum DigestFrequency {
  IMMEDIATE,
  HOURLY,
  DAILY,
  WEEKLY;

  /** How far back a digest of this cadence reaches. */
  public Duration lookback() {
    return switch (this) {
      case HOURLY -> Duration.ofHours(1);
      case DAILY -> Duration.ofDays(1);
      case WEEKLY -> Duration.ofDays(7);
      case IMMEDIATE ->
          throw new IllegalStateException("Immediate delivery has no digest lookback");
    };
  }
}
