package io.b2mash.revel.notification.channel;

import java.time.Duration;
import java.util.Optional;

/** Network errors, rate limiting and server-side failures. Worth another attempt later. */
public class TransientDeliveryException extends DeliveryException {

  private final Duration retryAfter;

  public TransientDeliveryException(String message) {
    this(message, (Duration) null);
  }

  public TransientDeliveryException(String message, Duration retryAfter) {
    super(message);
    this.retryAfter = retryAfter;
  }

  public TransientDeliveryException(String message, Throwable cause) {
    super(message, cause);
    this.retryAfter = null;
  }

  /** Delay requested by the remote side, if it sent one. */
  public Optional<Duration> getRetryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
