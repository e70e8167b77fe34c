package io.b2mash.revel.notification.channel;

import io.b2mash.revel.notification.delivery.DeliveryRecord;
import io.b2mash.revel.notification.delivery.DeliveryTracker;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/** Bookkeeping shared by the drivers around a single transport attempt. */
final class DeliveryAttempt {

  private DeliveryAttempt() {}

  /**
   * Starts an attempt on {@code record}, runs {@code send} and records the result. {@code send}
   * returns the metadata to store on success.
   */
  static boolean run(
      NotificationChannel channel,
      DeliveryRecord record,
      DeliveryTracker tracker,
      Clock clock,
      Supplier<Map<String, Object>> send) {
    record.beginAttempt(clock.instant());
    Map<String, Object> metadata;
    try {
      metadata = send.get();
    } catch (RuntimeException e) {
      record.markFailed(describe(e), channel.shouldRetry(e));
      tracker.save(record);
      throw e;
    }
    record.markSent(clock.instant(), metadata);
    tracker.save(record);
    return true;
  }

  /**
   * Holds the record back without counting an attempt, for throttles applied before anything was
   * sent. Returns the exception the driver throws so the dispatcher reschedules it.
   */
  static TransientDeliveryException defer(
      DeliveryRecord record, DeliveryTracker tracker, String reason, Duration retryAfter) {
    record.markDeferred(reason);
    tracker.save(record);
    return new TransientDeliveryException(reason, retryAfter);
  }

  private static String describe(RuntimeException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
