package io.b2mash.revel.notification.delivery;

import io.b2mash.revel.config.AsyncConfig;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Runs delayed retry attempts in memory. Retries lost to a restart are picked up by {@link
 * FailedDeliveryRetryJob}.
 */
@Component
public class DeliveryRetryScheduler {

  private static final Logger log = LoggerFactory.getLogger(DeliveryRetryScheduler.class);

  private final TaskScheduler taskScheduler;
  private final Clock clock;

  public DeliveryRetryScheduler(
      @Qualifier(AsyncConfig.RETRY_SCHEDULER) TaskScheduler taskScheduler, Clock clock) {
    this.taskScheduler = taskScheduler;
    this.clock = clock;
  }

  public void schedule(UUID recordId, Duration delay, Runnable attempt) {
    log.debug("Scheduling delivery retry recordId={} in {}", recordId, delay);
    taskScheduler.schedule(
        () -> {
          try {
            attempt.run();
          } catch (RuntimeException e) {
            log.error("Delivery retry failed for recordId={}", recordId, e);
          }
        },
        clock.instant().plus(delay));
  }
}
