package io.b2mash.revel.notification.delivery;

import io.b2mash.revel.config.NotificationProperties;
import io.b2mash.revel.notification.channel.NotificationDispatcher;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Sweeps recent transient failures that still have attempts left. Picks up retries whose in-memory
 * schedule was lost, for example to a restart. Records touched within {@code retrySweepMinIdle}
 * may still have a retry pending and are left to it.
 */
@Component
public class FailedDeliveryRetryJob {

  private static final Logger log = LoggerFactory.getLogger(FailedDeliveryRetryJob.class);

  private final DeliveryRecordRepository recordRepository;
  private final NotificationDispatcher dispatcher;
  private final NotificationProperties.Delivery settings;
  private final Clock clock;

  public FailedDeliveryRetryJob(
      DeliveryRecordRepository recordRepository,
      NotificationDispatcher dispatcher,
      NotificationProperties properties,
      Clock clock) {
    this.recordRepository = recordRepository;
    this.dispatcher = dispatcher;
    this.settings = properties.delivery();
    this.clock = clock;
  }

  @Scheduled(cron = "${revel.notifications.delivery.retry-sweep-cron:0 0 */6 * * *}")
  public int retryFailedDeliveries() {
    var now = clock.instant();
    var since = now.minus(settings.retrySweepWindow());
    var idleSince = now.minus(settings.retrySweepMinIdle());
    var candidates =
        recordRepository.findRetryCandidates(since, idleSince, settings.maxAttempts());
    int retried = 0;
    for (DeliveryRecord record : candidates) {
      try {
        dispatcher.deliverRecord(record.getId());
        retried++;
      } catch (Exception e) {
        log.warn("Retry sweep failed for recordId={}: {}", record.getId(), e.getMessage());
      }
    }
    if (!candidates.isEmpty()) {
      log.info("Retry sweep re-attempted {} of {} failed deliveries", retried, candidates.size());
    }
    return retried;
  }
}
