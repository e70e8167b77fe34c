package io.b2mash.revel.notification.delivery;

import io.b2mash.revel.config.NotificationProperties;
import io.b2mash.revel.notification.NotificationRepository;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/** Deletes notifications past the retention period together with their delivery records. */
@Component
public class NotificationRetentionJob {

  private static final Logger log = LoggerFactory.getLogger(NotificationRetentionJob.class);

  static final int BATCH_SIZE = 500;

  private final NotificationRepository notificationRepository;
  private final DeliveryRecordRepository recordRepository;
  private final TransactionTemplate transactionTemplate;
  private final int retentionDays;
  private final Clock clock;

  public NotificationRetentionJob(
      NotificationRepository notificationRepository,
      DeliveryRecordRepository recordRepository,
      TransactionTemplate transactionTemplate,
      NotificationProperties properties,
      Clock clock) {
    this.notificationRepository = notificationRepository;
    this.recordRepository = recordRepository;
    this.transactionTemplate = transactionTemplate;
    this.retentionDays = properties.retentionDays();
    this.clock = clock;
  }

  @Scheduled(cron = "${revel.notifications.retention-cron:0 30 3 * * *}")
  public int purgeExpiredNotifications() {
    var cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
    int totalDeleted = 0;
    while (true) {
      Integer deleted =
          transactionTemplate.execute(
              status -> {
                var ids =
                    notificationRepository.findIdsCreatedBefore(
                        cutoff, PageRequest.of(0, BATCH_SIZE));
                if (ids.isEmpty()) {
                  return 0;
                }
                recordRepository.deleteByNotificationIdIn(ids);
                return notificationRepository.deleteByIdIn(ids);
              });
      if (deleted == null || deleted == 0) {
        break;
      }
      totalDeleted += deleted;
    }
    if (totalDeleted > 0) {
      log.info("Deleted {} notifications older than {} days", totalDeleted, retentionDays);
    }
    return totalDeleted;
  }
}
