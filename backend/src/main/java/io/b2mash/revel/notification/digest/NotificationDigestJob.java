package io.b2mash.revel.notification.digest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Triggers the digest scan; hourly by default. */
@Component
public class NotificationDigestJob {

  private static final Logger log = LoggerFactory.getLogger(NotificationDigestJob.class);

  private final NotificationDigestService digestService;

  public NotificationDigestJob(NotificationDigestService digestService) {
    this.digestService = digestService;
  }

  @Scheduled(cron = "${revel.notifications.digest.cron:0 0 * * * *}")
  public void sendDueDigests() {
    log.debug("Notification digest scan started");
    digestService.runDigestScan();
  }
}
