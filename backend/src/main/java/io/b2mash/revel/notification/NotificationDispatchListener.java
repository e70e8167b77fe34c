package io.b2mash.revel.notification;

import io.b2mash.revel.config.AsyncConfig;
import io.b2mash.revel.notification.channel.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Dispatches newly stored notifications on the notification pool once the creating transaction
 * has committed. Delivery problems never reach the code that created the notification.
 */
@Component
public class NotificationDispatchListener {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatchListener.class);

  private final NotificationDispatcher dispatcher;

  public NotificationDispatchListener(NotificationDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onNotificationsCreated(NotificationCreatedEvent event) {
    try {
      var report = dispatcher.dispatchBatch(event.notificationIds());
      if (report.hasFailures()) {
        log.warn(
            "Dispatched {} of {} notifications, failures={}",
            report.dispatched().size(),
            event.notificationIds().size(),
            report.failures());
      }
    } catch (Exception e) {
      log.warn("Failed to dispatch notifications ids={}", event.notificationIds(), e);
    }
  }
}
