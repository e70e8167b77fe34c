package io.b2mash.revel.notification.channel;

import io.b2mash.revel.notification.Notification;
import io.b2mash.revel.notification.delivery.DeliveryChannel;
import io.b2mash.revel.notification.delivery.DeliveryRecord;
import io.b2mash.revel.notification.delivery.DeliveryTracker;
import io.b2mash.revel.notification.preference.NotificationPreferenceService;
import java.time.Clock;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/** The stored notification row is the delivery; this driver only records it. */
@Component
public final class InAppNotificationChannel implements NotificationChannel {

  private final NotificationPreferenceService preferenceService;
  private final DeliveryTracker deliveryTracker;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public InAppNotificationChannel(
      NotificationPreferenceService preferenceService,
      DeliveryTracker deliveryTracker,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.preferenceService = preferenceService;
    this.deliveryTracker = deliveryTracker;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Override
  public DeliveryChannel channel() {
    return DeliveryChannel.IN_APP;
  }

  @Override
  public boolean canDeliver(Notification notification) {
    var userId = notification.getUserId();
    return preferenceService.isChannelEnabled(userId, DeliveryChannel.IN_APP)
        && preferenceService.isNotificationTypeEnabled(userId, notification.getType());
  }

  @Override
  public boolean deliver(Notification notification, DeliveryRecord record) {
    DeliveryAttempt.run(this, record, deliveryTracker, clock, Map::of);
    eventPublisher.publishEvent(
        new InAppNotificationDeliveredEvent(notification.getId(), notification.getUserId()));
    return true;
  }
}
