package io.b2mash.revel.notification.channel;

import io.b2mash.revel.notification.Notification;
import io.b2mash.revel.notification.delivery.DeliveryChannel;
import io.b2mash.revel.notification.delivery.DeliveryRecord;

/**
 * Driver for one delivery transport. The set of drivers is closed: the dispatcher requires exactly
 * one driver per {@link DeliveryChannel}.
 */
public sealed interface NotificationChannel
    permits EmailNotificationChannel, TelegramNotificationChannel, InAppNotificationChannel {

  DeliveryChannel channel();

  /**
   * Whether this notification may be delivered to its user over this channel right now: user
   * opt-outs and transport prerequisites such as a verified address or a linked chat.
   */
  boolean canDeliver(Notification notification);

  /**
   * Renders and sends the notification, recording the outcome on {@code record} and persisting it.
   * On failure the record is left FAILED and the exception is rethrown to the caller.
   *
   * @return true when the transport accepted the message
   */
  boolean deliver(Notification notification, DeliveryRecord record);

  default boolean shouldRetry(Throwable error) {
    return error instanceof TransientDeliveryException;
  }
}
