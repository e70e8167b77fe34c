package io.b2mash.revel.notification;

import java.util.List;
import java.util.UUID;

/** Published when notifications are stored; dispatch happens once the transaction commits. */
public record NotificationCreatedEvent(List<UUID> notificationIds) {

  public NotificationCreatedEvent {
    notificationIds = List.copyOf(notificationIds);
  }
}
