package io.b2mash.revel.notification.template;

import io.b2mash.revel.notification.NotificationType;

/** No template is registered for a notification type. Indicates a deployment bug. */
public class TemplateNotRegisteredException extends RuntimeException {

  private final NotificationType notificationType;

  public TemplateNotRegisteredException(NotificationType notificationType) {
    super("No notification template registered for type " + notificationType);
    this.notificationType = notificationType;
  }

  public NotificationType getNotificationType() {
    return notificationType;
  }
}
