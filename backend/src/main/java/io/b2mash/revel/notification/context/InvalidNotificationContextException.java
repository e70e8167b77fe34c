package io.b2mash.revel.notification.context;

import io.b2mash.revel.notification.NotificationType;
import java.util.List;

/** Context failed validation for its notification type. Nothing was persisted. */
public class InvalidNotificationContextException extends RuntimeException {

  private final NotificationType notificationType;
  private final List<String> violations;

  public InvalidNotificationContextException(
      NotificationType notificationType, List<String> violations) {
    super(
        "Invalid context for notification type "
            + notificationType
            + ": "
            + String.join("; ", violations));
    this.notificationType = notificationType;
    this.violations = List.copyOf(violations);
  }

  public NotificationType getNotificationType() {
    return notificationType;
  }

  public List<String> getViolations() {
    return violations;
  }
}
