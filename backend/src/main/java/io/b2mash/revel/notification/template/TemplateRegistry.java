package io.b2mash.revel.notification.template;

import io.b2mash.revel.notification.NotificationType;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps each notification type to its template. Built once at startup and injected where rendering
 * happens. Registering a type twice replaces the earlier template and logs a warning.
 */
public class TemplateRegistry {

  private static final Logger log = LoggerFactory.getLogger(TemplateRegistry.class);

  private final Map<NotificationType, NotificationTemplate> templates =
      new EnumMap<>(NotificationType.class);

  public synchronized void register(NotificationTemplate template) {
    register(template.type(), template);
  }

  public synchronized void register(NotificationType type, NotificationTemplate template) {
    var previous = templates.put(type, template);
    if (previous != null && previous != template) {
      log.warn(
          "Notification template for type={} replaced: {} -> {}",
          type,
          previous.getClass().getSimpleName(),
          template.getClass().getSimpleName());
    }
  }

  /**
   * @throws TemplateNotRegisteredException if the type has no template
   */
  public synchronized NotificationTemplate getTemplate(NotificationType type) {
    var template = templates.get(type);
    if (template == null) {
      throw new TemplateNotRegisteredException(type);
    }
    return template;
  }

  public synchronized boolean isRegistered(NotificationType type) {
    return templates.containsKey(type);
  }

  public synchronized Set<NotificationType> unregisteredTypes() {
    return Arrays.stream(NotificationType.values())
        .filter(type -> !templates.containsKey(type))
        .collect(Collectors.toCollection(() -> EnumSet.noneOf(NotificationType.class)));
  }
}
