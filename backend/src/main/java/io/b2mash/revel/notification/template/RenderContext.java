package io.b2mash.revel.notification.template;

import io.b2mash.revel.notification.Notification;
import io.b2mash.revel.recipient.Recipient;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Everything a template needs to render one notification for one recipient. {@code variables} is
 * the notification context after enrichment.
 */
public record RenderContext(
    Notification notification,
    Recipient recipient,
    Locale locale,
    ZoneId zone,
    Map<String, Object> variables) {

  public RenderContext {
    variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
  }

  /** String value of a variable, or an empty string when absent. */
  public String string(String key) {
    var value = variables.get(key);
    return value != null ? value.toString() : "";
  }

  /** Copy of this context with an extra variable, used for nested renders. */
  public RenderContext with(String key, Object value) {
    var copy = new LinkedHashMap<>(variables);
    copy.put(key, value);
    return new RenderContext(notification, recipient, locale, zone, copy);
  }
}
