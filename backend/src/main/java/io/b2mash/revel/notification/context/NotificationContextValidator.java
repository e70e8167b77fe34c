package io.b2mash.revel.notification.context;

import io.b2mash.revel.notification.NotificationType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Checks a context map against the schema of its notification type. Has no side effects. */
@Component
public class NotificationContextValidator {

  private final NotificationContextSchemas schemas;

  public NotificationContextValidator(NotificationContextSchemas schemas) {
    this.schemas = schemas;
  }

  /**
   * @throws InvalidNotificationContextException if the type has no schema, a required key is
   *     missing or null, or a declared key holds a value of the wrong kind
   */
  public void validate(NotificationType type, Map<String, Object> context) {
    if (type == null) {
      throw new IllegalArgumentException("Notification type is required");
    }
    var schema =
        schemas
            .find(type)
            .orElseThrow(
                () ->
                    new InvalidNotificationContextException(
                        type, List.of("no context schema defined")));

    Map<String, Object> values = context != null ? context : Map.of();
    var violations = new ArrayList<String>();

    schema
        .required()
        .forEach(
            (key, kind) -> {
              if (!values.containsKey(key)) {
                violations.add("missing required key '" + key + "'");
              } else if (values.get(key) == null) {
                violations.add("key '" + key + "' must not be null");
              } else if (!kind.accepts(values.get(key))) {
                violations.add(describeMismatch(key, kind, values.get(key)));
              }
            });

    schema
        .optional()
        .forEach(
            (key, kind) -> {
              var value = values.get(key);
              if (value != null && !kind.accepts(value)) {
                violations.add(describeMismatch(key, kind, value));
              }
            });

    if (!violations.isEmpty()) {
      throw new InvalidNotificationContextException(type, violations);
    }
  }

  private static String describeMismatch(String key, ValueKind expected, Object value) {
    return "key '"
        + key
        + "' expected "
        + expected.name().toLowerCase()
        + " but was "
        + value.getClass().getSimpleName();
  }
}
