package io.b2mash.revel.notification.context;

import java.util.Collection;
import java.util.Map;

/** JSON value kinds a context entry may carry. */
public enum ValueKind {
  STRING,
  INTEGER,
  BOOLEAN,
  LIST,
  MAP;

  boolean accepts(Object value) {
    return switch (this) {
      case STRING -> value instanceof CharSequence;
      case INTEGER ->
          value instanceof Integer
              || value instanceof Long
              || value instanceof Short
              || value instanceof Byte;
      case BOOLEAN -> value instanceof Boolean;
      case LIST -> value instanceof Collection<?>;
      case MAP -> value instanceof Map<?, ?>;
    };
  }
}
