package io.b2mash.revel.notification.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Required and optional keys of a notification context, with the value kind of each. Keys not
 * declared here are accepted as-is.
 */
public record ContextSchema(Map<String, ValueKind> required, Map<String, ValueKind> optional) {

  public ContextSchema {
    required = Collections.unmodifiableMap(new LinkedHashMap<>(required));
    optional = Collections.unmodifiableMap(new LinkedHashMap<>(optional));
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private final Map<String, ValueKind> required = new LinkedHashMap<>();
    private final Map<String, ValueKind> optional = new LinkedHashMap<>();

    private Builder() {}

    public Builder require(String... keys) {
      for (String key : keys) {
        required.put(key, ValueKind.STRING);
      }
      return this;
    }

    public Builder require(String key, ValueKind kind) {
      required.put(key, kind);
      return this;
    }

    public Builder optional(String... keys) {
      for (String key : keys) {
        optional.put(key, ValueKind.STRING);
      }
      return this;
    }

    public Builder optional(String key, ValueKind kind) {
      optional.put(key, kind);
      return this;
    }

    /** Copies all keys of another schema into this one. */
    public Builder extend(ContextSchema base) {
      required.putAll(base.required());
      optional.putAll(base.optional());
      return this;
    }

    public ContextSchema build() {
      return new ContextSchema(required, optional);
    }
  }
}
