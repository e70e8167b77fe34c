package io.b2mash.revel.notification.preference;

import io.b2mash.revel.notification.delivery.DeliveryChannel;
import java.util.List;

/**
 * Per-type override. {@code enabled=false} switches the type off; a non-empty channel list narrows
 * the user's enabled channels for this type.
 */
public record NotificationTypeSetting(boolean enabled, List<DeliveryChannel> channels) {

  public NotificationTypeSetting {
    channels = channels != null ? List.copyOf(channels) : List.of();
  }

  public static NotificationTypeSetting disabled() {
    return new NotificationTypeSetting(false, List.of());
  }
}
