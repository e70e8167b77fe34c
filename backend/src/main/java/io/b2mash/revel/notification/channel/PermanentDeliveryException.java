package io.b2mash.revel.notification.channel;

/** Invalid address, blocked recipient or hard bounce. Never retried. */
public class PermanentDeliveryException extends DeliveryException {

  public PermanentDeliveryException(String message) {
    super(message);
  }

  public PermanentDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
