package io.b2mash.revel.notification.channel;

/** Raised by a channel driver when a transport send fails. */
public abstract class DeliveryException extends RuntimeException {

  protected DeliveryException(String message) {
    super(message);
  }

  protected DeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
