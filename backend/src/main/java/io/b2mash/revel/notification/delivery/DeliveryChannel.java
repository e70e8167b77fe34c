package io.b2mash.revel.notification.delivery;

public enum DeliveryChannel {
  IN_APP,
  EMAIL,
  TELEGRAM
}
