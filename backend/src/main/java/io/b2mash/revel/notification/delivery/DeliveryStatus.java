package io.b2mash.revel.notification.delivery;

public enum DeliveryStatus {
  PENDING,
  SENT,
  FAILED,
  SKIPPED
}
