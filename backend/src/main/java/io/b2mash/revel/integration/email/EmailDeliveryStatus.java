package io.b2mash.revel.integration.email;

public enum EmailDeliveryStatus {
  SENT,
  FAILED
}
