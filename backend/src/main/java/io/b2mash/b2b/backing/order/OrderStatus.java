package io.b2mash.b2b.backing.order;

public enum OrderStatus {
  PENDING,
  PROCESSED,
  /** Payment was declined; the order no longer holds tier capacity. */
  PAYMENT_FAILED
}
