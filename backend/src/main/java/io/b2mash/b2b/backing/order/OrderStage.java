package io.b2mash.b2b.backing.order;

/** Furthest point an order reached in the pipeline. */
public enum OrderStage {
  CREATED,
  PAYMENT_PENDING,
  PROCESSED,
  MEMBER_PROVISIONED,
  NOTIFIED,
  PAYMENT_FAILED
}
