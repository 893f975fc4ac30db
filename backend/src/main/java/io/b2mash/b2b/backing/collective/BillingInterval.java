package io.b2mash.b2b.backing.collective;

/** Recurrence of a tier or subscription. One-off tiers carry no interval. */
public enum BillingInterval {
  MONTH("month"),
  YEAR("year");

  private final String value;

  BillingInterval(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
