package io.b2mash.b2b.backing.payment;

public record ChargeResult(boolean success, String chargeReference, String errorMessage) {

  public static ChargeResult success(String chargeReference) {
    return new ChargeResult(true, chargeReference, null);
  }

  public static ChargeResult failure(String errorMessage) {
    return new ChargeResult(false, null, errorMessage);
  }
}
