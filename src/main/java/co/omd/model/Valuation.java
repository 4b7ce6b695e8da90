package co.omd.model;

/** Precios en % del par (100). limpio = sucio - intereses corridos. */
public record Valuation(double cleanPrice, double accruedInterest, double dirtyPrice) {

  public static final Valuation EXPIRED = new Valuation(0.0, 0.0, 0.0);

  public static Valuation fromDirty(double dirtyPrice, double accruedInterest) {
    return new Valuation(dirtyPrice - accruedInterest, accruedInterest, dirtyPrice);
  }
}
