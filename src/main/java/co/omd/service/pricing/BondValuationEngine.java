package co.omd.service.pricing;

import co.omd.model.Denomination;
import co.omd.model.Valuation;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.MonthDay;
import java.time.temporal.ChronoUnit;

/**
 * Fórmulas por título (TES, cupón anual en el aniversario del vencimiento, base 365).
 * Sin estado ni I/O. Sin redondeos: el redondeo es cosa de la presentación.
 *
 * <pre>
 * P_sucio = Σ_{i=1..n} C / (1+y)^(i-1+f)  +  100 / (1+y)^(n-1+f)
 * AI      = C * días(cupón anterior, liquidación) / 365
 * P_limpio = P_sucio - AI
 * </pre>
 */
@Component
public class BondValuationEngine {

  static final double BASIS_DAYS = 365.0;
  static final double REDEMPTION = 100.0;

  /**
   * @param yield    tasa como fracción (0.10655)
   * @param coupon   cupón como fracción (0.11)
   * @return precios en % del par; (0, 0, 0) si la liquidación no es anterior al vencimiento
   */
  public Valuation value(double yield, double coupon, LocalDate maturity, LocalDate settlement) {
    requireDates(maturity, settlement);
    if (!settlement.isBefore(maturity)) return Valuation.EXPIRED;

    CouponPeriod p = couponPeriod(maturity, settlement);
    double f = ChronoUnit.DAYS.between(settlement, p.next()) / BASIS_DAYS;
    int n = maturity.getYear() - p.next().getYear() + 1;

    double c = REDEMPTION * coupon;
    double base = 1.0 + yield;

    double dirty = 0.0;
    for (int i = 1; i <= n; i++) {
      dirty += c / Math.pow(base, i - 1 + f);
    }
    dirty += REDEMPTION / Math.pow(base, n - 1 + f);

    if (!Double.isFinite(dirty)) {
      throw new ArithmeticException("Tasa degenerada para descontar flujos: " + yield);
    }
    return Valuation.fromDirty(dirty, accrued(c, p.previous(), settlement));
  }

  /** Intereses corridos (% del par) solamente; 0 si el título ya venció. */
  public double accruedInterest(double coupon, LocalDate maturity, LocalDate settlement) {
    requireDates(maturity, settlement);
    if (!settlement.isBefore(maturity)) return 0.0;
    return accrued(REDEMPTION * coupon, couponPeriod(maturity, settlement).previous(), settlement);
  }

  /**
   * Efecto cupón: si el aniversario del vencimiento cae después de la liquidación dentro del
   * mismo año, el cupón se paga este año -> tasa * |nominal|. Signo: negativo si el nominal
   * es negativo (recogidos).
   */
  public double couponEffect(LocalDate settlement, LocalDate maturity, double couponRate, double faceValue) {
    requireDates(maturity, settlement);
    // MonthDay compara como si ambos fueran del mismo año bisiesto (29-feb incluido)
    if (!MonthDay.from(settlement).isBefore(MonthDay.from(maturity))) return 0.0;
    double effect = Math.abs(couponRate * faceValue);
    if (effect == 0.0) return 0.0;
    return faceValue < 0 ? -effect : effect;
  }

  /** UVR proyectada al 31-dic del año de liquidación. */
  public double indexForward(double indexSpot, double annualInflation, LocalDate settlement) {
    if (settlement == null) throw new IllegalArgumentException("Fecha de liquidación requerida");
    LocalDate yearEnd = LocalDate.of(settlement.getYear(), 12, 31);
    double days = ChronoUnit.DAYS.between(settlement, yearEnd);
    return indexSpot * Math.pow(1.0 + annualInflation, days / BASIS_DAYS);
  }

  /**
   * Indexación de un título UVR: nominal_uvr * UVR_fin - nominal_uvr * UVR_spot.
   * El nominal va en unidades UVR (con su signo). Títulos en pesos: siempre 0.
   */
  public double indexation(Denomination denomination, double faceValueUnits, double indexSpot, double indexForward) {
    if (denomination != Denomination.INDEX_LINKED) return 0.0;
    return (faceValueUnits * indexForward) - (faceValueUnits * indexSpot);
  }

  record CouponPeriod(LocalDate previous, LocalDate next) {}

  /**
   * Próximo cupón = primer aniversario del vencimiento posterior a la liquidación,
   * retrocediendo año a año desde el vencimiento. Se calcula siempre desde el vencimiento
   * para que un 29-feb no se corra a 28-feb de forma permanente.
   */
  static CouponPeriod couponPeriod(LocalDate maturity, LocalDate settlement) {
    int back = 0;
    while (maturity.minusYears(back + 1).isAfter(settlement)) back++;
    return new CouponPeriod(maturity.minusYears(back + 1), maturity.minusYears(back));
  }

  private static double accrued(double couponCash, LocalDate previousCoupon, LocalDate settlement) {
    return couponCash * (ChronoUnit.DAYS.between(previousCoupon, settlement) / BASIS_DAYS);
  }

  private static void requireDates(LocalDate maturity, LocalDate settlement) {
    if (maturity == null) throw new IllegalArgumentException("Vencimiento faltante");
    if (settlement == null) throw new IllegalArgumentException("Fecha de liquidación requerida");
  }
}
