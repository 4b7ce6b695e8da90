package co.omd.service.pricing;

import co.omd.model.BondRole;
import co.omd.model.OperationTotals;
import co.omd.model.ValuedBond;

import java.time.LocalDate;

/**
 * Sumas parciales de una corrida. Sólo sumas: el orden de los títulos no cambia el resultado,
 * y dos acumuladores parciales se pueden combinar.
 */
public class TotalsAccumulator {

  private double amountExchanged;
  private double debtBalance;
  private double couponEffects;
  private double indexation;
  private double costSum;
  private int count;

  public TotalsAccumulator add(ValuedBond b) {
    if (b.role() == BondRole.COLLECTED) amountExchanged += Math.abs(b.localFaceValue());
    debtBalance   += b.localFaceValue();
    couponEffects += b.couponEffect();
    indexation    += b.indexation();
    costSum       += b.costValue();
    count++;
    return this;
  }

  public TotalsAccumulator combine(TotalsAccumulator other) {
    amountExchanged += other.amountExchanged;
    debtBalance     += other.debtBalance;
    couponEffects   += other.couponEffects;
    indexation      += other.indexation;
    costSum         += other.costSum;
    count           += other.count;
    return this;
  }

  public int count() { return count; }

  /** Valor de giro = -(Σ valor costo); CFN = giro + efectos; resultado = saldo + CFN + indexaciones. */
  public OperationTotals toTotals(String operationId, LocalDate settlement) {
    double grossOutlay = -costSum;
    double netFiscalCost = grossOutlay + couponEffects;
    double overall = debtBalance + netFiscalCost + indexation;
    return new OperationTotals(operationId, settlement, amountExchanged, grossOutlay, couponEffects,
        netFiscalCost, indexation, debtBalance, overall);
  }
}
