package co.omd.service.pricing;

import co.omd.model.Denomination;
import co.omd.model.OperationResult;
import co.omd.model.RawBondRecord;
import co.omd.model.ReferenceParameters;
import co.omd.model.RowError;
import co.omd.model.Valuation;
import co.omd.model.ValuedBond;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Valora cada título y acumula los totales de la operación.
 * Una fila que falla se reporta en "omitidos" y no entra en los totales; el resto sigue.
 */
@Service
public class OperationAggregator {

  private static final Logger log = LoggerFactory.getLogger(OperationAggregator.class);

  private final BondValuationEngine engine;
  private final PriceBasis priceBasis;

  public OperationAggregator(BondValuationEngine engine,
                             @Value("${omd.calculo.base-precio:MODEL}") PriceBasis priceBasis) {
    this.engine = engine;
    this.priceBasis = priceBasis;
  }

  public OperationResult run(String operationId, LocalDate settlement, List<RawBondRecord> records,
                             double indexSpot, double annualInflation) {
    return run(operationId, settlement, records, Function.identity(), indexSpot, annualInflation);
  }

  /**
   * Igual que {@link #run(String, LocalDate, List, double, double)} pero con filas sin tipar:
   * la conversión de cada fila ocurre dentro de su propio manejo de errores.
   */
  public <T> OperationResult run(String operationId, LocalDate settlement, List<T> rows,
                                 Function<? super T, RawBondRecord> toRecord,
                                 double indexSpot, double annualInflation) {
    if (settlement == null) throw new IllegalArgumentException("Fecha de liquidación requerida");

    double indexForward = engine.indexForward(indexSpot, annualInflation, settlement);

    List<ValuedBond> valued = new ArrayList<>();
    List<RowError> skipped = new ArrayList<>();
    TotalsAccumulator acc = new TotalsAccumulator();

    for (int i = 0; i < rows.size(); i++) {
      T row = rows.get(i);
      RawBondRecord r = null;
      try {
        r = (row == null) ? null : toRecord.apply(row);
        ValuedBond b = valueOne(i, r, settlement, indexSpot, indexForward);
        valued.add(b);
        acc.add(b);
      } catch (RuntimeException e) {
        String isin = (r != null) ? r.identifier() : identifierOf(row);
        log.warn("Fila {} ({}) excluida de los totales: {}", i, isin, e.getMessage());
        skipped.add(new RowError(i, isin, describe(e)));
      }
    }

    log.info("Operación {} liquidada {}: {} títulos valorados, {} omitidos (base {})",
        operationId, settlement, acc.count(), skipped.size(), priceBasis);
    return new OperationResult(valued, acc.toTotals(operationId, settlement), skipped,
        new ReferenceParameters(indexSpot, annualInflation, indexForward));
  }

  ValuedBond valueOne(int index, RawBondRecord r, LocalDate settlement, double indexSpot, double indexForward) {
    if (r == null) throw new IllegalArgumentException("Fila vacía");
    if (r.maturity() == null) throw new IllegalArgumentException("Vencimiento faltante o inválido");
    requireFinite("cupón", r.couponPct());
    requireFinite("tasa", r.yieldPct());
    requireFinite("precio", r.pricePct());
    requireFinite("nominal", r.faceValue());

    double signedFace = r.signedFaceValue();
    boolean indexed = r.denomination() == Denomination.INDEX_LINKED;
    double localFace = indexed ? signedFace * indexSpot : signedFace;

    double coupon = r.couponPct() / 100.0;
    double yield = r.yieldPct() / 100.0;

    Valuation v;
    if (priceBasis == PriceBasis.QUOTED) {
      v = Valuation.fromDirty(r.pricePct(), engine.accruedInterest(coupon, r.maturity(), settlement));
    } else {
      v = engine.value(yield, coupon, r.maturity(), settlement);
    }

    double cost = localFace * (v.dirtyPrice() / 100.0);
    double effect = engine.couponEffect(settlement, r.maturity(), coupon, localFace);
    double indexation = engine.indexation(r.denomination(), signedFace, indexSpot, indexForward);

    return new ValuedBond(index, r, signedFace, v.cleanPrice(), v.dirtyPrice(), v.accruedInterest(),
        localFace, cost, effect, indexation);
  }

  /** ISIN de una fila que no se pudo convertir, para el reporte de omitidos. */
  private static String identifierOf(Object row) {
    if (row instanceof JsonNode n && n.hasNonNull("isin")) return n.get("isin").asText();
    return "";
  }

  private static void requireFinite(String field, double value) {
    if (!Double.isFinite(value)) throw new IllegalArgumentException("Valor no numérico en " + field);
  }

  private static String describe(RuntimeException e) {
    String msg = e.getMessage();
    return (msg == null || msg.isBlank()) ? e.getClass().getSimpleName() : msg;
  }
}
