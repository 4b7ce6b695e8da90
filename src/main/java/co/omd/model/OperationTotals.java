package co.omd.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Totales de una operación.
 * costo fiscal neto = valor de giro + efectos cupones;
 * resultado general = saldo de la deuda + costo fiscal neto + indexaciones.
 */
public record OperationTotals(
    @JsonProperty("operacion_id")       String operationId,
    @JsonProperty("fecha_liquidacion")  LocalDate settlementDate,
    @JsonProperty("monto_canjeado")     double amountExchanged,
    @JsonProperty("valor_giro")         double grossOutlay,
    @JsonProperty("efectos_cupones")    double totalCouponEffect,
    @JsonProperty("cfn")                double netFiscalCost,
    @JsonProperty("indexaciones")       double totalIndexation,
    @JsonProperty("saldo_deuda")        double debtBalance,
    @JsonProperty("resultado_general")  double overallResult
) {

  /** Columna "CFN + INX" del histórico. */
  @JsonProperty("cfn_mas_indexaciones")
  public double netFiscalCostPlusIndexation() {
    return netFiscalCost + totalIndexation;
  }
}
