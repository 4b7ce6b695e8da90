package co.omd.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resultado por título. Inmutable; el agregador sólo lo lee y suma.
 * Nominales y montos derivados llevan el signo del tipo.
 */
public record ValuedBond(
    @JsonProperty("indice")              int rowIndex,
    @JsonProperty("titulo")              RawBondRecord source,
    @JsonProperty("nominal_original")    double signedFaceValue,
    @JsonProperty("precio_limpio")       double cleanPricePct,
    @JsonProperty("precio_sucio")        double dirtyPricePct,
    @JsonProperty("intereses_corridos")  double accruedInterestPct,
    @JsonProperty("nominal_cop")         double localFaceValue,
    @JsonProperty("valor_costo")         double costValue,
    @JsonProperty("efecto_cupon")        double couponEffect,
    @JsonProperty("indexacion")          double indexation
) {

  public BondRole role() { return source.role(); }
}
