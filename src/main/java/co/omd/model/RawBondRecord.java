package co.omd.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Fila de título tal como sale del memorando (o del editor de correcciones).
 * Cupón, tasa y precio en puntos porcentuales, igual que en el documento
 * (10,655% -> 10.655). Nominal en unidades de la denominación (pesos o UVR).
 */
public record RawBondRecord(
    @JsonProperty("isin")         String identifier,
    @JsonProperty("vencimiento")  LocalDate maturity,
    @JsonProperty("denominacion") Denomination denomination,
    @JsonProperty("cupon")        double couponPct,
    @JsonProperty("tasa")         double yieldPct,
    @JsonProperty("precio")       double pricePct,
    @JsonProperty("nominal")      double faceValue,
    @JsonProperty("tipo")         BondRole role,
    @JsonProperty("linea")        String line
) {

  public RawBondRecord {
    if (identifier == null) identifier = "";
    if (denomination == null) denomination = Denomination.LOCAL_CURRENCY;
  }

  /** Registro vacío: la fila se conserva aunque no se haya podido leer nada. */
  public static RawBondRecord empty(String identifier, String line) {
    return new RawBondRecord(identifier, null, Denomination.LOCAL_CURRENCY, 0, 0, 0, 0, null, line);
  }

  /** El tipo (recogido/entregado) se asigna una sola vez, desde la sección del documento. */
  public RawBondRecord withRole(BondRole newRole) {
    if (newRole == null) throw new IllegalArgumentException("tipo nulo");
    if (role != null) {
      throw new IllegalStateException("El título " + identifier + " ya tiene tipo " + role.label());
    }
    return new RawBondRecord(identifier, maturity, denomination, couponPct, yieldPct, pricePct,
        faceValue, newRole, line);
  }

  public boolean hasIdentifier() {
    return !identifier.isBlank();
  }

  /** Nominal con el signo de su tipo. */
  public double signedFaceValue() {
    if (role == null) throw new IllegalStateException("Título sin tipo (recogido/entregado): " + identifier);
    return role.applySign(faceValue);
  }
}
