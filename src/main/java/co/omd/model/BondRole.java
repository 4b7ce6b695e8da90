package co.omd.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lado del canje. Único lugar donde se decide el signo del nominal:
 * recogidos negativos, entregados positivos, sin importar cómo vino el dato.
 */
public enum BondRole {
  COLLECTED("Recogido"),
  DELIVERED("Entregado");

  private final String label;

  BondRole(String label) { this.label = label; }

  @JsonValue
  public String label() { return label; }

  public double applySign(double value) {
    double abs = Math.abs(value);
    return this == COLLECTED ? -abs : abs;
  }

  @JsonCreator
  public static BondRole fromJson(String value) {
    if (value == null || value.isBlank()) return null;
    String v = value.trim();
    for (BondRole r : values()) {
      if (r.label.equalsIgnoreCase(v) || r.name().equalsIgnoreCase(v)) return r;
    }
    // plural del memorando ("RECOGIDOS" / "ENTREGADOS")
    String u = v.toUpperCase(Locale.ROOT);
    if (u.startsWith("RECOGID")) return COLLECTED;
    if (u.startsWith("ENTREGAD")) return DELIVERED;
    throw new IllegalArgumentException("Tipo de título desconocido: " + value);
  }
}
