package co.omd.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Denominación del título: pesos o unidades UVR. */
public enum Denomination {
  LOCAL_CURRENCY("COP"),
  INDEX_LINKED("UVR");

  private final String label;

  Denomination(String label) { this.label = label; }

  @JsonValue
  public String label() { return label; }

  /**
   * Palabras clave que aparecen en la columna "Den" del memorando.
   * Devuelve null si el token no es una denominación conocida.
   */
  public static Denomination fromKeyword(String token) {
    if (token == null) return null;
    switch (token.trim().toUpperCase(Locale.ROOT)) {
      case "UVR":
        return INDEX_LINKED;
      case "COP":
      case "PESOS":
        return LOCAL_CURRENCY;
      default:
        return null;
    }
  }

  @JsonCreator
  public static Denomination fromJson(String value) {
    if (value == null || value.isBlank()) return LOCAL_CURRENCY;
    Denomination d = fromKeyword(value);
    if (d != null) return d;
    return Denomination.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
