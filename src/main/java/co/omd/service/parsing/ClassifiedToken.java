package co.omd.service.parsing;

import co.omd.model.Denomination;

import java.time.LocalDate;

/** Token de una fila ya clasificado. Sólo el campo de su tipo viene poblado. */
public record ClassifiedToken(Kind kind, String raw, Denomination denomination, LocalDate date, Double number) {

  public enum Kind { DENOMINATION, DATE, NUMBER, UNRECOGNIZED }

  public static ClassifiedToken denomination(String raw, Denomination d) {
    return new ClassifiedToken(Kind.DENOMINATION, raw, d, null, null);
  }

  public static ClassifiedToken date(String raw, LocalDate d) {
    return new ClassifiedToken(Kind.DATE, raw, null, d, null);
  }

  public static ClassifiedToken number(String raw, double v) {
    return new ClassifiedToken(Kind.NUMBER, raw, null, null, v);
  }

  public static ClassifiedToken unrecognized(String raw) {
    return new ClassifiedToken(Kind.UNRECOGNIZED, raw, null, null, null);
  }
}
