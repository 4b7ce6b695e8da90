package co.omd.service.parsing;

import co.omd.model.BondRole;
import co.omd.model.Denomination;
import co.omd.model.RawBondRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Fila del editor de correcciones (JSON libre) -> {@link RawBondRecord}.
 * Acepta números como JSON o como texto con formato colombiano y fechas en
 * cualquiera de los formatos del memorando. Campo ausente = valor por defecto;
 * campo presente pero ilegible = IllegalArgumentException (la fila se omite).
 */
@Component
public class BondRowReader {

  public RawBondRecord read(JsonNode row) {
    if (row == null || !row.isObject()) throw new IllegalArgumentException("Fila no es un objeto JSON");

    String isin = text(row, "isin");
    LocalDate maturity = date(row, "vencimiento");
    Denomination denomination = denomination(text(row, "denominacion"));
    double coupon = number(row, "cupon");
    double yield = number(row, "tasa");
    double price = number(row, "precio");
    double face = number(row, "nominal");
    String tipo = text(row, "tipo");
    BondRole role = (tipo == null) ? null : BondRole.fromJson(tipo);

    return new RawBondRecord(isin, maturity, denomination, coupon, yield, price, face, role, text(row, "linea"));
  }

  private static String text(JsonNode row, String field) {
    JsonNode n = row.get(field);
    if (n == null || n.isNull()) return null;
    String s = n.asText().trim();
    return s.isEmpty() ? null : s;
  }

  private static LocalDate date(JsonNode row, String field) {
    String s = text(row, field);
    if (s == null) return null;
    LocalDate d = DateParser.parse(s);
    if (d == null) throw new IllegalArgumentException("Fecha inválida en " + field + ": " + s);
    return d;
  }

  private static double number(JsonNode row, String field) {
    JsonNode n = row.get(field);
    if (n == null || n.isNull()) return 0.0;
    if (n.isNumber()) return n.asDouble();
    String s = n.asText().trim();
    if (s.isEmpty()) return 0.0;
    Double v = NumberParser.parse(s);
    if (v == null) throw new IllegalArgumentException("Valor no numérico en " + field + ": " + s);
    return v;
  }

  private static Denomination denomination(String s) {
    if (s == null) return Denomination.LOCAL_CURRENCY;
    Denomination d = Denomination.fromKeyword(s);
    if (d == null) {
      for (Denomination x : Denomination.values()) {
        if (x.name().equalsIgnoreCase(s)) return x;
      }
      throw new IllegalArgumentException("Denominación desconocida: " + s);
    }
    return d;
  }
}
