package co.omd.service.parsing;

import co.omd.util.Texts;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fechas de los memorandos:
 * <ul>
 *   <li>vencimientos "15-dic-26" / "15-DIC-2026" (mes abreviado en español, año 2 dígitos = 20YY)</li>
 *   <li>"2026-12-15" y "15/12/2026"</li>
 *   <li>encabezado "Bogotá D. C., 19 de diciembre de 2025" (mes completo)</li>
 * </ul>
 * Combinaciones inválidas (30-feb, 31-abr) devuelven null.
 */
public final class DateParser {
  private DateParser(){}

  private static final Map<String, Integer> SHORT_MONTHS = Map.ofEntries(
      Map.entry("ENE", 1), Map.entry("FEB", 2), Map.entry("MAR", 3), Map.entry("ABR", 4),
      Map.entry("MAY", 5), Map.entry("JUN", 6), Map.entry("JUL", 7), Map.entry("AGO", 8),
      Map.entry("SEP", 9), Map.entry("OCT", 10), Map.entry("NOV", 11), Map.entry("DIC", 12));

  private static final Map<String, Integer> LONG_MONTHS = Map.ofEntries(
      Map.entry("ENERO", 1), Map.entry("FEBRERO", 2), Map.entry("MARZO", 3), Map.entry("ABRIL", 4),
      Map.entry("MAYO", 5), Map.entry("JUNIO", 6), Map.entry("JULIO", 7), Map.entry("AGOSTO", 8),
      Map.entry("SEPTIEMBRE", 9), Map.entry("SETIEMBRE", 9), Map.entry("OCTUBRE", 10),
      Map.entry("NOVIEMBRE", 11), Map.entry("DICIEMBRE", 12));

  private static final Pattern ABBREVIATED = Pattern.compile("(\\d{1,2})-([A-Za-z]{3})-(\\d{2}|\\d{4})");
  private static final Pattern ISO = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");
  private static final Pattern DMY = Pattern.compile("(\\d{1,2})/(\\d{1,2})/(\\d{4})");

  // "<ciudad>, 19 de diciembre de 2025"
  private static final Pattern HEADER = Pattern.compile(
      "(?mu)^\\s*\\p{L}[\\p{L} .]*,\\s*(\\d{1,2})\\s+de\\s+(\\p{L}+)\\s+(?:de|del)\\s+(\\d{4})",
      Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

  /** Fecha de un token de la tabla (vencimiento). */
  public static LocalDate parse(String token) {
    if (token == null) return null;
    String s = token.trim();
    if (s.isEmpty()) return null;

    Matcher m = ABBREVIATED.matcher(s);
    if (m.matches()) {
      Integer month = SHORT_MONTHS.get(m.group(2).toUpperCase(Locale.ROOT));
      if (month == null) return null;
      int year = Integer.parseInt(m.group(3));
      if (m.group(3).length() == 2) year += 2000;
      return safeDate(year, month, Integer.parseInt(m.group(1)));
    }
    m = ISO.matcher(s);
    if (m.matches()) {
      return safeDate(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
    }
    m = DMY.matcher(s);
    if (m.matches()) {
      return safeDate(Integer.parseInt(m.group(3)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(1)));
    }
    return null;
  }

  /** Primera fecha de encabezado "ciudad, D de mes de YYYY" del documento, o null. */
  public static LocalDate findHeaderDate(String text) {
    if (text == null || text.isBlank()) return null;
    Matcher m = HEADER.matcher(text);
    if (!m.find()) return null;
    return parseLong(m.group(1), m.group(2), m.group(3));
  }

  /** "19", "diciembre", "2025". */
  public static LocalDate parseLong(String day, String monthName, String year) {
    if (day == null || monthName == null || year == null) return null;
    Integer month = LONG_MONTHS.get(Texts.fold(monthName));
    if (month == null) return null;
    try {
      return safeDate(Integer.parseInt(year.trim()), month, Integer.parseInt(day.trim()));
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static LocalDate safeDate(int year, int month, int day) {
    try {
      return LocalDate.of(year, month, day);
    } catch (DateTimeException e) {
      return null;
    }
  }
}
