package co.omd.service.parsing;

import java.util.regex.Pattern;

/**
 * Números con formato colombiano ("9.716.595,80", "10,655%").
 * <ul>
 *   <li>'.' y ',' juntos: '.' miles, ',' decimal.</li>
 *   <li>sólo ',': decimal.</li>
 *   <li>sólo '.': miles (en los memorandos nunca aparece un punto decimal suelto).</li>
 * </ul>
 * Devuelve null si el token no es un número; nunca lanza.
 */
public final class NumberParser {
  private NumberParser(){}

  private static final Pattern PLAIN = Pattern.compile("[+-]?\\d+(\\.\\d+)?");

  public static Double parse(String token) {
    if (token == null) return null;
    String s = token.trim();
    if (s.endsWith("%")) s = s.substring(0, s.length() - 1).trim();
    if (s.isEmpty()) return null;

    boolean hasDot = s.indexOf('.') >= 0;
    boolean hasComma = s.indexOf(',') >= 0;
    if (hasDot && hasComma) {
      s = s.replace(".", "").replace(',', '.');
    } else if (hasComma) {
      s = s.replace(',', '.');
    } else if (hasDot) {
      s = s.replace(".", "");
    }

    // Double.parseDouble acepta "NaN", "1e5", "0x1p3"... acá no
    if (!PLAIN.matcher(s).matches()) return null;
    try {
      return Double.parseDouble(s);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
