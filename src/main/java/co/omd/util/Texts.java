package co.omd.util;

import java.text.Normalizer;
import java.util.Locale;

public final class Texts {
  private Texts(){}

  /** Quita tildes, pasa a mayúsculas y colapsa espacios (incluye NBSP). */
  public static String fold(String s) {
    if (s == null) return "";
    String n = Normalizer.normalize(s, Normalizer.Form.NFD)
        .replaceAll("\\p{InCombiningDiacriticalMarks}+", "");
    return n.replace('\u00A0', ' ')
        .replaceAll("\\s+", " ")
        .trim()
        .toUpperCase(Locale.ROOT);
  }
}
