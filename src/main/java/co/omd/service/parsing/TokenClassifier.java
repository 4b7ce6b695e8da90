package co.omd.service.parsing;

import co.omd.model.Denomination;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Etapa 1 de la extracción: parte la línea en tokens y los clasifica
 * (denominación, fecha, número o no reconocido), en ese orden de prioridad.
 */
@Component
public class TokenClassifier {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public List<String> tokenize(String line) {
    if (line == null) return List.of();
    String t = line.replace('\u00A0', ' ').trim();
    if (t.isEmpty()) return List.of();
    return List.of(WHITESPACE.split(t));
  }

  public ClassifiedToken classify(String token) {
    Denomination d = Denomination.fromKeyword(token);
    if (d != null) return ClassifiedToken.denomination(token, d);

    LocalDate date = DateParser.parse(token);
    if (date != null) return ClassifiedToken.date(token, date);

    Double n = NumberParser.parse(token);
    if (n != null) return ClassifiedToken.number(token, n);

    return ClassifiedToken.unrecognized(token);
  }

  public List<ClassifiedToken> classifyAll(List<String> tokens) {
    List<ClassifiedToken> out = new ArrayList<>(tokens.size());
    for (String t : tokens) out.add(classify(t));
    return out;
  }
}
