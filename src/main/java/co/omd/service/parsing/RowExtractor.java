package co.omd.service.parsing;

import co.omd.model.Denomination;
import co.omd.model.RawBondRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Etapa 2: de una línea de la tabla (ISIN, vencimiento, den, cupón, tasa, precio, nominal...)
 * a un {@link RawBondRecord} sin tipo.
 *
 * <p>Los memorandos no delimitan columnas, así que los números se asignan buscando
 * primero el precio (el único campo con rango acotado, 40..160 % del par) y, si no
 * aparece, por posición.
 */
@Component
public class RowExtractor {

  private static final Logger log = LoggerFactory.getLogger(RowExtractor.class);

  /** ISIN: 10 a 12 alfanuméricos en mayúscula, con al menos un dígito. */
  private static final Pattern IDENTIFIER = Pattern.compile("(?=[A-Z]*\\d)[A-Z0-9]{10,12}");

  static final double PRICE_MIN = 40.0;
  static final double PRICE_MAX = 160.0;

  private final TokenClassifier classifier;

  public RowExtractor(TokenClassifier classifier) {
    this.classifier = classifier;
  }

  public static boolean isIdentifier(String token) {
    return token != null && IDENTIFIER.matcher(token).matches();
  }

  public boolean startsWithIdentifier(String line) {
    List<String> tokens = classifier.tokenize(line);
    return !tokens.isEmpty() && isIdentifier(tokens.get(0));
  }

  public RawBondRecord extract(String line) {
    List<String> tokens = classifier.tokenize(line);
    if (tokens.isEmpty()) return RawBondRecord.empty("", line);

    String isin = isIdentifier(tokens.get(0)) ? tokens.get(0) : "";
    int from = isin.isEmpty() ? 0 : 1;

    Denomination denomination = Denomination.LOCAL_CURRENCY;
    LocalDate maturity = null;
    List<Double> nums = new ArrayList<>();

    for (ClassifiedToken t : classifier.classifyAll(tokens.subList(from, tokens.size()))) {
      switch (t.kind()) {
        case DENOMINATION -> denomination = t.denomination();
        case DATE -> maturity = t.date();
        case NUMBER -> nums.add(t.number());
        case UNRECOGNIZED -> { /* best effort */ }
      }
    }

    NumericFields f = mapNumbers(nums);
    if (!f.anchored()) {
      log.debug("Fila sin precio ancla ({} números), asignación por posición: {}", nums.size(), line);
    }
    return new RawBondRecord(isin, maturity, denomination, f.coupon(), f.yield(), f.price(), f.faceValue(),
        null, line);
  }

  record NumericFields(double coupon, double yield, double price, double faceValue, boolean anchored) {}

  /**
   * Precio ancla = primer número en [40, 160]. Antes del ancla pueden venir 0, 1 o 2 tasas
   * (tasa inmediatamente antes; cupón antes de la tasa); el nominal es el número siguiente.
   */
  static NumericFields mapNumbers(List<Double> nums) {
    int anchor = -1;
    for (int i = 0; i < nums.size(); i++) {
      double v = nums.get(i);
      if (v >= PRICE_MIN && v <= PRICE_MAX) { anchor = i; break; }
    }

    if (anchor >= 0) {
      double price = nums.get(anchor);
      double face = (anchor + 1 < nums.size()) ? nums.get(anchor + 1) : 0.0;
      double yield = 0.0, coupon = 0.0;
      if (anchor == 1) {
        yield = nums.get(0);
      } else if (anchor >= 2) {
        yield = nums.get(anchor - 1);
        coupon = nums.get(anchor - 2);
      }
      return new NumericFields(coupon, yield, price, face, true);
    }

    // sin ancla (precio extremo): por cantidad
    if (nums.size() >= 4) {
      return new NumericFields(nums.get(0), nums.get(1), nums.get(2), nums.get(3), false);
    }
    if (nums.size() == 3) {
      return new NumericFields(0.0, nums.get(0), nums.get(1), nums.get(2), false);
    }
    return new NumericFields(0.0, 0.0, 0.0, 0.0, false);
  }
}
