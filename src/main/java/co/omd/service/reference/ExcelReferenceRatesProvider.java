package co.omd.service.reference;

import co.omd.service.parsing.DateParser;
import co.omd.service.parsing.NumberParser;
import org.apache.poi.ss.usermodel.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lee las planillas de referencia:
 * <ul>
 *   <li>UVR (histórico): hoja 1, A = fecha, B = valor.</li>
 *   <li>Inflación: hoja 1, A = año (número, texto o fecha), C = inflación anual en %.</li>
 * </ul>
 * Se cachean en memoria con TTL. Archivo ausente o ilegible -> valores por defecto.
 */
@Component
public class ExcelReferenceRatesProvider implements ReferenceRatesProvider {

  private static final Logger log = LoggerFactory.getLogger(ExcelReferenceRatesProvider.class);
  private static final long TTL_MS = 10 * 60_000L;
  private static final Pattern YEAR = Pattern.compile("(19|20)\\d{2}");

  private final ResourceLoader loader;
  private final String uvrPath;
  private final String inflationPath;
  private final double uvrDefault;
  private final double inflationDefault;

  private volatile Map<LocalDate, Double> uvr;
  private volatile long uvrLoadedTs;
  private volatile InflationTable inflation;
  private volatile long inflationLoadedTs;

  public ExcelReferenceRatesProvider(ResourceLoader loader,
                                     @Value("${omd.referencia.uvr-path:}") String uvrPath,
                                     @Value("${omd.referencia.inflacion-path:}") String inflationPath,
                                     @Value("${omd.referencia.uvr-default:100.0}") double uvrDefault,
                                     @Value("${omd.referencia.inflacion-default:0.03}") double inflationDefault) {
    this.loader = loader;
    this.uvrPath = uvrPath;
    this.inflationPath = inflationPath;
    this.uvrDefault = uvrDefault;
    this.inflationDefault = inflationDefault;
  }

  @Override
  public double indexValue(LocalDate date) {
    if (date == null) return uvrDefault;
    Double v = uvrSeries().get(date);
    if (v == null) {
      log.warn("UVR no disponible para {}; se usa {}", date, uvrDefault);
      return uvrDefault;
    }
    return v;
  }

  @Override
  public double annualInflation(int year) {
    InflationTable t = inflationTable();
    Double pct = t.byYear.get(year);
    if (pct == null) pct = t.last;
    if (pct == null) {
      log.warn("Inflación no disponible para {}; se usa {}", year, inflationDefault);
      return inflationDefault;
    }
    return pct / 100.0;
  }

  // ------------------- carga -------------------

  private Map<LocalDate, Double> uvrSeries() {
    long now = System.currentTimeMillis();
    Map<LocalDate, Double> cached = uvr;
    if (cached != null && now - uvrLoadedTs < TTL_MS) return cached;

    Map<LocalDate, Double> out = new HashMap<>();
    try (Workbook wb = open(uvrPath)) {
      Sheet sh = firstSheet(wb);
      if (sh != null) {
        for (Row row : sh) {
          LocalDate d = asDate(row.getCell(0, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL));
          Double v = asDouble(row.getCell(1, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL));
          if (d != null && v != null) out.put(d, v);
        }
        log.info("[UVR] {} -> {} puntos", uvrPath, out.size());
      }
    } catch (Exception e) {
      log.warn("[UVR] Error leyendo {}: {}", uvrPath, e.toString());
    }
    uvr = out;
    uvrLoadedTs = now;
    return out;
  }

  private InflationTable inflationTable() {
    long now = System.currentTimeMillis();
    InflationTable cached = inflation;
    if (cached != null && now - inflationLoadedTs < TTL_MS) return cached;

    InflationTable t = new InflationTable();
    try (Workbook wb = open(inflationPath)) {
      Sheet sh = firstSheet(wb);
      if (sh != null) {
        for (Row row : sh) {
          Double pct = asDouble(row.getCell(2, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL));
          if (pct == null) continue;
          Integer y = asYear(row.getCell(0, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL));
          if (y != null) t.byYear.put(y, pct);
          t.last = pct;
        }
        log.info("[INFLACION] {} -> {} años", inflationPath, t.byYear.size());
      }
    } catch (Exception e) {
      log.warn("[INFLACION] Error leyendo {}: {}", inflationPath, e.toString());
    }
    inflation = t;
    inflationLoadedTs = now;
    return t;
  }

  private static final class InflationTable {
    final Map<Integer, Double> byYear = new LinkedHashMap<>();
    Double last;
  }

  /** null si no hay ruta configurada o el recurso no existe. */
  private Workbook open(String path) throws Exception {
    if (path == null || path.isBlank()) return null;
    Resource res = loader.getResource(path);
    if (!res.exists() || !res.isReadable()) {
      log.warn("Planilla de referencia no encontrada: {}", path);
      return null;
    }
    try (InputStream in = res.getInputStream()) {
      return WorkbookFactory.create(in);
    }
  }

  private static Sheet firstSheet(Workbook wb) {
    return (wb == null || wb.getNumberOfSheets() == 0) ? null : wb.getSheetAt(0);
  }

  // ------------------- celdas -------------------

  static LocalDate asDate(Cell c) {
    if (c == null) return null;
    if (c.getCellType() == CellType.NUMERIC && DateUtil.isCellDateFormatted(c)) {
      return c.getLocalDateTimeCellValue().toLocalDate();
    }
    if (c.getCellType() == CellType.STRING) {
      return DateParser.parse(c.getStringCellValue());
    }
    return null;
  }

  static Double asDouble(Cell c) {
    if (c == null) return null;
    if (c.getCellType() == CellType.NUMERIC) return c.getNumericCellValue();
    if (c.getCellType() == CellType.FORMULA && c.getCachedFormulaResultType() == CellType.NUMERIC) {
      return c.getNumericCellValue();
    }
    if (c.getCellType() == CellType.STRING) {
      return NumberParser.parse(c.getStringCellValue());
    }
    return null;
  }

  static Integer asYear(Cell c) {
    if (c == null) return null;
    if (c.getCellType() == CellType.NUMERIC) {
      if (DateUtil.isCellDateFormatted(c)) return c.getLocalDateTimeCellValue().getYear();
      double v = c.getNumericCellValue();
      return (v >= 1900 && v <= 2100 && v == Math.rint(v)) ? (int) v : null;
    }
    if (c.getCellType() == CellType.STRING) {
      Matcher m = YEAR.matcher(c.getStringCellValue());
      return m.find() ? Integer.parseInt(m.group()) : null;
    }
    return null;
  }
}
