package co.omd.service.parsing;

import co.omd.model.BondRole;
import co.omd.model.RawBondRecord;
import co.omd.model.ScanResult;
import co.omd.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Recorre el texto del memorando línea por línea.
 * Estado: sin sección / recogidos / entregados, según el último encabezado de sección visto.
 * Las líneas que empiezan con un ISIN dentro de una sección se pasan a {@link RowExtractor}.
 */
@Component
public class DocumentTableScanner {

  private static final Logger log = LoggerFactory.getLogger(DocumentTableScanner.class);

  // comparados sin tildes y en mayúsculas
  private static final List<String> COLLECTED_HEADERS = List.of(
      "TES RECIBIDOS POR LA NACION", "TITULOS RECOGIDOS");
  private static final List<String> DELIVERED_HEADERS = List.of(
      "TES ENTREGADOS POR LA NACION", "TITULOS ENTREGADOS");
  private static final List<String> TABLE_HEADERS = List.of(
      "CODIGO ISIN", "VENCIMIENTO");

  enum Section { NONE, COLLECTED, DELIVERED }

  private final RowExtractor extractor;

  public DocumentTableScanner(RowExtractor extractor) {
    this.extractor = extractor;
  }

  public ScanResult scan(String text) {
    LocalDate settlement = DateParser.findHeaderDate(text);
    if (settlement == null) {
      log.warn("No se encontró la fecha de liquidación en el encabezado del memorando");
    }

    List<RawBondRecord> collected = new ArrayList<>();
    List<RawBondRecord> delivered = new ArrayList<>();
    if (text == null || text.isBlank()) return new ScanResult(settlement, collected, delivered);

    Section section = Section.NONE;
    int ignored = 0;

    for (String rawLine : text.split("\\r?\\n")) {
      String line = rawLine.strip();
      if (line.isEmpty()) continue;
      String folded = Texts.fold(line);

      Section header = sectionHeader(folded);
      if (header != null) {
        section = header;
        continue;
      }
      if (containsAny(folded, TABLE_HEADERS)) continue;

      if (!extractor.startsWithIdentifier(line)) continue;
      if (section == Section.NONE) {
        ignored++;
        continue;
      }

      RawBondRecord rec = extractor.extract(line);
      if (section == Section.COLLECTED) {
        collected.add(rec.withRole(BondRole.COLLECTED));
      } else {
        delivered.add(rec.withRole(BondRole.DELIVERED));
      }
    }

    if (ignored > 0) log.warn("{} filas con ISIN fuera de una sección recogidos/entregados", ignored);
    log.info("Memorando escaneado: fecha={} recogidos={} entregados={}",
        settlement, collected.size(), delivered.size());
    return new ScanResult(settlement, collected, delivered);
  }

  static Section sectionHeader(String folded) {
    if (containsAny(folded, COLLECTED_HEADERS)) return Section.COLLECTED;
    if (containsAny(folded, DELIVERED_HEADERS)) return Section.DELIVERED;
    return null;
  }

  private static boolean containsAny(String folded, List<String> phrases) {
    for (String p : phrases) {
      if (folded.contains(p)) return true;
    }
    return false;
  }
}
