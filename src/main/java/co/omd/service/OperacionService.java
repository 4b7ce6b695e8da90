package co.omd.service;

import co.omd.model.OperationResult;
import co.omd.model.RawBondRecord;
import co.omd.model.ScanResult;
import co.omd.service.document.PdfTextExtractor;
import co.omd.service.parsing.BondRowReader;
import co.omd.service.parsing.DocumentTableScanner;
import co.omd.service.pricing.OperationAggregator;
import co.omd.service.reference.ReferenceRatesProvider;
import co.omd.util.OperationIds;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

/**
 * Flujo de una OMD: memorando -> filas -> (corrección externa) -> cálculo.
 * Resuelve UVR e inflación de referencia salvo que vengan explícitos.
 */
@Service
public class OperacionService {

  private final PdfTextExtractor pdfText;
  private final DocumentTableScanner scanner;
  private final OperationAggregator aggregator;
  private final ReferenceRatesProvider rates;
  private final BondRowReader rowReader;

  public OperacionService(PdfTextExtractor pdfText,
                          DocumentTableScanner scanner,
                          OperationAggregator aggregator,
                          ReferenceRatesProvider rates,
                          BondRowReader rowReader) {
    this.pdfText = pdfText;
    this.scanner = scanner;
    this.aggregator = aggregator;
    this.rates = rates;
    this.rowReader = rowReader;
  }

  public ScanResult scanPdf(InputStream pdf) throws IOException {
    return scanner.scan(pdfText.extractText(pdf));
  }

  public ScanResult scanText(String text) {
    return scanner.scan(text);
  }

  /**
   * @param indexSpot       UVR explícita o null para buscarla en el histórico
   * @param annualInflation inflación explícita (fracción) o null para la del año de liquidación
   */
  public OperationResult calculate(String operationId, LocalDate settlement, List<RawBondRecord> records,
                                   Double indexSpot, Double annualInflation) {
    return calculate(operationId, settlement, records, r -> r, indexSpot, annualInflation);
  }

  /** Filas tal como llegan del editor; una fila ilegible va a "omitidos". */
  public OperationResult calculateRows(String operationId, LocalDate settlement, List<JsonNode> rows,
                                       Double indexSpot, Double annualInflation) {
    return calculate(operationId, settlement, rows, rowReader::read, indexSpot, annualInflation);
  }

  private <T> OperationResult calculate(String operationId, LocalDate settlement, List<T> rows,
                                        Function<? super T, RawBondRecord> toRecord,
                                        Double indexSpot, Double annualInflation) {
    if (settlement == null) throw new IllegalArgumentException("Fecha de liquidación requerida");
    double uvr = (indexSpot != null) ? indexSpot : rates.indexValue(settlement);
    double inf = (annualInflation != null) ? annualInflation : rates.annualInflation(settlement.getYear());
    List<T> safeRows = (rows == null) ? List.of() : rows;
    return aggregator.run(OperationIds.orDefault(operationId, settlement), settlement, safeRows, toRecord, uvr, inf);
  }
}
