package co.omd.service.export;

import co.omd.model.Denomination;
import co.omd.model.OperationResult;
import co.omd.model.OperationTotals;
import co.omd.model.ValuedBond;
import org.apache.poi.ss.usermodel.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;

/**
 * Agrega una operación al libro "Consolidado":
 * <ul>
 *   <li>"Canjes desagregado": una fila por título.</li>
 *   <li>"HISTORICO": una fila con los totales.</li>
 * </ul>
 * Las columnas son posiciones fijas del libro existente; no se leen encabezados.
 */
@Service
public class ConsolidadoWorkbookWriter {

  private static final Logger log = LoggerFactory.getLogger(ConsolidadoWorkbookWriter.class);

  public static final String SHEET_DETAIL = "Canjes desagregado";
  public static final String SHEET_HISTORY = "HISTORICO";
  public static final String OPERATION_KIND = "OMD";

  // Canjes desagregado
  static final int D_YEAR = 0, D_OPERATION = 1, D_SETTLEMENT = 2, D_ROLE = 3, D_ISIN = 5, D_DENOM = 6,
      D_MATURITY = 9, D_COUPON = 10, D_YIELD = 11, D_DIRTY = 12, D_CLEAN = 13, D_ACCRUED = 14,
      D_FACE_ORIG = 16, D_COST = 17, D_FACE_LOCAL = 18, D_COUPON_EFFECT = 22, D_INDEXATION = 29;

  // HISTORICO
  static final int H_YEAR = 0, H_OPERATION = 1, H_KIND = 2, H_SETTLEMENT = 3, H_EXCHANGED = 4, H_OUTLAY = 5,
      H_COUPON_EFFECTS = 6, H_CFN = 7, H_INDEXATION = 8, H_CFN_INDEXATION = 9, H_BALANCE = 10, H_RESULT = 11;

  /**
   * @throws IllegalArgumentException si el archivo subido no es un libro Excel legible
   */
  public byte[] append(InputStream consolidado, OperationResult result) {
    Workbook opened;
    try {
      opened = WorkbookFactory.create(consolidado);
    } catch (IOException | RuntimeException e) {
      throw new IllegalArgumentException("El archivo Consolidado no es un libro Excel válido", e);
    }
    try (Workbook wb = opened) {
      CellStyle dateStyle = dateStyle(wb);
      OperationTotals t = result.totals();

      Sheet detail = wb.getSheet(SHEET_DETAIL);
      if (detail == null) {
        log.warn("El consolidado no tiene la hoja '{}'; no se agregan títulos", SHEET_DETAIL);
      } else {
        for (ValuedBond b : result.bonds()) {
          appendDetail(nextRow(detail), b, t, dateStyle);
        }
      }

      Sheet history = wb.getSheet(SHEET_HISTORY);
      if (history == null) {
        log.warn("El consolidado no tiene la hoja '{}'; no se agrega el resumen", SHEET_HISTORY);
      } else {
        appendHistory(nextRow(history), t, dateStyle);
      }

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      wb.write(out);
      log.info("Consolidado actualizado: operación {} ({} títulos)", t.operationId(), result.bonds().size());
      return out.toByteArray();
    } catch (IOException e) {
      throw new IllegalStateException("Error actualizando el consolidado: " + e.getMessage(), e);
    }
  }

  private static void appendDetail(Row row, ValuedBond b, OperationTotals t, CellStyle dateStyle) {
    LocalDate liq = t.settlementDate();
    set(row, D_YEAR, liq.getYear());
    set(row, D_OPERATION, t.operationId());
    set(row, D_SETTLEMENT, liq, dateStyle);
    set(row, D_ROLE, b.role().label());
    set(row, D_ISIN, b.source().identifier());
    set(row, D_DENOM, b.source().denomination() == Denomination.INDEX_LINKED ? "UVR" : "COP");
    set(row, D_MATURITY, b.source().maturity(), dateStyle);
    set(row, D_COUPON, b.source().couponPct() / 100.0);
    set(row, D_YIELD, b.source().yieldPct() / 100.0);
    set(row, D_DIRTY, b.dirtyPricePct() / 100.0);
    set(row, D_CLEAN, b.cleanPricePct() / 100.0);
    set(row, D_ACCRUED, b.accruedInterestPct());
    set(row, D_FACE_ORIG, b.signedFaceValue());
    set(row, D_COST, b.costValue());
    set(row, D_FACE_LOCAL, b.localFaceValue());
    set(row, D_COUPON_EFFECT, b.couponEffect());
    set(row, D_INDEXATION, b.indexation());
  }

  private static void appendHistory(Row row, OperationTotals t, CellStyle dateStyle) {
    set(row, H_YEAR, t.settlementDate().getYear());
    set(row, H_OPERATION, t.operationId());
    set(row, H_KIND, OPERATION_KIND);
    set(row, H_SETTLEMENT, t.settlementDate(), dateStyle);
    set(row, H_EXCHANGED, t.amountExchanged());
    set(row, H_OUTLAY, t.grossOutlay());
    set(row, H_COUPON_EFFECTS, t.totalCouponEffect());
    set(row, H_CFN, t.netFiscalCost());
    set(row, H_INDEXATION, t.totalIndexation());
    set(row, H_CFN_INDEXATION, t.netFiscalCostPlusIndexation());
    set(row, H_BALANCE, t.debtBalance());
    set(row, H_RESULT, t.overallResult());
  }

  /** Fila siguiente a la última con datos (POI devuelve -1 en hojas vacías). */
  private static Row nextRow(Sheet sh) {
    int last = sh.getLastRowNum();
    return sh.createRow(sh.getPhysicalNumberOfRows() == 0 ? 0 : last + 1);
  }

  private static CellStyle dateStyle(Workbook wb) {
    CellStyle st = wb.createCellStyle();
    st.setDataFormat(wb.getCreationHelper().createDataFormat().getFormat("dd/mm/yyyy"));
    return st;
  }

  private static void set(Row row, int col, double v) {
    row.createCell(col, CellType.NUMERIC).setCellValue(v);
  }

  private static void set(Row row, int col, String v) {
    row.createCell(col, CellType.STRING).setCellValue(v == null ? "" : v);
  }

  private static void set(Row row, int col, LocalDate d, CellStyle dateStyle) {
    if (d == null) return;
    Cell c = row.createCell(col);
    c.setCellValue(d);
    c.setCellStyle(dateStyle);
  }
}
