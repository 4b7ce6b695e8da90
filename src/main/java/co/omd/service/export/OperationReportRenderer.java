package co.omd.service.export;

import co.omd.model.BondRole;
import co.omd.model.OperationResult;
import co.omd.model.OperationTotals;
import co.omd.model.ValuedBond;
import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import org.jsoup.helper.W3CDom;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Informe imprimible "Seguimiento OMD": cuadro resumen + detalle de recogidos y entregados.
 * El HTML se arma con jsoup (escapa los textos) y se pasa a PDF con openhtmltopdf.
 */
@Service
public class OperationReportRenderer {

  private static final Locale CO = Locale.forLanguageTag("es-CO");
  private static final DateTimeFormatter DMY = DateTimeFormatter.ofPattern("dd/MM/yyyy");

  private static final String CSS = String.join("\n",
      "@page { size: letter landscape; margin: 30px; }",
      "body { font-family: Helvetica, sans-serif; font-size: 8pt; }",
      "h1 { font-size: 14pt; text-align: center; margin: 4px 0; }",
      "h2 { font-size: 11pt; margin: 14px 0 4px 0; }",
      "table { border-collapse: collapse; margin-bottom: 10px; }",
      "th { background: #d3d3d3; }",
      "table.resumen th { background: #808080; color: #f5f5f5; }",
      "th, td { border: 1px solid #000; padding: 3px 6px; }",
      "td.num { text-align: right; }");

  public byte[] render(OperationResult result) {
    return toPdf(toHtml(result));
  }

  Document toHtml(OperationResult result) {
    OperationTotals t = result.totals();
    Document doc = Document.createShell("");
    doc.outputSettings().syntax(Document.OutputSettings.Syntax.xml);
    doc.head().appendElement("meta").attr("charset", "UTF-8");
    doc.head().appendElement("style").appendText(CSS);
    doc.title("Informe " + t.operationId());

    Element body = doc.body();
    body.appendElement("h1").text("SEGUIMIENTO DE OPERACIONES DE MANEJO DE DEUDA (OMD)");
    body.appendElement("h1").text("Fecha de Liquidación: " + date(t.settlementDate()));
    body.appendElement("p").text("Operación: " + t.operationId());

    Element summary = body.appendElement("table").addClass("resumen");
    headerRow(summary, List.of("Indicador", "Valor (COP)"));
    summaryRow(summary, "Monto Canjeado (Recogido)", t.amountExchanged());
    summaryRow(summary, "Costo Fiscal Neto (CFN)", t.netFiscalCost());
    summaryRow(summary, "Ahorro Generado", t.overallResult());
    summaryRow(summary, "Saldo de Deuda", t.debtBalance());

    detail(body, "Títulos Recogidos (Tesorería / Mercado)", result.byRole(BondRole.COLLECTED));
    detail(body, "Títulos Entregados", result.byRole(BondRole.DELIVERED));

    if (!result.skipped().isEmpty()) {
      body.appendElement("h2").text("Filas omitidas");
      Element ul = body.appendElement("ul");
      result.skipped().forEach(e ->
          ul.appendElement("li").text("Fila " + e.rowIndex() + " " + e.identifier() + ": " + e.message()));
    }
    return doc;
  }

  private static void detail(Element body, String title, List<ValuedBond> bonds) {
    if (bonds.isEmpty()) return;
    body.appendElement("h2").text(title);
    Element table = body.appendElement("table");
    headerRow(table, List.of("ISIN", "Vencimiento", "Tasa %", "Valor Nominal Orig", "Valor Costo", "Efecto Cupón"));
    for (ValuedBond b : bonds) {
      Element tr = table.appendElement("tr");
      tr.appendElement("td").text(b.source().identifier());
      tr.appendElement("td").text(date(b.source().maturity()));
      tr.appendElement("td").addClass("num").text(money(b.source().yieldPct()));
      tr.appendElement("td").addClass("num").text(money(b.signedFaceValue()));
      tr.appendElement("td").addClass("num").text(money(b.costValue()));
      tr.appendElement("td").addClass("num").text(money(b.couponEffect()));
    }
  }

  private static void headerRow(Element table, List<String> titles) {
    Element tr = table.appendElement("tr");
    titles.forEach(h -> tr.appendElement("th").text(h));
  }

  private static void summaryRow(Element table, String label, double value) {
    Element tr = table.appendElement("tr");
    tr.appendElement("td").text(label);
    tr.appendElement("td").addClass("num").text(money(value));
  }

  static String money(double v) {
    // DecimalFormat no es thread-safe
    return new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(CO)).format(v);
  }

  private static String date(LocalDate d) {
    return d == null ? "" : d.format(DMY);
  }

  private static byte[] toPdf(Document html) {
    try {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      PdfRendererBuilder builder = new PdfRendererBuilder();
      builder.useFastMode();
      builder.withW3cDocument(new W3CDom().fromJsoup(html), "/");
      builder.toStream(out);
      builder.run();
      return out.toByteArray();
    } catch (Exception e) {
      throw new IllegalStateException("No se pudo generar el informe PDF", e);
    }
  }
}
