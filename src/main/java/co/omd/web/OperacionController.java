package co.omd.web;

import co.omd.model.OperationResult;
import co.omd.model.ScanResult;
import co.omd.service.OperacionService;
import co.omd.service.export.ConsolidadoWorkbookWriter;
import co.omd.service.export.OperationReportRenderer;
import co.omd.util.OperationIds;
import co.omd.web.dto.CalculoRequest;
import co.omd.web.dto.MemorandoResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.InputStream;
import java.util.Map;

@RestController
@RequestMapping("/api/omd")
public class OperacionController {

    private static final Logger log = LoggerFactory.getLogger(OperacionController.class);

    private static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final OperacionService service;
    private final OperationReportRenderer reportRenderer;
    private final ConsolidadoWorkbookWriter workbookWriter;

    public OperacionController(OperacionService service,
                               OperationReportRenderer reportRenderer,
                               ConsolidadoWorkbookWriter workbookWriter) {
        this.service = service;
        this.reportRenderer = reportRenderer;
        this.workbookWriter = workbookWriter;
    }

    /** Memorando OMD en PDF -> fecha de liquidación + filas recogidos/entregados. */
    @PostMapping(path = "/memorando", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> memorando(@RequestParam("archivo") MultipartFile archivo) {
        if (archivo == null || archivo.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "archivo vacío"));
        }
        try (InputStream in = archivo.getInputStream()) {
            ScanResult scan = service.scanPdf(in);
            return ResponseEntity.ok(MemorandoResponse.of(OperationIds.defaultFor(scan.settlementDate()), scan));
        } catch (Exception e) {
            log.error("Error leyendo memorando {}: {}", archivo.getOriginalFilename(), e.toString(), e);
            return ResponseEntity.badRequest().body(Map.of("error", "No se pudo leer el PDF: " + e.getMessage()));
        }
    }

    /** Igual que /memorando pero con el texto ya extraído. */
    @PostMapping(path = "/memorando/texto", consumes = MediaType.TEXT_PLAIN_VALUE)
    public MemorandoResponse memorandoTexto(@RequestBody String texto) {
        ScanResult scan = service.scanText(texto);
        return MemorandoResponse.of(OperationIds.defaultFor(scan.settlementDate()), scan);
    }

    @PostMapping("/calculo")
    public ResponseEntity<?> calculo(@RequestBody CalculoRequest req) {
        try {
            return ResponseEntity.ok(calculate(req));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/informe")
    public ResponseEntity<?> informe(@RequestBody CalculoRequest req) {
        try {
            OperationResult result = calculate(req);
            byte[] pdf = reportRenderer.render(result);
            return download(pdf, MediaType.APPLICATION_PDF, "Informe_" + result.totals().operationId() + ".pdf");
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Error generando informe: {}", e.toString(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", "Error generando PDF"));
        }
    }

    /** Agrega la operación al consolidado subido y lo devuelve actualizado. */
    @PostMapping(path = "/consolidado", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> consolidado(@RequestPart("consolidado") MultipartFile consolidado,
                                         @RequestPart("solicitud") CalculoRequest req) {
        if (consolidado == null || consolidado.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "No se ha cargado el archivo Consolidado."));
        }
        try (InputStream in = consolidado.getInputStream()) {
            OperationResult result = calculate(req);
            byte[] xlsx = workbookWriter.append(in, result);
            return download(xlsx, XLSX, "Consolidado_OMD_" + result.totals().operationId() + ".xlsx");
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Error generando Excel: {}", e.toString(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", "Error generando Excel: " + e.getMessage()));
        }
    }

    // ---------- helpers ----------

    private OperationResult calculate(CalculoRequest req) {
        if (req == null) throw new IllegalArgumentException("solicitud vacía");
        return service.calculateRows(req.operacionId, req.fechaLiquidacion, req.titulos, req.uvr, req.inflacion);
    }

    private static ResponseEntity<byte[]> download(byte[] body, MediaType type, String filename) {
        return ResponseEntity.ok()
                .contentType(type)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .body(body);
    }
}
