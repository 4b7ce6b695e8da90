package co.omd.web;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.converter.ByteArrayHttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.fasterxml.jackson.databind.SerializationFeature;

import co.omd.service.OperacionService;
import co.omd.service.document.PdfTextExtractor;
import co.omd.service.export.ConsolidadoWorkbookWriter;
import co.omd.service.export.OperationReportRenderer;
import co.omd.service.parsing.BondRowReader;
import co.omd.service.parsing.DocumentTableScanner;
import co.omd.service.parsing.RowExtractor;
import co.omd.service.parsing.TokenClassifier;
import co.omd.service.pricing.BondValuationEngine;
import co.omd.service.pricing.OperationAggregator;
import co.omd.service.pricing.PriceBasis;
import co.omd.service.reference.ReferenceRatesProvider;

class OperacionControllerTest {

    private static final String CALCULO = "{"
            + "\"fecha_liquidacion\":\"2025-03-01\","
            + "\"titulos\":[{"
            + "\"isin\":\"CO1111111111\",\"vencimiento\":\"2026-03-01\",\"denominacion\":\"COP\","
            + "\"cupon\":10,\"tasa\":10,\"precio\":100,\"nominal\":1000000,\"tipo\":\"Recogido\"}]"
            + "}";

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ReferenceRatesProvider rates = mock(ReferenceRatesProvider.class);
        when(rates.indexValue(any())).thenReturn(100.0);
        when(rates.annualInflation(anyInt())).thenReturn(0.03);

        OperacionService service = new OperacionService(
                new PdfTextExtractor(),
                new DocumentTableScanner(new RowExtractor(new TokenClassifier())),
                new OperationAggregator(new BondValuationEngine(), PriceBasis.MODEL),
                rates,
                new BondRowReader());
        mvc = MockMvcBuilders.standaloneSetup(
                new OperacionController(service, new OperationReportRenderer(), new ConsolidadoWorkbookWriter()))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(
                        new ByteArrayHttpMessageConverter(),
                        new StringHttpMessageConverter(StandardCharsets.UTF_8),
                        new MappingJackson2HttpMessageConverter(Jackson2ObjectMapperBuilder.json()
                                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                                .build()))
                .build();
    }

    @Test
    void scansPlainText() throws Exception {
        String memo = String.join("\n",
                "Bogotá D. C., 19 de diciembre de 2025",
                "TES recibidos por la Nación",
                "CO1234567890 15-dic-26 COP 0,00% 10,655% 90,471 9.716.595.800.000");

        mvc.perform(post("/api/omd/memorando/texto")
                        .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                        .content(memo.getBytes(StandardCharsets.UTF_8)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.operacion_id").value("OMD_191225"))
                .andExpect(jsonPath("$.memorando.fecha_liquidacion").value("2025-12-19"))
                .andExpect(jsonPath("$.memorando.recogidos[0].isin").value("CO1234567890"))
                .andExpect(jsonPath("$.memorando.recogidos[0].tipo").value("Recogido"))
                .andExpect(jsonPath("$.memorando.recogidos[0].denominacion").value("COP"))
                .andExpect(jsonPath("$.memorando.entregados.length()").value(0));
    }

    @Test
    void emptyPdfUploadIsRejected() throws Exception {
        MockMultipartFile empty = new MockMultipartFile("archivo", "memo.pdf", "application/pdf", new byte[0]);

        mvc.perform(multipart("/api/omd/memorando").file(empty))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void unreadablePdfIsRejected() throws Exception {
        MockMultipartFile junk = new MockMultipartFile("archivo", "memo.pdf", "application/pdf",
                "no es un pdf".getBytes(StandardCharsets.UTF_8));

        mvc.perform(multipart("/api/omd/memorando").file(junk))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("PDF")));
    }

    @Test
    void calculatesOperation() throws Exception {
        mvc.perform(post("/api/omd/calculo").contentType(MediaType.APPLICATION_JSON).content(CALCULO))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totales.operacion_id").value("OMD_010325"))
                .andExpect(jsonPath("$.totales.monto_canjeado").value(closeTo(1_000_000.0, 1e-6)))
                .andExpect(jsonPath("$.totales.valor_giro").value(closeTo(1_000_000.0, 1e-6)))
                .andExpect(jsonPath("$.titulos[0].nominal_original").value(closeTo(-1_000_000.0, 1e-6)))
                .andExpect(jsonPath("$.parametros.uvr").value(closeTo(100.0, 0.0)))
                .andExpect(jsonPath("$.omitidos.length()").value(0));
    }

    @Test
    void calculationWithoutSettlementDateIsBadRequest() throws Exception {
        mvc.perform(post("/api/omd/calculo").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"titulos\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void unreadableRowsAreSkippedNotRejected() throws Exception {
        String body = "{"
                + "\"fecha_liquidacion\":\"2025-03-01\","
                + "\"titulos\":["
                + "{\"isin\":\"CO1111111111\",\"vencimiento\":\"2026-03-01\",\"denominacion\":\"COP\","
                + "\"cupon\":10,\"tasa\":10,\"precio\":100,\"nominal\":1000000,\"tipo\":\"Recogido\"},"
                + "{\"isin\":\"CO2222222222\",\"vencimiento\":\"2026-02-30\",\"cupon\":10,\"tasa\":10,"
                + "\"nominal\":5000,\"tipo\":\"Recogido\"},"
                + "{\"isin\":\"CO3333333333\",\"vencimiento\":\"15-dic-26\",\"cupon\":\"0,00%\","
                + "\"tasa\":\"10,655%\",\"precio\":\"90,471\",\"nominal\":\"2.000\",\"tipo\":\"Entregado\"},"
                + "{\"isin\":\"CO4444444444\",\"vencimiento\":\"2026-03-01\",\"cupon\":\"abc\","
                + "\"nominal\":5000,\"tipo\":\"Recogido\"},"
                + "{\"isin\":\"CO5555555555\",\"vencimiento\":\"2026-03-01\",\"denominacion\":\"USD\","
                + "\"nominal\":5000,\"tipo\":\"Recogido\"}"
                + "]}";

        mvc.perform(post("/api/omd/calculo").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.titulos.length()").value(2))
                .andExpect(jsonPath("$.titulos[1].titulo.isin").value("CO3333333333"))
                .andExpect(jsonPath("$.titulos[1].titulo.vencimiento").value("2026-12-15"))
                .andExpect(jsonPath("$.omitidos.length()").value(3))
                .andExpect(jsonPath("$.omitidos[0].indice").value(1))
                .andExpect(jsonPath("$.omitidos[0].isin").value("CO2222222222"))
                .andExpect(jsonPath("$.omitidos[1].isin").value("CO4444444444"))
                .andExpect(jsonPath("$.omitidos[2].isin").value("CO5555555555"))
                .andExpect(jsonPath("$.totales.monto_canjeado").value(closeTo(1_000_000.0, 1e-6)));
    }

    @Test
    void unreadableBodyIsBadRequestWithMessage() throws Exception {
        mvc.perform(post("/api/omd/calculo").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fecha_liquidacion\":\"2025-02-30\",\"titulos\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("Solicitud ilegible")));
    }

    @Test
    void reportIsPdfDownload() throws Exception {
        mvc.perform(post("/api/omd/informe").contentType(MediaType.APPLICATION_JSON).content(CALCULO))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("Informe_OMD_010325.pdf")));
    }

    @Test
    void consolidadoIsUpdatedAndReturned() throws Exception {
        byte[] xlsx;
        try (Workbook wb = new XSSFWorkbook()) {
            wb.createSheet(ConsolidadoWorkbookWriter.SHEET_DETAIL);
            wb.createSheet(ConsolidadoWorkbookWriter.SHEET_HISTORY);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            wb.write(out);
            xlsx = out.toByteArray();
        }
        MockMultipartFile consolidado = new MockMultipartFile("consolidado", "Consolidado.xlsx",
                "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", xlsx);
        MockMultipartFile solicitud = new MockMultipartFile("solicitud", "", MediaType.APPLICATION_JSON_VALUE,
                CALCULO.getBytes(StandardCharsets.UTF_8));

        mvc.perform(multipart("/api/omd/consolidado").file(consolidado).file(solicitud))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("Consolidado_OMD_OMD_010325.xlsx")));
    }

    @Test
    void consolidadoThatIsNotExcelIsBadRequest() throws Exception {
        MockMultipartFile consolidado = new MockMultipartFile("consolidado", "Consolidado.xlsx",
                "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
                "esto no es un libro".getBytes(StandardCharsets.UTF_8));
        MockMultipartFile solicitud = new MockMultipartFile("solicitud", "", MediaType.APPLICATION_JSON_VALUE,
                CALCULO.getBytes(StandardCharsets.UTF_8));

        mvc.perform(multipart("/api/omd/consolidado").file(consolidado).file(solicitud))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("Consolidado")));
    }
}
