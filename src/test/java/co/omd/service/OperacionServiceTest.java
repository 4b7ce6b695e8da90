package co.omd.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import co.omd.model.OperationResult;
import co.omd.model.ScanResult;
import co.omd.service.document.PdfTextExtractor;
import co.omd.service.parsing.BondRowReader;
import co.omd.service.parsing.DocumentTableScanner;
import co.omd.service.parsing.RowExtractor;
import co.omd.service.parsing.TokenClassifier;
import co.omd.service.pricing.BondValuationEngine;
import co.omd.service.pricing.OperationAggregator;
import co.omd.service.pricing.PriceBasis;
import co.omd.service.reference.ReferenceRatesProvider;

class OperacionServiceTest {

    private static final LocalDate LIQ = LocalDate.of(2025, 12, 19);

    private ReferenceRatesProvider rates;
    private OperacionService service;

    @BeforeEach
    void setUp() {
        rates = mock(ReferenceRatesProvider.class);
        when(rates.indexValue(LIQ)).thenReturn(390.25);
        when(rates.annualInflation(2025)).thenReturn(0.052);
        service = new OperacionService(
                new PdfTextExtractor(),
                new DocumentTableScanner(new RowExtractor(new TokenClassifier())),
                new OperationAggregator(new BondValuationEngine(), PriceBasis.MODEL),
                rates,
                new BondRowReader());
    }

    @Test
    void resolvesReferenceDataAndDefaultId() {
        ScanResult scan = service.scanText(String.join("\n",
                "Bogotá D. C., 19 de diciembre de 2025",
                "TES recibidos por la Nación",
                "CO1234567890 15-dic-26 UVR 3,00% 4,655% 99,471 1.000.000"));

        OperationResult result = service.calculate(null, scan.settlementDate(), scan.collected(), null, null);

        assertEquals("OMD_191225", result.totals().operationId());
        assertEquals(390.25, result.parameters().indexSpot(), 0.0);
        assertEquals(0.052, result.parameters().annualInflation(), 0.0);
        assertEquals(-390_250_000.0, result.bonds().get(0).localFaceValue(), 1e-6);
    }

    @Test
    void explicitValuesOverrideProvider() {
        OperationResult result = service.calculate("OMD_ESPECIAL", LIQ, List.of(), 400.0, 0.04);

        assertEquals("OMD_ESPECIAL", result.totals().operationId());
        assertEquals(400.0, result.parameters().indexSpot(), 0.0);
        assertEquals(0.04, result.parameters().annualInflation(), 0.0);
        assertTrue(result.bonds().isEmpty());
        verify(rates, never()).indexValue(LIQ);
        verify(rates, never()).annualInflation(anyInt());
    }

    @Test
    void missingSettlementDateIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> service.calculate(null, null, List.of(), null, null));
    }
}
