package co.omd.service.export;

import java.time.LocalDate;
import java.util.List;

import co.omd.model.BondRole;
import co.omd.model.Denomination;
import co.omd.model.OperationResult;
import co.omd.model.RawBondRecord;
import co.omd.model.ReferenceParameters;
import co.omd.model.RowError;
import co.omd.model.ValuedBond;
import co.omd.service.pricing.TotalsAccumulator;

final class ExportFixtures {
    private ExportFixtures() {}

    static final LocalDate LIQ = LocalDate.of(2025, 3, 1);

    static OperationResult result() {
        RawBondRecord rc = new RawBondRecord("CO1234567890", LocalDate.of(2026, 12, 15), Denomination.LOCAL_CURRENCY,
                0, 10.655, 90.471, 1_234_567.891, BondRole.COLLECTED, "");
        RawBondRecord rd = new RawBondRecord("CO0000000002", LocalDate.of(2030, 7, 24), Denomination.INDEX_LINKED,
                3, 5.1, 98.125, 2_000, BondRole.DELIVERED, "");
        ValuedBond c = new ValuedBond(0, rc, -1_234_567.891, 90.0, 91.0, 1.0, -1_234_567.891, -1_123_456.78, 0, 0);
        ValuedBond d = new ValuedBond(1, rd, 2_000, 97.0, 98.0, 1.0, 700_000, 686_000, 21_000, 8_000);
        List<ValuedBond> bonds = List.of(c, d);

        TotalsAccumulator acc = new TotalsAccumulator();
        bonds.forEach(acc::add);
        return new OperationResult(bonds, acc.toTotals("OMD_010325", LIQ),
                List.of(new RowError(2, "CO9999999999", "Vencimiento faltante o inválido")),
                new ReferenceParameters(350.0, 0.05, 366.5));
    }
}
