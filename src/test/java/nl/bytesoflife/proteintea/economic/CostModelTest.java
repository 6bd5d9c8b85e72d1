package nl.bytesoflife.proteintea.economic;

import nl.bytesoflife.proteintea.InvalidInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CostModelTest {

    static CostInputs scenarioA() {
        return new CostInputs(2_500_000, 0.3, 100_000, 0.8, 0.15, 0.5, 0.1, 500_000, 10);
    }

    @Test
    void scenarioABreakdown() {
        CostReport report = new CostModel().calculate(scenarioA());
        AnnualCostBreakdown breakdown = report.getBreakdown();

        assertEquals(325_000, breakdown.get(CostCategory.EQUIPMENT), 1e-6);
        assertEquals(100_000, breakdown.get(CostCategory.MAINTENANCE), 1e-6);
        assertEquals(400_000, breakdown.get(CostCategory.RAW_MATERIAL), 1e-6);
        assertEquals(75_000, breakdown.get(CostCategory.UTILITIES), 1e-6);
        assertEquals(250_000, breakdown.get(CostCategory.LABOR), 1e-6);
        assertEquals(250_000, breakdown.get(CostCategory.INDIRECT), 1e-6);
        assertEquals(1_400_000, report.getTotalAnnualCost(), 1e-6);
        assertEquals(2.80, report.getUnitCost(), 1e-9);
        assertEquals(3_250_000, report.getTotalInvestment(), 1e-6);
    }

    static Stream<Arguments> costInputs() {
        return Stream.of(
                Arguments.of(scenarioA()),
                Arguments.of(new CostInputs(1_000_000, 0.5, 20_000, 1.1, 0.2, 0.3, 0.05, 120_000, 7)),
                Arguments.of(new CostInputs(0, 0, 0, 0, 0, 0, 0, 1, 1)),
                Arguments.of(new CostInputs(7_333_333.33, 0.17, 451_234.5, 0.013, 0.0071, 2.9, 0.33, 3_141_592, 25))
        );
    }

    @ParameterizedTest
    @MethodSource("costInputs")
    void totalIsSumOfCategories(CostInputs inputs) {
        CostReport report = new CostModel().calculate(inputs);
        double sum = 0;
        for (double amount : report.getBreakdown().getAmounts().values()) {
            sum += amount;
        }
        assertEquals(sum, report.getTotalAnnualCost(), Math.max(1e-9, Math.abs(sum) * 1e-9));
    }

    @ParameterizedTest
    @MethodSource("costInputs")
    void unitCostTimesVolumeIsTotal(CostInputs inputs) {
        CostReport report = new CostModel().calculate(inputs);
        double total = report.getTotalAnnualCost();
        assertEquals(total, report.getUnitCost() * inputs.productionVolumeKgPerYear(),
                Math.max(1e-9, total * 1e-9));
    }

    @Test
    void breakdownHasEveryCategory() {
        CostReport report = new CostModel().calculate(scenarioA());
        assertEquals(CostCategory.values().length, report.getBreakdown().getAmounts().size());
        assertEquals("raw_material", CostCategory.RAW_MATERIAL.key());
        assertEquals(CostCategory.UTILITIES, CostCategory.fromKey("utilities"));
    }

    @Test
    void zeroProductionVolumeIsRejected() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> new CostModel().calculate(scenarioA().withProductionVolume(0)));
        assertEquals("production_volume", e.getField());
    }

    @Test
    void zeroDurationIsRejected() {
        CostInputs inputs = new CostInputs(2_500_000, 0.3, 100_000, 0.8, 0.15, 0.5, 0.1, 500_000, 0);
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> new CostModel().calculate(inputs));
        assertEquals("project_duration", e.getField());
    }

    @Test
    void negativeCostIsRejected() {
        CostInputs inputs = new CostInputs(2_500_000, 0.3, -1, 0.8, 0.15, 0.5, 0.1, 500_000, 10);
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> new CostModel().calculate(inputs));
        assertEquals("maintenance_cost", e.getField());
        assertEquals(-1, e.getValue());
    }

    @Test
    void reportPrintsTotals() {
        String text = new CostModel().calculate(scenarioA()).toString();
        assertTrue(text.startsWith("Cost Report:"));
        assertTrue(text.contains("Total annual cost: 1400000.00 USD/yr"));
        assertTrue(text.contains("Unit cost: 2.8000 USD/kg"));
    }
}
