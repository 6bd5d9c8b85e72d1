package nl.bytesoflife.proteintea.sustainability;

import nl.bytesoflife.proteintea.InvalidInputException;
import nl.bytesoflife.proteintea.environmental.ConsumptionMetrics;
import nl.bytesoflife.proteintea.environmental.ImpactCategory;
import nl.bytesoflife.proteintea.environmental.ImpactInputs;
import nl.bytesoflife.proteintea.environmental.ImpactModel;
import nl.bytesoflife.proteintea.environmental.ImpactReport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EcoEfficiencyCalculatorTest {

    @Test
    void valuePerUnitOfImpact() {
        ImpactReport impacts = new ImpactModel().calculate(
                new ImpactInputs(ConsumptionMetrics.of(240, 30_000), 500, 10, 1000, 200, 0.5));
        EcoEfficiency eco = new EcoEfficiencyCalculator().calculate(1000, impacts);

        // GWP total is 200 kg CO2e
        assertEquals(5.0, eco.get(ImpactCategory.GWP), 1e-9);
        assertEquals(1000, eco.getEconomicValue());
        assertEquals(ImpactCategory.values().length, eco.getRatios().size());
    }

    @Test
    void categoryWithoutImpactHasNoRatio() {
        // no electricity, water, transport or waste leaves GWP and HCT at zero
        ImpactReport impacts = new ImpactModel().calculate(
                new ImpactInputs(ConsumptionMetrics.of(0, 0), 0, 0, 1000, 0, 0));
        EcoEfficiency eco = new EcoEfficiencyCalculator().calculate(1000, impacts);

        assertNull(eco.get(ImpactCategory.GWP));
        assertNull(eco.get(ImpactCategory.HCT));
        // 1000 USD over 50 kg oil-eq from mechanical processing
        assertEquals(20, eco.get(ImpactCategory.FRS), 1e-9);
    }

    @Test
    void negativeValueIsRejected() {
        ImpactReport impacts = new ImpactModel().calculate(
                new ImpactInputs(ConsumptionMetrics.of(240, 30_000), 500, 10, 1000, 200, 0.5));
        assertThrows(InvalidInputException.class, () -> new EcoEfficiencyCalculator().calculate(-1, impacts));
    }
}
