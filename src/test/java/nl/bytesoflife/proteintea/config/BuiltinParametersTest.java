package nl.bytesoflife.proteintea.config;

import nl.bytesoflife.proteintea.economic.CostInputs;
import nl.bytesoflife.proteintea.environmental.allocation.AllocationMethod;
import nl.bytesoflife.proteintea.environmental.allocation.CoProduct;
import nl.bytesoflife.proteintea.technical.TechnicalParameters;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinParametersTest {

    @Test
    void economicDefaultsAreTheReferencePlant() {
        EconomicParameters params = BuiltinParameters.economic();
        assertEquals(new CostInputs(2_500_000, 0.3, 100_000, 0.8, 0.15, 0.5, 0.1, 500_000, 10),
                params.costInputs());
        assertEquals(0.10, params.discountRate());
        assertEquals(5.0, params.sellingPricePerKg());
        assertEquals(5.0, params.sensitivity().sellingPricePerKg());
        assertEquals(10, params.sensitivity().depreciationYears());
        assertEquals(0.10, params.sensitivity().perturbation());
        assertEquals(0.2, params.sensitivity().sensitivityRange());
        assertEquals(10, params.sensitivity().steps());
    }

    @Test
    void environmentalDefaultsUseHybridAllocation() {
        EnvironmentalParameters params = EnvironmentalParameters.defaults();
        assertEquals(AllocationMethod.HYBRID, params.allocationMethod());
        assertEquals(0.6, params.economicWeight());
        assertEquals(List.of(
                new CoProduct("protein_isolate", 1000, 6.5),
                new CoProduct("starch", 300, 2.3),
                new CoProduct("fiber", 200, 1.8)), params.coProducts());
        assertEquals(7550, params.coProductValue(), 1e-9);
    }

    @Test
    void technicalDefaults() {
        assertEquals(new TechnicalParameters(1000, 219, 45, 63.1, 13.6, 10.2, 2300), BuiltinParameters.technical());
    }

    @Test
    void defaultsAreLoadedOnce() {
        assertSame(BuiltinParameters.economic(), EconomicParameters.defaults());
        assertSame(BuiltinParameters.environmental(), BuiltinParameters.environmental());
        assertSame(BuiltinParameters.technical(), BuiltinParameters.technical());
    }

    @Test
    void sellingPriceChangeReachesSensitivity() {
        EconomicParameters params = EconomicParameters.defaults().withSellingPrice(6.0);
        assertEquals(6.0, params.sellingPricePerKg());
        assertEquals(6.0, params.sensitivity().sellingPricePerKg());
        // defaults are untouched
        assertEquals(5.0, EconomicParameters.defaults().sellingPricePerKg());
    }
}
