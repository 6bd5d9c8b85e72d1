package nl.bytesoflife.proteintea.environmental.allocation;

import nl.bytesoflife.proteintea.InvalidAllocationException;
import nl.bytesoflife.proteintea.InvalidInputException;
import nl.bytesoflife.proteintea.environmental.ConsumptionMetrics;
import nl.bytesoflife.proteintea.environmental.ImpactInputs;
import nl.bytesoflife.proteintea.environmental.ImpactModel;
import nl.bytesoflife.proteintea.environmental.ImpactReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AllocationModelTest {

    private static final List<CoProduct> PRICED = List.of(
            new CoProduct("protein_isolate", 100, 6.0),
            new CoProduct("starch", 100, 2.0));

    @Test
    void massAllocationScenario() {
        List<CoProduct> products = List.of(CoProduct.ofMass("a", 300), CoProduct.ofMass("b", 700));
        AllocationResult result = new AllocationModel()
                .withMethod(AllocationMethod.MASS)
                .allocate(products, Map.of("gwp", 1000.0));

        assertEquals(0.3, result.getFactor("a"), 1e-12);
        assertEquals(0.7, result.getFactor("b"), 1e-12);
        assertEquals(300, result.getAllocated("a").get("gwp"), 1e-9);
        assertEquals(700, result.getAllocated("b").get("gwp"), 1e-9);
    }

    @Test
    void economicAllocationUsesMarketValue() {
        Map<String, Double> factors = new AllocationModel().withMethod(AllocationMethod.ECONOMIC).factors(PRICED);
        assertEquals(0.75, factors.get("protein_isolate"), 1e-12);
        assertEquals(0.25, factors.get("starch"), 1e-12);
    }

    @Test
    void hybridBlendsEconomicAndMassShares() {
        Map<String, Double> factors = new AllocationModel()
                .withMethod(AllocationMethod.HYBRID)
                .withEconomicWeight(0.6)
                .factors(PRICED);
        // 0.6 x 0.75 + 0.4 x 0.5
        assertEquals(0.65, factors.get("protein_isolate"), 1e-12);
        assertEquals(0.35, factors.get("starch"), 1e-12);
    }

    @Test
    void hybridDefaultsToEqualWeights() {
        AllocationModel model = new AllocationModel().withMethod(AllocationMethod.HYBRID);
        assertEquals(0.5, model.getEconomicWeight());
        assertEquals(0.625, model.factors(PRICED).get("protein_isolate"), 1e-12);
    }

    @ParameterizedTest
    @EnumSource(AllocationMethod.class)
    void factorsSumToOneAndAllocationsSumBack(AllocationMethod method) {
        List<CoProduct> products = List.of(
                new CoProduct("protein_isolate", 1000, 6.5),
                new CoProduct("starch", 300, 2.3),
                new CoProduct("fiber", 200, 1.8));
        Map<String, Double> totals = new LinkedHashMap<>();
        totals.put("gwp", 1234.5);
        totals.put("water_consumption", 98_765.0);

        AllocationResult result = new AllocationModel().withMethod(method).withEconomicWeight(0.3)
                .allocate(products, totals);

        double factorSum = result.getFactors().values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(1.0, factorSum, 1e-6);
        for (Map.Entry<String, Double> total : totals.entrySet()) {
            double allocatedSum = 0;
            for (Map<String, Double> amounts : result.getAllocatedImpacts().values()) {
                allocatedSum += amounts.get(total.getKey());
            }
            assertEquals(total.getValue(), allocatedSum, total.getValue() * 1e-9);
        }
        assertEquals(method, result.getMethod());
    }

    @Test
    void allocatesImpactReportTotals() {
        ImpactInputs inputs = new ImpactInputs(ConsumptionMetrics.of(240, 30_000), 500, 10, 1000, 200, 0.5);
        ImpactReport report = new ImpactModel().calculate(inputs);
        List<CoProduct> products = List.of(CoProduct.ofMass("a", 300), CoProduct.ofMass("b", 700));

        AllocationResult result = new AllocationModel().allocate(products, report);

        assertEquals(60, result.getAllocated("a").get("gwp"), 1e-9);
        assertEquals(4, result.getAllocated("a").size());
    }

    @Test
    void productOrderIsPreserved() {
        List<CoProduct> products = List.of(CoProduct.ofMass("z", 1), CoProduct.ofMass("a", 1), CoProduct.ofMass("m", 1));
        AllocationResult result = new AllocationModel().allocate(products, Map.of("cost", 3.0));
        assertEquals(List.of("z", "a", "m"), List.copyOf(result.getFactors().keySet()));
    }

    @Test
    void physicalIsMassAllocation() {
        assertEquals(AllocationMethod.MASS, AllocationMethod.fromKey("physical"));
        assertEquals(AllocationMethod.HYBRID, AllocationMethod.fromKey("Hybrid"));
        assertThrows(IllegalArgumentException.class, () -> AllocationMethod.fromKey("energy"));
    }

    @Test
    void zeroTotalMassIsInvalidAllocation() {
        List<CoProduct> products = List.of(CoProduct.ofMass("a", 0), CoProduct.ofMass("b", 0));
        InvalidAllocationException e = assertThrows(InvalidAllocationException.class,
                () -> new AllocationModel().factors(products));
        assertEquals("mass", e.getMethod());
    }

    @Test
    void zeroTotalValueIsInvalidAllocation() {
        List<CoProduct> products = List.of(new CoProduct("a", 10, 0.0), new CoProduct("b", 20, 0.0));
        InvalidAllocationException e = assertThrows(InvalidAllocationException.class,
                () -> new AllocationModel().withMethod(AllocationMethod.ECONOMIC).factors(products));
        assertEquals("economic", e.getMethod());
    }

    @Test
    void failedHybridAllocationNamesHybrid() {
        List<CoProduct> worthless = List.of(new CoProduct("a", 10, 0.0), new CoProduct("b", 20, 0.0));
        InvalidAllocationException noValue = assertThrows(InvalidAllocationException.class,
                () -> new AllocationModel().withMethod(AllocationMethod.HYBRID).factors(worthless));
        assertEquals("hybrid", noValue.getMethod());
        assertTrue(noValue.getMessage().contains("hybrid allocation"), noValue.getMessage());

        List<CoProduct> massless = List.of(new CoProduct("a", 0, 2.0), new CoProduct("b", 0, 3.0));
        InvalidAllocationException noMass = assertThrows(InvalidAllocationException.class,
                () -> new AllocationModel().withMethod(AllocationMethod.HYBRID).factors(massless));
        assertEquals("hybrid", noMass.getMethod());
    }

    @Test
    void missingPriceIsRejectedForEconomicAllocation() {
        List<CoProduct> products = List.of(new CoProduct("a", 10, 2.0), CoProduct.ofMass("b", 20));
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> new AllocationModel().withMethod(AllocationMethod.ECONOMIC).factors(products));
        assertEquals("price_per_kg", e.getField());
        // mass allocation does not need prices
        assertEquals(2.0 / 3, new AllocationModel().factors(products).get("b"), 1e-12);
    }

    @Test
    void invalidProductListsAreRejected() {
        AllocationModel model = new AllocationModel();
        assertThrows(InvalidInputException.class, () -> model.factors(List.of()));
        assertThrows(InvalidInputException.class,
                () -> model.factors(List.of(CoProduct.ofMass("a", 1), CoProduct.ofMass("a", 2))));
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> model.factors(List.of(CoProduct.ofMass("a", -1))));
        assertEquals("mass_kg", e.getField());
    }

    @Test
    void economicWeightOutsideUnitIntervalIsRejected() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> new AllocationModel().withEconomicWeight(1.5));
        assertEquals("economic_weight", e.getField());
    }
}
