package nl.bytesoflife.proteintea.environmental;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinImpactFactorsTest {

    @Test
    void dryFractionationHasThreeFactorsPerCategory() {
        ImpactFactorTable table = BuiltinImpactFactors.dryFractionation();
        assertEquals("Dry Fractionation", table.getName());
        for (ImpactCategory category : ImpactCategory.values()) {
            assertEquals(3, table.getFactors(category).size(), category.key());
        }
    }

    @Test
    void dryFractionationIsCached() {
        assertSame(BuiltinImpactFactors.dryFractionation(), BuiltinImpactFactors.dryFractionation());
    }

    @Test
    void coolingFactorIsDrivenByCoolingEnergy() {
        ImpactFactor cooling = BuiltinImpactFactors.dryFractionation().getFactors(ImpactCategory.WATER_CONSUMPTION)
                .get(2);
        assertEquals("cooling", cooling.process());
        assertEquals(0.3, cooling.factor());
        assertEquals(ImpactDriver.COOLING_KWH, cooling.driver());
    }

    @Test
    void unitsHavePerKgVariants() {
        assertEquals(Unit.KG_CO2_EQ_PER_KG, Unit.KG_CO2_EQ.perKilogram());
        assertEquals(Unit.CTUH_PER_KG, Unit.CTUH_PER_KG.perKilogram());
        assertTrue(Unit.KG_WATER_PER_KG.isPerKilogram());
        assertFalse(Unit.KG_OIL_EQ.isPerKilogram());
        assertEquals("kg_CO2_eq", Unit.KG_CO2_EQ.symbol());
    }

    @Test
    void categoryKeysRoundTrip() {
        for (ImpactCategory category : ImpactCategory.values()) {
            assertEquals(category, ImpactCategory.fromKey(category.key()));
        }
        assertThrows(IllegalArgumentException.class, () -> ImpactCategory.fromKey("ozone"));
    }
}
