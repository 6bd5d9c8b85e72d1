package nl.bytesoflife.proteintea.config;

import nl.bytesoflife.proteintea.environmental.allocation.AllocationMethod;
import nl.bytesoflife.proteintea.environmental.allocation.AllocationModel;
import nl.bytesoflife.proteintea.environmental.allocation.CoProduct;

import java.util.List;

/**
 * Environmental inputs of an analysis: co-products and how burdens are split between them.
 *
 * @param allocationMethod allocation method
 * @param economicWeight   economic share weight for hybrid allocation, 0..1
 * @param coProducts       co-products in report order
 */
public record EnvironmentalParameters(
        AllocationMethod allocationMethod,
        double economicWeight,
        List<CoProduct> coProducts
) {

    public EnvironmentalParameters {
        if (allocationMethod == null) {
            throw new IllegalArgumentException("Allocation method must not be null");
        }
        coProducts = List.copyOf(coProducts);
    }

    public static EnvironmentalParameters defaults() {
        return BuiltinParameters.environmental();
    }

    public EnvironmentalParameters withAllocationMethod(AllocationMethod allocationMethod) {
        return new EnvironmentalParameters(allocationMethod, economicWeight, coProducts);
    }

    public EnvironmentalParameters withCoProducts(List<CoProduct> coProducts) {
        return new EnvironmentalParameters(allocationMethod, economicWeight, coProducts);
    }

    public AllocationModel allocationModel() {
        return new AllocationModel()
                .withMethod(allocationMethod)
                .withEconomicWeight(economicWeight);
    }

    /**
     * Market value of the priced co-products, USD.
     */
    public double coProductValue() {
        double value = 0;
        for (CoProduct product : coProducts) {
            value += product.value();
        }
        return value;
    }
}
