package nl.bytesoflife.proteintea.environmental.allocation;

import nl.bytesoflife.proteintea.InvalidAllocationException;
import nl.bytesoflife.proteintea.InvalidInputException;
import nl.bytesoflife.proteintea.environmental.ImpactReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static nl.bytesoflife.proteintea.InputChecks.requireFraction;
import static nl.bytesoflife.proteintea.InputChecks.requireNonNegative;

/**
 * Splits impact or cost totals across co-products.
 *
 * <pre>
 * AllocationResult result = new AllocationModel()
 *     .withMethod(AllocationMethod.HYBRID)
 *     .withEconomicWeight(0.6)
 *     .allocate(coProducts, impactReport);
 * </pre>
 */
public class AllocationModel {

    private static final Logger log = LoggerFactory.getLogger(AllocationModel.class);

    public static final double DEFAULT_ECONOMIC_WEIGHT = 0.5;

    private AllocationMethod method = AllocationMethod.MASS;
    private double economicWeight = DEFAULT_ECONOMIC_WEIGHT;

    public AllocationModel withMethod(AllocationMethod method) {
        if (method == null) {
            throw new IllegalArgumentException("AllocationMethod must not be null");
        }
        this.method = method;
        return this;
    }

    /**
     * Weight of the economic share in hybrid allocation; the mass share gets the rest.
     */
    public AllocationModel withEconomicWeight(double economicWeight) {
        this.economicWeight = requireFraction("economic_weight", economicWeight);
        return this;
    }

    public AllocationMethod getMethod() {
        return method;
    }

    public double getEconomicWeight() {
        return economicWeight;
    }

    /**
     * Allocation factor per co-product; the factors sum to 1.
     */
    public Map<String, Double> factors(List<CoProduct> products) {
        validate(products);
        return switch (method) {
            case MASS -> massFactors(products, method);
            case ECONOMIC -> economicFactors(products, method);
            case HYBRID -> hybridFactors(products);
        };
    }

    public AllocationResult allocate(List<CoProduct> products, ImpactReport report) {
        return allocate(products, report.totals());
    }

    /**
     * Allocate arbitrary named totals, e.g. impact category totals or annual cost totals.
     */
    public AllocationResult allocate(List<CoProduct> products, Map<String, Double> totals) {
        Map<String, Double> factors = factors(products);

        Map<String, Map<String, Double>> allocated = new LinkedHashMap<>();
        for (Map.Entry<String, Double> factor : factors.entrySet()) {
            Map<String, Double> amounts = new LinkedHashMap<>();
            for (Map.Entry<String, Double> total : totals.entrySet()) {
                amounts.put(total.getKey(), factor.getValue() * total.getValue());
            }
            allocated.put(factor.getKey(), amounts);
        }

        log.debug("Allocated {} totals over {} co-products by {}", totals.size(), products.size(), method.key());
        return new AllocationResult(method, factors, allocated);
    }

    private static Map<String, Double> massFactors(List<CoProduct> products, AllocationMethod method) {
        double totalMass = 0;
        for (CoProduct product : products) {
            totalMass += product.massKg();
        }
        if (totalMass == 0) {
            throw new InvalidAllocationException(method.key(),
                    "Total co-product mass is zero, " + method.key() + " allocation is undefined");
        }
        Map<String, Double> factors = new LinkedHashMap<>();
        for (CoProduct product : products) {
            factors.put(product.name(), product.massKg() / totalMass);
        }
        return factors;
    }

    private static Map<String, Double> economicFactors(List<CoProduct> products, AllocationMethod method) {
        double totalValue = 0;
        for (CoProduct product : products) {
            totalValue += product.value();
        }
        if (totalValue == 0) {
            throw new InvalidAllocationException(method.key(),
                    "Total co-product value is zero, " + method.key() + " allocation is undefined");
        }
        Map<String, Double> factors = new LinkedHashMap<>();
        for (CoProduct product : products) {
            factors.put(product.name(), product.value() / totalValue);
        }
        return factors;
    }

    private Map<String, Double> hybridFactors(List<CoProduct> products) {
        Map<String, Double> economic = economicFactors(products, method);
        Map<String, Double> mass = massFactors(products, method);
        Map<String, Double> factors = new LinkedHashMap<>();
        for (CoProduct product : products) {
            String name = product.name();
            factors.put(name, economicWeight * economic.get(name) + (1 - economicWeight) * mass.get(name));
        }
        return factors;
    }

    private void validate(List<CoProduct> products) {
        if (products == null || products.isEmpty()) {
            throw new InvalidInputException("co_products", "must contain at least one product");
        }
        Set<String> names = new HashSet<>();
        for (CoProduct product : products) {
            if (!names.add(product.name())) {
                throw new InvalidInputException("co_products", "contains duplicate product " + product.name());
            }
            requireNonNegative("mass_kg", product.massKg());
            if (product.hasPrice()) {
                requireNonNegative("price_per_kg", product.pricePerKg());
            } else if (method.requiresPrices()) {
                throw new InvalidInputException("price_per_kg",
                        "is required for " + method.key() + " allocation (missing for " + product.name() + ")");
            }
        }
    }
}
