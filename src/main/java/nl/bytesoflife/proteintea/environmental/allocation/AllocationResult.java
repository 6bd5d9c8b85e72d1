package nl.bytesoflife.proteintea.environmental.allocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Allocation factors per co-product and the totals allocated with them.
 * Both maps keep the co-product order of the request.
 */
public class AllocationResult {

    private final AllocationMethod method;
    private final Map<String, Double> factors;
    private final Map<String, Map<String, Double>> allocated;

    public AllocationResult(AllocationMethod method, Map<String, Double> factors,
                            Map<String, Map<String, Double>> allocated) {
        this.method = method;
        this.factors = Collections.unmodifiableMap(new LinkedHashMap<>(factors));
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Double>> entry : allocated.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
        }
        this.allocated = Collections.unmodifiableMap(copy);
    }

    public AllocationMethod getMethod() {
        return method;
    }

    public Map<String, Double> getFactors() {
        return factors;
    }

    public double getFactor(String product) {
        Double factor = factors.get(product);
        if (factor == null) {
            throw new IllegalArgumentException("Unknown co-product: " + product);
        }
        return factor;
    }

    /**
     * product → (total key → allocated amount).
     */
    public Map<String, Map<String, Double>> getAllocatedImpacts() {
        return allocated;
    }

    public Map<String, Double> getAllocated(String product) {
        Map<String, Double> amounts = allocated.get(product);
        if (amounts == null) {
            throw new IllegalArgumentException("Unknown co-product: " + product);
        }
        return amounts;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Allocation (" + method.key() + "):\n");
        for (Map.Entry<String, Double> entry : factors.entrySet()) {
            sb.append(String.format(Locale.US, "  - %s: %.4f", entry.getKey(), entry.getValue())).append("\n");
        }
        return sb.toString();
    }
}
