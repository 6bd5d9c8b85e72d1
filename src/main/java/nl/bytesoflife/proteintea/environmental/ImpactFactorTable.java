package nl.bytesoflife.proteintea.environmental;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Named set of characterization factors. Factor order is the contribution order in reports.
 */
public class ImpactFactorTable {

    private final String name;
    private final List<ImpactFactor> factors;

    public ImpactFactorTable(String name, List<ImpactFactor> factors) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Factor table name must not be blank");
        }
        if (factors == null || factors.isEmpty()) {
            throw new IllegalArgumentException("Factor table must have at least one factor");
        }
        Set<String> seen = new HashSet<>();
        for (ImpactFactor factor : factors) {
            if (!seen.add(factor.category().key() + "/" + factor.process())) {
                throw new IllegalArgumentException("Duplicate factor " + factor.process()
                        + " in category " + factor.category().key());
            }
        }
        this.name = name;
        this.factors = List.copyOf(factors);
    }

    public String getName() {
        return name;
    }

    public List<ImpactFactor> getFactors() {
        return factors;
    }

    public List<ImpactFactor> getFactors(ImpactCategory category) {
        List<ImpactFactor> result = new ArrayList<>();
        for (ImpactFactor factor : factors) {
            if (factor.category() == category) {
                result.add(factor);
            }
        }
        return result;
    }
}
