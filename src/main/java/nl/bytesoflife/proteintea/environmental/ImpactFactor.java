package nl.bytesoflife.proteintea.environmental;

/**
 * Characterization factor of one process step within one category.
 *
 * @param category category the factor contributes to
 * @param process  process step name reported on the contribution
 * @param factor   impact per unit of the driver
 * @param driver   activity quantity the factor applies to
 */
public record ImpactFactor(ImpactCategory category, String process, double factor, ImpactDriver driver) {

    public ImpactFactor {
        if (category == null || driver == null) {
            throw new IllegalArgumentException("Impact factor needs a category and a driver");
        }
        if (process == null || process.isBlank()) {
            throw new IllegalArgumentException("Process name must not be blank");
        }
        if (!(factor >= 0) || Double.isInfinite(factor)) {
            throw new IllegalArgumentException("Impact factor for " + process + " must be a finite non-negative number");
        }
    }
}
