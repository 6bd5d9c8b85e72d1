package nl.bytesoflife.proteintea.sustainability;

/**
 * Benchmark value a score component is measured against, and its weight in the overall score.
 */
public record ScoreTarget(double target, double weight) {

    public ScoreTarget {
        if (!(target > 0) || Double.isInfinite(target)) {
            throw new IllegalArgumentException("Score target must be a finite positive number");
        }
        if (!(weight >= 0 && weight <= 1)) {
            throw new IllegalArgumentException("Score weight must be between 0 and 1");
        }
    }
}
