package nl.bytesoflife.proteintea.sustainability;

/**
 * Acceptable operating range {@code target ± tolerance} of one RF metric. Both limits are inclusive.
 */
public record BenchmarkBand(BandMetric metric, double target, double tolerance) {

    public BenchmarkBand {
        if (metric == null) {
            throw new IllegalArgumentException("Band metric must not be null");
        }
        if (!(tolerance >= 0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("Band tolerance must be a finite non-negative number");
        }
    }

    public boolean contains(double value) {
        return Math.abs(value - target) <= tolerance;
    }
}
