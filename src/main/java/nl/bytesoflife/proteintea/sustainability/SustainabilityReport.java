package nl.bytesoflife.proteintea.sustainability;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Overall sustainability score, its weighted components and the RF bands that were violated.
 */
public class SustainabilityReport {

    private final double overallScore;
    private final List<SubScore> subScores;
    private final List<BandViolation> violations;

    public SustainabilityReport(double overallScore, List<SubScore> subScores, List<BandViolation> violations) {
        this.overallScore = overallScore;
        this.subScores = List.copyOf(subScores);
        this.violations = List.copyOf(violations);
    }

    public double getOverallScore() {
        return overallScore;
    }

    public List<SubScore> getSubScores() {
        return subScores;
    }

    public Optional<SubScore> getSubScore(ScoreComponent component) {
        return subScores.stream().filter(s -> s.component() == component).findFirst();
    }

    public List<BandViolation> getViolations() {
        return violations;
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Sustainability Report:\n");
        sb.append(String.format(Locale.US, "  Overall score: %.1f", overallScore)).append("\n");
        for (SubScore subScore : subScores) {
            sb.append(String.format(Locale.US, "  - %s: %.1f (value %.3f, target %.3f, weight %.2f)",
                    subScore.component().key(), subScore.score(), subScore.value(),
                    subScore.target(), subScore.weight())).append("\n");
        }
        if (!violations.isEmpty()) {
            sb.append("  Out of band:\n");
            for (BandViolation violation : violations) {
                sb.append(String.format(Locale.US, "    - %s: %.2f %s (target %.2f ± %.2f)",
                        violation.metricName(), violation.currentValue(), violation.unit(),
                        violation.target(), violation.tolerance())).append("\n");
            }
        }
        return sb.toString();
    }
}
