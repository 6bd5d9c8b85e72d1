package nl.bytesoflife.proteintea.sustainability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static nl.bytesoflife.proteintea.InputChecks.requireFinite;
import static nl.bytesoflife.proteintea.InputChecks.requireNonNegative;
import static nl.bytesoflife.proteintea.InputChecks.requirePositive;

/**
 * Scores a process run against sustainability benchmarks and checks the RF operating bands.
 * <p>
 * Without RF parameters the RF component and all band checks are skipped; the remaining
 * components keep their weights, so the maximum attainable score drops accordingly.
 */
public class SustainabilityScorer {

    private static final Logger log = LoggerFactory.getLogger(SustainabilityScorer.class);

    private SustainabilityBenchmarks benchmarks = BuiltinBenchmarks.rfTreatment();

    public SustainabilityScorer withBenchmarks(SustainabilityBenchmarks benchmarks) {
        if (benchmarks == null) {
            throw new IllegalArgumentException("SustainabilityBenchmarks must not be null");
        }
        this.benchmarks = benchmarks;
        return this;
    }

    public SustainabilityBenchmarks getBenchmarks() {
        return benchmarks;
    }

    public SustainabilityReport score(SustainabilityInputs inputs) {
        if (inputs == null) {
            throw new IllegalArgumentException("SustainabilityInputs must not be null");
        }
        requirePositive("total_mass", inputs.totalMassKg());
        requireNonNegative("protein_concentrate_mass", inputs.proteinConcentrateMassKg());
        requireFinite("energy_intensity", inputs.energyIntensity());
        requireFinite("water_intensity", inputs.waterIntensity());

        List<SubScore> subScores = new ArrayList<>();
        if (inputs.hasRfTreatment()) {
            subScores.add(SubScore.of(ScoreComponent.RF_TREATMENT_EFFICIENCY,
                    inputs.rf().energyContributionPercent(),
                    benchmarks.getTarget(ScoreComponent.RF_TREATMENT_EFFICIENCY)));
        }
        subScores.add(SubScore.of(ScoreComponent.PROCESS_EFFICIENCY,
                inputs.proteinYieldPercent(), benchmarks.getTarget(ScoreComponent.PROCESS_EFFICIENCY)));
        subScores.add(SubScore.of(ScoreComponent.ENERGY_EFFICIENCY,
                1 - inputs.energyIntensity(), benchmarks.getTarget(ScoreComponent.ENERGY_EFFICIENCY)));
        subScores.add(SubScore.of(ScoreComponent.RESOURCE_CONSERVATION,
                1 - inputs.waterIntensity(), benchmarks.getTarget(ScoreComponent.RESOURCE_CONSERVATION)));

        double overall = 0;
        for (SubScore subScore : subScores) {
            overall += subScore.score();
        }

        List<BandViolation> violations = inputs.hasRfTreatment() ? checkBands(inputs.rf()) : List.of();
        log.debug("Sustainability score {} with {} band violations", overall, violations.size());
        return new SustainabilityReport(overall, subScores, violations);
    }

    /**
     * Every configured band whose metric is measured and falls outside {@code target ± tolerance}.
     * Without RF parameters there is nothing to check.
     */
    public List<BandViolation> checkBands(RfProcessParameters rf) {
        if (rf == null) {
            return List.of();
        }
        List<BandViolation> violations = new ArrayList<>();
        for (BenchmarkBand band : benchmarks.getBands()) {
            Double value = band.metric().get(rf);
            if (value == null || band.contains(value)) {
                continue;
            }
            violations.add(new BandViolation(band.metric().key(), value, band.target(), band.tolerance(),
                    band.metric().unit()));
        }
        return violations;
    }
}
