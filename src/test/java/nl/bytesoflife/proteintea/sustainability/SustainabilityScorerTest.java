package nl.bytesoflife.proteintea.sustainability;

import nl.bytesoflife.proteintea.InvalidInputException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SustainabilityScorerTest {

    private static final RfProcessParameters ON_TARGET = RfProcessParameters.of(84.4, 100.1, 19.0);

    private static SustainabilityInputs inputs(RfProcessParameters rf) {
        return new SustainabilityInputs(1000, 219, 0.3, 0.4, rf);
    }

    @Test
    void subScoresAreValueOverTargetTimesWeight() {
        SustainabilityReport report = new SustainabilityScorer().score(inputs(ON_TARGET));

        assertEquals(4, report.getSubScores().size());
        assertEquals(35, report.getSubScore(ScoreComponent.RF_TREATMENT_EFFICIENCY).orElseThrow().score(), 1e-9);
        assertEquals(35, report.getSubScore(ScoreComponent.PROCESS_EFFICIENCY).orElseThrow().score(), 1e-9);
        // (1 - 0.3) / (1 - 0.65) x 0.20
        assertEquals(40, report.getSubScore(ScoreComponent.ENERGY_EFFICIENCY).orElseThrow().score(), 1e-9);
        // (1 - 0.4) / (1 - 0.55) x 0.10
        assertEquals(13.3333, report.getSubScore(ScoreComponent.RESOURCE_CONSERVATION).orElseThrow().score(), 1e-4);
        assertEquals(123.3333, report.getOverallScore(), 1e-4);
    }

    @Test
    void processEfficiencyUsesProteinYield() {
        SubScore process = new SustainabilityScorer().score(inputs(ON_TARGET))
                .getSubScore(ScoreComponent.PROCESS_EFFICIENCY).orElseThrow();
        assertEquals(21.9, process.value(), 1e-9);
        assertEquals(21.9, process.target());
        assertEquals(0.35, process.weight());
    }

    @Test
    void onTargetRunHasNoViolations() {
        SustainabilityReport report = new SustainabilityScorer().score(inputs(ON_TARGET));
        assertFalse(report.hasViolations());
    }

    @Test
    void hotOutfeedIsReported() {
        RfProcessParameters rf = RfProcessParameters.of(90.0, 100.1, 19.0);
        List<BandViolation> violations = new SustainabilityScorer().score(inputs(rf)).getViolations();

        assertEquals(1, violations.size());
        BandViolation violation = violations.get(0);
        assertEquals("temperature_outfeed", violation.metricName());
        assertEquals(90.0, violation.currentValue());
        assertEquals(84.4, violation.target());
        assertEquals(5.0, violation.tolerance());
        assertEquals("°C", violation.unit());
        assertEquals(5.6, violation.deviation(), 1e-9);
    }

    @Test
    void bandsAreCheckedIndependently() {
        RfProcessParameters rf = RfProcessParameters.of(70.0, 110.0, 21.0);
        List<BandViolation> violations = new SustainabilityScorer().checkBands(rf);
        assertEquals(List.of("temperature_outfeed", "temperature_electrode", "energy_contribution"),
                violations.stream().map(BandViolation::metricName).toList());
    }

    @Test
    void valueInsideToleranceIsAccepted() {
        RfProcessParameters rf = RfProcessParameters.of(80.0, 104.0, 18.5);
        assertTrue(new SustainabilityScorer().checkBands(rf).isEmpty());
    }

    @Test
    void baselineProcessSkipsRfScoreAndBands() {
        SustainabilityReport report = new SustainabilityScorer().score(inputs(null));

        assertEquals(3, report.getSubScores().size());
        assertTrue(report.getSubScore(ScoreComponent.RF_TREATMENT_EFFICIENCY).isEmpty());
        assertFalse(report.hasViolations());
        // remaining weights are not rescaled
        assertEquals(88.3333, report.getOverallScore(), 1e-4);
    }

    @Test
    void noRfParametersMeansNoBandChecks() {
        assertTrue(new SustainabilityScorer().checkBands(null).isEmpty());
    }

    @Test
    void anodeBandOnlyWhenConfiguredAndMeasured() {
        SustainabilityBenchmarks withAnode = BuiltinBenchmarks.rfTreatment()
                .withBand(new BenchmarkBand(BandMetric.ANODE_CURRENT, 1.2, 0.1));
        SustainabilityScorer scorer = new SustainabilityScorer().withBenchmarks(withAnode);

        RfProcessParameters unmeasured = RfProcessParameters.of(84.4, 100.1, 19.0);
        assertTrue(scorer.checkBands(unmeasured).isEmpty());

        RfProcessParameters high = new RfProcessParameters(84.4, 100.1, 19.0, 1.5, null);
        List<BandViolation> violations = scorer.checkBands(high);
        assertEquals(1, violations.size());
        assertEquals("anode_current", violations.get(0).metricName());
        assertEquals("A", violations.get(0).unit());

        // the built-in set itself has no current bands
        assertTrue(new SustainabilityScorer().checkBands(high).isEmpty());
    }

    @Test
    void zeroTotalMassIsRejected() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> new SustainabilityScorer().score(new SustainabilityInputs(0, 0, 0.3, 0.4, null)));
        assertEquals("total_mass", e.getField());
    }

    @Test
    void builtinBenchmarks() {
        SustainabilityBenchmarks benchmarks = BuiltinBenchmarks.rfTreatment();
        assertSame(benchmarks, BuiltinBenchmarks.rfTreatment());
        assertEquals(3, benchmarks.getBands().size());
        assertEquals(0.35, benchmarks.getTarget(ScoreComponent.ENERGY_EFFICIENCY).target(), 1e-12);
        double weights = 0;
        for (ScoreTarget target : benchmarks.getTargets().values()) {
            weights += target.weight();
        }
        assertEquals(1.0, weights, 1e-12);
    }
}
