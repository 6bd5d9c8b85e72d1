package nl.bytesoflife.proteintea.sustainability;

import java.util.List;
import java.util.Map;

/**
 * Factory for built-in sustainability benchmark sets.
 */
public class BuiltinBenchmarks {

    public static final double RF_ENERGY_CONTRIBUTION_PERCENT = 19.0;
    public static final double PROTEIN_YIELD_PERCENT = 21.9;
    public static final double MAX_ENERGY_INTENSITY = 0.65;
    public static final double MAX_WATER_INTENSITY = 0.55;

    private static volatile SustainabilityBenchmarks cachedRfTreatment;

    /**
     * Benchmarks of the RF-pretreated dry fractionation process.
     * <ul>
     *   <li>RF treatment efficiency: 19% energy contribution, weight 0.35</li>
     *   <li>Process efficiency: 21.9% protein yield, weight 0.35</li>
     *   <li>Energy efficiency: 1 - 0.65 kWh/kg, weight 0.20</li>
     *   <li>Resource conservation: 1 - 0.55 kg/kg, weight 0.10</li>
     *   <li>Bands: outfeed 84.4 ± 5 °C, electrode 100.1 ± 5 °C, RF energy 19 ± 1 %</li>
     * </ul>
     */
    public static SustainabilityBenchmarks rfTreatment() {
        if (cachedRfTreatment == null) {
            synchronized (BuiltinBenchmarks.class) {
                if (cachedRfTreatment == null) {
                    cachedRfTreatment = createRfTreatment();
                }
            }
        }
        return cachedRfTreatment;
    }

    private static SustainabilityBenchmarks createRfTreatment() {
        return new SustainabilityBenchmarks("RF Treatment", Map.of(
                ScoreComponent.RF_TREATMENT_EFFICIENCY, new ScoreTarget(RF_ENERGY_CONTRIBUTION_PERCENT, 0.35),
                ScoreComponent.PROCESS_EFFICIENCY, new ScoreTarget(PROTEIN_YIELD_PERCENT, 0.35),
                ScoreComponent.ENERGY_EFFICIENCY, new ScoreTarget(1 - MAX_ENERGY_INTENSITY, 0.20),
                ScoreComponent.RESOURCE_CONSERVATION, new ScoreTarget(1 - MAX_WATER_INTENSITY, 0.10)
        ), List.of(
                new BenchmarkBand(BandMetric.TEMPERATURE_OUTFEED, 84.4, 5.0),
                new BenchmarkBand(BandMetric.TEMPERATURE_ELECTRODE, 100.1, 5.0),
                new BenchmarkBand(BandMetric.ENERGY_CONTRIBUTION, RF_ENERGY_CONTRIBUTION_PERCENT, 1.0)
        ));
    }
}
