package nl.bytesoflife.proteintea.sustainability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Score targets and RF operating bands used by the sustainability scorer.
 */
public class SustainabilityBenchmarks {

    private final String name;
    private final Map<ScoreComponent, ScoreTarget> targets;
    private final List<BenchmarkBand> bands;

    public SustainabilityBenchmarks(String name, Map<ScoreComponent, ScoreTarget> targets,
                                    List<BenchmarkBand> bands) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Benchmark set name must not be blank");
        }
        EnumMap<ScoreComponent, ScoreTarget> copy = new EnumMap<>(ScoreComponent.class);
        for (ScoreComponent component : ScoreComponent.values()) {
            ScoreTarget target = targets.get(component);
            if (target == null) {
                throw new IllegalArgumentException("Missing target for score component " + component.key());
            }
            copy.put(component, target);
        }
        this.name = name;
        this.targets = Collections.unmodifiableMap(copy);
        this.bands = List.copyOf(bands);
    }

    public String getName() {
        return name;
    }

    public ScoreTarget getTarget(ScoreComponent component) {
        return targets.get(component);
    }

    public Map<ScoreComponent, ScoreTarget> getTargets() {
        return targets;
    }

    public List<BenchmarkBand> getBands() {
        return bands;
    }

    /**
     * A copy with an extra band, e.g. for anode or grid current once their ranges are known.
     */
    public SustainabilityBenchmarks withBand(BenchmarkBand band) {
        List<BenchmarkBand> extended = new ArrayList<>(bands);
        extended.add(band);
        return new SustainabilityBenchmarks(name, targets, extended);
    }
}
