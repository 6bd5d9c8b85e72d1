package nl.bytesoflife.proteintea.economic.sensitivity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static nl.bytesoflife.proteintea.InputChecks.requireNonNegative;

/**
 * Perturbs the cost drivers one at a time and reports how much the annual profit moves.
 *
 * <pre>
 * SensitivityReport report = new SensitivityAnalyzer()
 *     .withConfig(SensitivityConfig.defaults())
 *     .analyze(SensitivityInputs.from(costInputs));
 * </pre>
 */
public class SensitivityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SensitivityAnalyzer.class);

    private SensitivityConfig config = SensitivityConfig.defaults();

    public SensitivityAnalyzer withConfig(SensitivityConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("SensitivityConfig must not be null");
        }
        this.config = config;
        return this;
    }

    public SensitivityConfig getConfig() {
        return config;
    }

    /**
     * Raise each parameter by the configured perturbation and classify the profit impact.
     */
    public SensitivityReport analyze(SensitivityInputs base) {
        validate(base);
        double baseProfit = profit(base);
        if (baseProfit == 0) {
            log.warn("Base profit is zero, sensitivity impacts are undefined");
        }

        List<SensitivityRow> rows = new ArrayList<>();
        for (SensitivityParameter parameter : SensitivityParameter.values()) {
            double baseValue = parameter.get(base);
            double modified = profit(parameter.with(base, baseValue * (1 + config.perturbation())));
            Double impact = impactPercent(baseProfit, modified);
            SensitivityClass cls = impact == null ? null : SensitivityClass.classify(impact);
            rows.add(new SensitivityRow(parameter, baseValue, impact, cls));
        }

        log.debug("Sensitivity analysis: base profit {}, {} parameters", baseProfit, rows.size());
        return new SensitivityReport(baseProfit, config.perturbation(), rows);
    }

    /**
     * Profit response of one parameter over {@code [1 - range, 1 + range]} of its base value.
     */
    public SensitivityCurve curve(SensitivityInputs base, SensitivityParameter parameter) {
        validate(base);
        double baseProfit = profit(base);
        double baseValue = parameter.get(base);
        int steps = config.steps();
        double range = config.sensitivityRange();

        List<SensitivityPoint> points = new ArrayList<>(steps + 1);
        for (int i = 0; i <= steps; i++) {
            // centered so the middle step lands exactly on 1.0
            double factor = 1 + range * (2.0 * i - steps) / steps;
            double value = baseValue * factor;
            double profit = profit(parameter.with(base, value));
            points.add(new SensitivityPoint(factor, value, profit, impactPercent(baseProfit, profit)));
        }
        return new SensitivityCurve(parameter, baseValue, baseProfit, points);
    }

    /**
     * Annual profit under straight-line equipment depreciation, USD/year.
     */
    public double profit(SensitivityInputs inputs) {
        double volume = inputs.productionVolume();
        double revenue = volume * config.sellingPricePerKg();
        double fixed = inputs.equipmentCost() / config.depreciationYears() + inputs.maintenanceCost();
        double variable = (inputs.rawMaterialCost() + inputs.utilityCost() + inputs.laborCost()) * volume;
        return revenue - (fixed + variable);
    }

    private static Double impactPercent(double baseProfit, double modifiedProfit) {
        if (baseProfit == 0) {
            return null;
        }
        return (modifiedProfit - baseProfit) / baseProfit * 100;
    }

    private static void validate(SensitivityInputs base) {
        if (base == null) {
            throw new IllegalArgumentException("SensitivityInputs must not be null");
        }
        for (SensitivityParameter parameter : SensitivityParameter.values()) {
            requireNonNegative(parameter.key(), parameter.get(base));
        }
    }
}
