package nl.bytesoflife.proteintea;

import nl.bytesoflife.proteintea.config.BuiltinParameters;
import nl.bytesoflife.proteintea.config.EconomicParameters;
import nl.bytesoflife.proteintea.config.EnvironmentalParameters;
import nl.bytesoflife.proteintea.economic.CostModel;
import nl.bytesoflife.proteintea.economic.CostReport;
import nl.bytesoflife.proteintea.economic.ProfitabilityInputs;
import nl.bytesoflife.proteintea.economic.ProfitabilityMetrics;
import nl.bytesoflife.proteintea.economic.ProfitabilityModel;
import nl.bytesoflife.proteintea.economic.sensitivity.SensitivityAnalyzer;
import nl.bytesoflife.proteintea.economic.sensitivity.SensitivityInputs;
import nl.bytesoflife.proteintea.economic.sensitivity.SensitivityReport;
import nl.bytesoflife.proteintea.environmental.ImpactCategory;
import nl.bytesoflife.proteintea.environmental.ImpactInputs;
import nl.bytesoflife.proteintea.environmental.ImpactModel;
import nl.bytesoflife.proteintea.environmental.ImpactReport;
import nl.bytesoflife.proteintea.environmental.allocation.AllocationResult;
import nl.bytesoflife.proteintea.sustainability.EcoEfficiency;
import nl.bytesoflife.proteintea.sustainability.EcoEfficiencyCalculator;
import nl.bytesoflife.proteintea.sustainability.RfProcessParameters;
import nl.bytesoflife.proteintea.sustainability.SustainabilityInputs;
import nl.bytesoflife.proteintea.sustainability.SustainabilityReport;
import nl.bytesoflife.proteintea.sustainability.SustainabilityScorer;
import nl.bytesoflife.proteintea.technical.ProteinRecovery;
import nl.bytesoflife.proteintea.technical.ProteinRecoveryCalculator;
import nl.bytesoflife.proteintea.technical.TechnicalParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for process analysis.
 * Runs the economic and the environmental branch from per-domain parameters; parameters
 * that are not set fall back to the bundled defaults.
 *
 * <pre>
 * ProcessAnalysisEngine engine = new ProcessAnalysisEngine()
 *     .withEconomicParameters(EconomicParameters.defaults().withSellingPrice(5.5));
 * EconomicAnalysis economics = engine.analyzeEconomics();
 * EnvironmentalAnalysis environment = engine.analyzeEnvironment(impactInputs, rf);
 * </pre>
 */
public class ProcessAnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(ProcessAnalysisEngine.class);

    private EconomicParameters economicParameters;
    private EnvironmentalParameters environmentalParameters;
    private TechnicalParameters technicalParameters;

    public ProcessAnalysisEngine withEconomicParameters(EconomicParameters parameters) {
        this.economicParameters = parameters;
        return this;
    }

    public ProcessAnalysisEngine withEnvironmentalParameters(EnvironmentalParameters parameters) {
        this.environmentalParameters = parameters;
        return this;
    }

    public ProcessAnalysisEngine withTechnicalParameters(TechnicalParameters parameters) {
        this.technicalParameters = parameters;
        return this;
    }

    public EconomicParameters getEconomicParameters() {
        return economicParameters != null ? economicParameters : BuiltinParameters.economic();
    }

    public EnvironmentalParameters getEnvironmentalParameters() {
        return environmentalParameters != null ? environmentalParameters : BuiltinParameters.environmental();
    }

    public TechnicalParameters getTechnicalParameters() {
        return technicalParameters != null ? technicalParameters : BuiltinParameters.technical();
    }

    /**
     * Mass and protein balance of the configured run.
     */
    public ProteinRecovery analyzeTechnical() {
        return new ProteinRecoveryCalculator().calculate(getTechnicalParameters());
    }

    /**
     * Cost breakdown, profitability and sensitivity of the configured economics.
     * When technical parameters are set on this engine, the annual production volume
     * of the run replaces the production volume of the economic parameters.
     */
    public EconomicAnalysis analyzeEconomics() {
        EconomicParameters params = getEconomicParameters();
        if (technicalParameters != null) {
            double volume = analyzeTechnical().annualProductionVolumeKg();
            log.debug("Production volume {} kg/yr taken from the technical parameters", volume);
            params = params.withProductionVolume(volume);
        }

        CostReport costs = new CostModel().calculate(params.costInputs());
        ProfitabilityMetrics profitability = new ProfitabilityModel().calculate(
                ProfitabilityInputs.of(params.costInputs(), costs, params.discountRate(), params.sellingPricePerKg()));
        SensitivityReport sensitivity = new SensitivityAnalyzer()
                .withConfig(params.sensitivity())
                .analyze(SensitivityInputs.from(params.costInputs()));

        log.info("Economic analysis: unit cost {} USD/kg, annual profit {} USD",
                costs.getUnitCost(), profitability.annualProfit());
        return new EconomicAnalysis(costs, profitability, sensitivity);
    }

    /**
     * Impacts, co-product allocation, sustainability score and eco-efficiency of one run.
     * The protein concentrate mass used for the score is the configured protein yield applied
     * to the product mass of {@code inputs}.
     *
     * @param inputs resource consumption of the run
     * @param rf     RF operating point, or null for the process without RF pretreatment
     */
    public EnvironmentalAnalysis analyzeEnvironment(ImpactInputs inputs, RfProcessParameters rf) {
        EnvironmentalParameters params = getEnvironmentalParameters();

        ImpactReport impacts = new ImpactModel().calculate(inputs);
        AllocationResult allocation = params.allocationModel().allocate(params.coProducts(), impacts);

        ProteinRecovery recovery = analyzeTechnical();
        double concentrateMass = recovery.proteinYieldPercent() / 100 * inputs.productMassKg();
        SustainabilityReport sustainability = new SustainabilityScorer()
                .score(SustainabilityInputs.of(impacts.getIntensity(), concentrateMass, rf));

        EcoEfficiency ecoEfficiency = new EcoEfficiencyCalculator().calculate(params.coProductValue(), impacts);

        log.info("Environmental analysis: GWP {} kg CO2e, sustainability score {}",
                impacts.getTotal(ImpactCategory.GWP), sustainability.getOverallScore());
        return new EnvironmentalAnalysis(impacts, allocation, sustainability, ecoEfficiency);
    }
}
