package nl.bytesoflife.proteintea;

import nl.bytesoflife.proteintea.environmental.ImpactReport;
import nl.bytesoflife.proteintea.environmental.allocation.AllocationResult;
import nl.bytesoflife.proteintea.sustainability.EcoEfficiency;
import nl.bytesoflife.proteintea.sustainability.SustainabilityReport;

/**
 * Results of the environmental branch.
 */
public record EnvironmentalAnalysis(
        ImpactReport impacts,
        AllocationResult allocation,
        SustainabilityReport sustainability,
        EcoEfficiency ecoEfficiency
) {
}
