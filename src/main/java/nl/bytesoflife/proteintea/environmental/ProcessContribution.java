package nl.bytesoflife.proteintea.environmental;

/**
 * Impact attributed to one process step, tagged with its unit.
 *
 * @param process process step name, e.g. {@code electricity} or {@code thermal_treatment}
 * @param value   impact amount in {@code unit}
 * @param unit    unit of {@code value}
 */
public record ProcessContribution(String process, double value, Unit unit) {

    public ProcessContribution {
        if (process == null || process.isBlank()) {
            throw new IllegalArgumentException("Process name must not be blank");
        }
        if (unit == null) {
            throw new IllegalArgumentException("Unit must not be null for process " + process);
        }
    }

    /**
     * This contribution divided by the product mass, in the per-kg variant of its unit.
     */
    public ProcessContribution perKilogram(double massKg) {
        return new ProcessContribution(process, value / massKg, unit.perKilogram());
    }
}
