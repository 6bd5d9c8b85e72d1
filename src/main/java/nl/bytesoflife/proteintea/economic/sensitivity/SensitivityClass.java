package nl.bytesoflife.proteintea.economic.sensitivity;

/**
 * Qualitative sensitivity class from fixed cut points on |impact %|:
 * below 5 is LOW, from 5 up to (not including) 15 is MEDIUM, 15 and above is HIGH.
 */
public enum SensitivityClass {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    public static final double MEDIUM_THRESHOLD = 5.0;
    public static final double HIGH_THRESHOLD = 15.0;

    private final String label;

    SensitivityClass(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SensitivityClass classify(double impactPercent) {
        double magnitude = Math.abs(impactPercent);
        if (magnitude < MEDIUM_THRESHOLD) return LOW;
        if (magnitude < HIGH_THRESHOLD) return MEDIUM;
        return HIGH;
    }
}
