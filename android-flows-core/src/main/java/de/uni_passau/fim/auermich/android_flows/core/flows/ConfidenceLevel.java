package de.uni_passau.fim.auermich.android_flows.core.flows;

/**
 * A coarse classification of a confidence score. The thresholds only classify a score, they don't change it.
 */
public enum ConfidenceLevel {

    HIGH(0.7),
    MEDIUM(0.4),
    LOW(0.0);

    private final double threshold;

    ConfidenceLevel(double threshold) {
        this.threshold = threshold;
    }

    /**
     * Returns the smallest score classified as this level.
     *
     * @return Returns the lower bound (inclusive).
     */
    public double getThreshold() {
        return threshold;
    }

    /**
     * Classifies the given score.
     *
     * @param confidence A score in [0,1].
     * @return Returns the highest level whose threshold the score reaches.
     */
    public static ConfidenceLevel of(double confidence) {
        for (ConfidenceLevel level : values()) {
            if (confidence >= level.threshold) {
                return level;
            }
        }
        return LOW;
    }
}
