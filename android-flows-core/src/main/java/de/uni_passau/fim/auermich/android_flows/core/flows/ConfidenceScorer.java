package de.uni_passau.fim.auermich.android_flows.core.flows;

/**
 * Combines the findings of the taint analysis into a confidence score in [0,1]:
 * <pre>
 *   0.10                                  base
 * + 0.50 | 0.25 | 0                       evidence: sink argument | source on path | none
 * + max(0, 0.25 - 0.05 * (length - 1))    shorter paths score higher
 * + 0.15                                  if the entry point handles deeplinks
 * - 0.10                                  if the sink argument is a constant
 * </pre>
 * The score is clamped to [0,1].
 */
public final class ConfidenceScorer {

    static final double BASE = 0.1;
    static final double SINK_ARGUMENT_WEIGHT = 0.5;
    static final double PATH_SOURCE_WEIGHT = 0.25;
    static final double MAX_LENGTH_BONUS = 0.25;
    static final double LENGTH_PENALTY = 0.05;
    static final double DEEPLINK_BONUS = 0.15;
    static final double CONSTANT_ARGUMENT_PENALTY = 0.1;

    private ConfidenceScorer() {
        throw new UnsupportedOperationException("Utility class!");
    }

    /**
     * Computes the confidence that a path constitutes a real flow of Intent data into the sink.
     *
     * @param evidence The taint evidence found along the path.
     * @param pathLength The number of edges of the path.
     * @param deeplinkHandler Whether the entry point of the path handles deeplinks.
     * @param constantSinkArgument Whether the sink receives a constant (string literal or string resource).
     * @return Returns the score in [0,1].
     */
    public static double score(TaintEvidence evidence, int pathLength, boolean deeplinkHandler,
                               boolean constantSinkArgument) {

        double score = BASE;

        switch (evidence) {
            case SINK_ARGUMENT:
                score += SINK_ARGUMENT_WEIGHT;
                break;
            case PATH_SOURCE:
                score += PATH_SOURCE_WEIGHT;
                break;
            default:
                break;
        }

        score += Math.max(0.0, MAX_LENGTH_BONUS - LENGTH_PENALTY * Math.max(0, pathLength - 1));

        if (deeplinkHandler) {
            score += DEEPLINK_BONUS;
        }

        if (constantSinkArgument) {
            score -= CONSTANT_ARGUMENT_PENALTY;
        }

        return Math.min(1.0, Math.max(0.0, score));
    }
}
