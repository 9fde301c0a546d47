package de.uni_passau.fim.auermich.android_flows.core.flows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConfidenceScorerTest {

    private static final double DELTA = 1e-9;

    @DisplayName("Testing the weights of the evidence.")
    @Test
    void testEvidence() {
        assertEquals(0.85, ConfidenceScorer.score(TaintEvidence.SINK_ARGUMENT, 1, false, false), DELTA);
        assertEquals(0.6, ConfidenceScorer.score(TaintEvidence.PATH_SOURCE, 1, false, false), DELTA);
        assertEquals(0.35, ConfidenceScorer.score(TaintEvidence.NONE, 1, false, false), DELTA);
    }

    @DisplayName("Testing that longer paths score lower until the bonus is used up.")
    @Test
    void testPathLength() {
        assertEquals(0.35, ConfidenceScorer.score(TaintEvidence.NONE, 0, false, false), DELTA);
        assertEquals(0.3, ConfidenceScorer.score(TaintEvidence.NONE, 2, false, false), DELTA);
        assertEquals(0.15, ConfidenceScorer.score(TaintEvidence.NONE, 5, false, false), DELTA);
        assertEquals(0.1, ConfidenceScorer.score(TaintEvidence.NONE, 6, false, false), DELTA);
        assertEquals(0.1, ConfidenceScorer.score(TaintEvidence.NONE, 40, false, false), DELTA);

        for (int length = 1; length < 10; length++) {
            assertTrue(ConfidenceScorer.score(TaintEvidence.PATH_SOURCE, length, true, false)
                    >= ConfidenceScorer.score(TaintEvidence.PATH_SOURCE, length + 1, true, false));
        }
    }

    @DisplayName("Testing the deeplink bonus and the constant argument penalty.")
    @Test
    void testAdjustments() {
        assertEquals(0.5, ConfidenceScorer.score(TaintEvidence.NONE, 1, true, false), DELTA);
        assertEquals(0.25, ConfidenceScorer.score(TaintEvidence.NONE, 1, false, true), DELTA);
        assertEquals(0.0, ConfidenceScorer.score(TaintEvidence.NONE, 10, false, true), DELTA);
    }

    @DisplayName("Testing that the score is clamped to [0,1].")
    @Test
    void testClamp() {
        assertEquals(1.0, ConfidenceScorer.score(TaintEvidence.SINK_ARGUMENT, 1, true, false), DELTA);
        assertTrue(ConfidenceScorer.score(TaintEvidence.NONE, 100, false, true) >= 0.0);
    }

    @DisplayName("Testing the confidence levels.")
    @Test
    void testLevels() {
        assertEquals(ConfidenceLevel.HIGH, ConfidenceLevel.of(1.0));
        assertEquals(ConfidenceLevel.HIGH, ConfidenceLevel.of(0.7));
        assertEquals(ConfidenceLevel.MEDIUM, ConfidenceLevel.of(0.69));
        assertEquals(ConfidenceLevel.MEDIUM, ConfidenceLevel.of(0.4));
        assertEquals(ConfidenceLevel.LOW, ConfidenceLevel.of(0.39));
        assertEquals(ConfidenceLevel.LOW, ConfidenceLevel.of(0.0));
    }
}
