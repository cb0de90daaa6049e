package com.marco.orchestrator.disambiguation;

/**
 * Tunable thresholds for {@link DisambiguationEngine}.
 *
 * @param acceptThreshold        minimum confidence to dispatch a complete candidate without asking
 * @param completeThreshold      minimum confidence for a candidate to be worth completing
 *                               through clarification; below it the command fails
 * @param maxClarificationRounds clarification rounds allowed per command
 */
public record DisambiguationPolicy(double acceptThreshold, double completeThreshold, int maxClarificationRounds) {

    public DisambiguationPolicy {
        if (completeThreshold < 0 || acceptThreshold > 1 || completeThreshold > acceptThreshold) {
            throw new IllegalArgumentException(
                    "thresholds must satisfy 0 <= complete (%s) <= accept (%s) <= 1"
                            .formatted(completeThreshold, acceptThreshold));
        }
        if (maxClarificationRounds < 0) {
            throw new IllegalArgumentException("maxClarificationRounds must be >= 0");
        }
    }

    public static DisambiguationPolicy defaults() {
        return new DisambiguationPolicy(0.8, 0.4, 3);
    }
}
