package com.marco.orchestrator.classifier;

import com.marco.orchestrator.intent.IntentCandidate;

import java.util.List;

/**
 * Typed outcome of {@link IntentClassifier#classify}.
 *
 * Either a (possibly empty) ranked candidate list, or a
 * ClassifierUnavailable condition with the reason, never both.
 *
 * @param candidates        candidates in the order the backend produced them
 * @param unavailableReason non-null when the backend could not be reached or timed out
 * @param attempts          backend calls made (1 or 2)
 */
public record ClassifyResult(List<IntentCandidate> candidates, String unavailableReason, int attempts) {

    public ClassifyResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static ClassifyResult of(List<IntentCandidate> candidates, int attempts) {
        return new ClassifyResult(candidates, null, attempts);
    }

    public static ClassifyResult unavailable(String reason, int attempts) {
        return new ClassifyResult(List.of(), reason, attempts);
    }

    public boolean isAvailable() {
        return unavailableReason == null;
    }
}
