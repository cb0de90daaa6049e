package com.marco.orchestrator.intent;

import java.util.Set;

/**
 * Classifier output before resolution.
 *
 * Created once per classify call and discarded by the disambiguation engine;
 * never persisted.
 *
 * @param intent          a possibly incomplete intent
 * @param confidence      normalised score, clamped into [0, 1]
 * @param missingFields   parameter names the classifier could not fill
 * @param ambiguousFields parameter names the classifier filled with low certainty
 */
public record IntentCandidate(
        Intent      intent,
        double      confidence,
        Set<String> missingFields,
        Set<String> ambiguousFields) {

    public IntentCandidate {
        if (intent == null) {
            throw new IllegalArgumentException("intent must not be null");
        }
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence      = Math.max(0.0, Math.min(1.0, confidence));
        missingFields   = missingFields == null ? Set.of() : Set.copyOf(missingFields);
        ambiguousFields = ambiguousFields == null ? Set.of() : Set.copyOf(ambiguousFields);
    }

    public static IntentCandidate complete(Intent intent, double confidence) {
        return new IntentCandidate(intent, confidence, Set.of(), Set.of());
    }

    public boolean isComplete() {
        return missingFields.isEmpty() && ambiguousFields.isEmpty();
    }
}
