package com.marco.orchestrator.classifier;

import java.util.Set;

/**
 * One answered clarification round, fed back into the next classify call.
 */
public record ClarificationExchange(String question, Set<String> fields, String answer) {

    public ClarificationExchange {
        fields = fields == null ? Set.of() : Set.copyOf(fields);
    }
}
