package com.marco.orchestrator.classifier;

import com.marco.orchestrator.intent.Intent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the classifier may use besides the text itself.
 *
 * @param facts          cumulative workflow context (session facts plus facts
 *                       produced by earlier steps)
 * @param completedSteps intents already executed in this command, in order
 * @param clarifications answered clarification rounds for the current step
 * @param partialIntent  the intent being completed by the clarifications, or null
 * @param followUp       true when classifying a follow-up step; the classifier
 *                       may then answer with no candidates to signal "done"
 */
public record ClassificationContext(
        Map<String, Object>         facts,
        List<Intent>                completedSteps,
        List<ClarificationExchange> clarifications,
        Intent                      partialIntent,
        boolean                     followUp) {

    public ClassificationContext {
        facts          = facts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(facts));
        completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
        clarifications = clarifications == null ? List.of() : List.copyOf(clarifications);
    }

    public static ClassificationContext empty() {
        return new ClassificationContext(Map.of(), List.of(), List.of(), null, false);
    }
}
