package com.marco.orchestrator.disambiguation;

import com.marco.orchestrator.intent.ClarificationRequest;
import com.marco.orchestrator.intent.IntentCandidate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides what to do with a ranked candidate list: dispatch, ask, or give up.
 *
 * <ol>
 *   <li>Sort by confidence, highest first; ties go to the candidate with
 *       fewer missing fields, then fewer ambiguous fields.</li>
 *   <li>Top candidate complete and ≥ accept threshold → RESOLVED.</li>
 *   <li>Top candidate ≥ complete threshold but with missing/ambiguous fields
 *       → CLARIFY, asking about exactly those fields.</li>
 *   <li>Top candidate complete but between the two thresholds → CLARIFY,
 *       asking the user to confirm the interpretation.</li>
 *   <li>Everything below the complete threshold, an empty list, or an
 *       exhausted clarification budget → UNRESOLVED with the best-effort
 *       candidate attached.</li>
 * </ol>
 *
 * Pure decision logic: no I/O, no state, same input gives the same output.
 */
@Component
public class DisambiguationEngine {

    /** Upper bound on enumerated options offered in one question. */
    static final int MAX_OPTIONS = 5;

    private static final Comparator<IntentCandidate> RANKING = Comparator
            .comparingDouble(IntentCandidate::confidence).reversed()
            .thenComparingInt(c -> c.missingFields().size())
            .thenComparingInt(c -> c.ambiguousFields().size());

    /**
     * @param roundsUsed clarification rounds already spent by this command
     */
    public Resolution resolve(List<IntentCandidate> candidates, DisambiguationPolicy policy, int roundsUsed) {
        if (candidates == null || candidates.isEmpty()) {
            return Resolution.unresolved("No interpretation was found for the command", null);
        }

        List<IntentCandidate> ranked = candidates.stream().sorted(RANKING).toList();
        IntentCandidate top = ranked.get(0);

        if (top.confidence() < policy.completeThreshold()) {
            return Resolution.unresolved(
                    "Best interpretation %s has confidence %.2f, below %.2f".formatted(
                            label(top), top.confidence(), policy.completeThreshold()), top);
        }

        Set<String> openFields = openFields(top);

        if (openFields.isEmpty() && top.confidence() >= policy.acceptThreshold()) {
            return Resolution.resolved(top.intent());
        }

        if (roundsUsed >= policy.maxClarificationRounds()) {
            return Resolution.unresolved(
                    "Clarification budget of %d round(s) exhausted".formatted(policy.maxClarificationRounds()), top);
        }

        if (openFields.isEmpty()) {
            return Resolution.clarify(confirmInterpretation(top, ranked, policy));
        }
        return Resolution.clarify(askForFields(top, openFields, ranked));
    }

    // ------------------------------------------------------------------
    // Question building
    // ------------------------------------------------------------------

    private static Set<String> openFields(IntentCandidate c) {
        Set<String> fields = new LinkedHashSet<>();
        if (!c.intent().hasTarget()) {
            fields.add("action");
        }
        fields.addAll(c.missingFields());
        fields.addAll(c.ambiguousFields());
        return fields;
    }

    private static ClarificationRequest askForFields(IntentCandidate top, Set<String> fields,
                                                     List<IntentCandidate> ranked) {
        if (fields.contains("action") && !top.intent().hasTarget()) {
            List<String> options = ranked.stream()
                    .filter(c -> c.intent().hasTarget())
                    .map(c -> c.intent().qualifiedName())
                    .distinct()
                    .limit(MAX_OPTIONS)
                    .toList();
            return new ClarificationRequest("What would you like me to do?", options, fields, top.intent());
        }

        String question = fields.size() == 1
                ? "Which %s should I use for %s?".formatted(fields.iterator().next(), label(top))
                : "To run %s I still need: %s. Please provide them.".formatted(
                        label(top), String.join(", ", fields));

        // Offer the values other interpretations of the same action proposed for the field.
        List<String> options = new ArrayList<>();
        if (fields.size() == 1) {
            String field = fields.iterator().next();
            ranked.stream()
                    .filter(c -> c.intent().qualifiedName().equals(top.intent().qualifiedName()))
                    .map(c -> c.intent().parameters().get(field))
                    .filter(v -> v != null && !v.toString().isBlank())
                    .map(Object::toString)
                    .distinct()
                    .limit(MAX_OPTIONS)
                    .forEach(options::add);
        }
        return new ClarificationRequest(question, options, fields, top.intent());
    }

    private static ClarificationRequest confirmInterpretation(IntentCandidate top, List<IntentCandidate> ranked,
                                                              DisambiguationPolicy policy) {
        List<String> options = ranked.stream()
                .filter(c -> c.confidence() >= policy.completeThreshold() && c.intent().hasTarget())
                .map(c -> c.intent().describe())
                .distinct()
                .limit(MAX_OPTIONS)
                .toList();
        return new ClarificationRequest("Did you mean " + top.intent().describe() + "?",
                options, Set.of(), top.intent());
    }

    private static String label(IntentCandidate c) {
        return c.intent().hasTarget() ? c.intent().qualifiedName() : "(unknown action)";
    }
}
