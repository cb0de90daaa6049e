package com.marco.orchestrator.intent;

import java.util.List;
import java.util.Set;

/**
 * A question for the user, produced when no candidate is dispatch-eligible
 * with enough confidence.
 *
 * @param question text shown to the user
 * @param options  enumerated choices; empty when the answer is free-form
 * @param fields   the parameter names being asked about (never fields the
 *                 classifier was already confident about)
 * @param context  the partial intent being completed
 */
public record ClarificationRequest(
        String       question,
        List<String> options,
        Set<String>  fields,
        Intent       context) {

    public ClarificationRequest {
        options = options == null ? List.of() : List.copyOf(options);
        fields  = fields == null ? Set.of() : Set.copyOf(fields);
    }
}
