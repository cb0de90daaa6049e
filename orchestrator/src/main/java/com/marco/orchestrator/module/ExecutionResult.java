package com.marco.orchestrator.module;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a module hands back after a successful action.
 *
 * @param summary   short text shown to the user
 * @param data      structured payload (listing, file content, course list ...)
 * @param facts     key/value facts merged into the workflow's cumulative context,
 *                  e.g. a resolved {@code course_id} a later step can reuse
 * @param followUp  true when the module knows another step is available
 * @param nextInput text for the next classification step; null means
 *                  "re-classify the original request with the new context"
 */
public record ExecutionResult(
        String              summary,
        Object              data,
        Map<String, Object> facts,
        boolean             followUp,
        String              nextInput) {

    public ExecutionResult {
        facts = facts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(facts));
    }

    public static ExecutionResult of(String summary, Object data) {
        return new ExecutionResult(summary, data, Map.of(), false, null);
    }

    public static ExecutionResult withFacts(String summary, Object data, Map<String, Object> facts) {
        return new ExecutionResult(summary, data, facts, false, null);
    }

    /** Marks this result as having a follow-up step. */
    public ExecutionResult thenContinue(String next) {
        return new ExecutionResult(summary, data, facts, true, next);
    }
}
