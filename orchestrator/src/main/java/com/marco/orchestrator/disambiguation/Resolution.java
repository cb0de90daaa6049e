package com.marco.orchestrator.disambiguation;

import com.marco.orchestrator.intent.ClarificationRequest;
import com.marco.orchestrator.intent.Intent;
import com.marco.orchestrator.intent.IntentCandidate;

/**
 * Outcome of {@link DisambiguationEngine#resolve}: exactly one of a resolved
 * intent, a clarification request, or an IntentUnresolved failure.
 *
 * @param kind          which of the three outcomes this is
 * @param intent        set when RESOLVED
 * @param clarification set when CLARIFY
 * @param bestEffort    the top candidate, kept for diagnostics when UNRESOLVED (may be null)
 * @param reason        why the candidates could not be resolved, when UNRESOLVED
 */
public record Resolution(
        Kind                 kind,
        Intent               intent,
        ClarificationRequest clarification,
        IntentCandidate      bestEffort,
        String               reason) {

    public enum Kind { RESOLVED, CLARIFY, UNRESOLVED }

    public static Resolution resolved(Intent intent) {
        return new Resolution(Kind.RESOLVED, intent, null, null, null);
    }

    public static Resolution clarify(ClarificationRequest request) {
        return new Resolution(Kind.CLARIFY, null, request, null, null);
    }

    public static Resolution unresolved(String reason, IntentCandidate bestEffort) {
        return new Resolution(Kind.UNRESOLVED, null, null, bestEffort, reason);
    }
}
