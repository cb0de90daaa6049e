package com.marco.orchestrator.workflow;

/**
 * Why a command ended in {@link WorkflowPhase#FAILED}.
 *
 * CLASSIFIER_UNAVAILABLE — backend unreachable or timed out twice; the user may retry or rephrase.
 * INTENT_UNRESOLVED      — no confident interpretation, or the clarification budget ran out.
 * INVALID_INTENT         — unknown module/action (or undeclared parameter in strict mode); never retried.
 * MODULE_EXECUTION       — the module reported a failure.
 * TIMEOUT                — the command's processing budget or the dispatch timeout ran out.
 * INTERNAL               — a bug in the orchestrator itself; logged with a stack trace.
 */
public enum FailureKind {
    CLASSIFIER_UNAVAILABLE,
    INTENT_UNRESOLVED,
    INVALID_INTENT,
    MODULE_EXECUTION,
    TIMEOUT,
    INTERNAL
}
