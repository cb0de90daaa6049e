package com.marco.orchestrator.workflow;

/**
 * Phase of one in-flight command.
 *
 * Happy path:
 *   CLASSIFYING → DISAMBIGUATING → VALIDATING → [CONFIRM_PENDING] → DISPATCHING
 *     → STEP_COMPLETE → (CLASSIFYING for the next step | DONE)
 *
 * AWAITING_CLARIFICATION and CONFIRM_PENDING suspend the command until the
 * front-end answers; no thread is held while suspended.
 *
 * DONE, FAILED, CANCELLED and UNCERTAIN are terminal. CANCELLED is a normal
 * outcome, not an error. UNCERTAIN means a destructive or non-idempotent
 * dispatch was abandoned mid-flight and its effect is unknown.
 */
public enum WorkflowPhase {
    CLASSIFYING,
    DISAMBIGUATING,
    VALIDATING,
    AWAITING_CLARIFICATION,
    CONFIRM_PENDING,
    DISPATCHING,
    STEP_COMPLETE,
    DONE,
    FAILED,
    CANCELLED,
    UNCERTAIN;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED || this == UNCERTAIN;
    }

    /** Waiting on the user. */
    public boolean isSuspended() {
        return this == AWAITING_CLARIFICATION || this == CONFIRM_PENDING;
    }
}
