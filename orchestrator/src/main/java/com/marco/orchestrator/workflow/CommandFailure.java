package com.marco.orchestrator.workflow;

import com.marco.orchestrator.intent.Intent;

/**
 * Failure detail attached to a FAILED or UNCERTAIN command, and the note
 * explaining why a CANCELLED or DONE command stopped early.
 *
 * @param kind       failure category; null unless the command FAILED or timed out
 * @param message    user-facing explanation
 * @param bestEffort the closest interpretation found, for diagnostics (may be null)
 */
public record CommandFailure(FailureKind kind, String message, Intent bestEffort) {}
