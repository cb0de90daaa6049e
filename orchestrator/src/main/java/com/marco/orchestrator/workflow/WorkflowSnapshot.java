package com.marco.orchestrator.workflow;

import com.marco.orchestrator.intent.ClarificationRequest;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable, JSON-serialisable view of a command's {@link WorkflowState}.
 * This is what {@code getStatus} hands out; the live state never leaves the
 * thread running the command.
 */
public record WorkflowSnapshot(
        UUID                 commandId,
        String               rawInput,
        WorkflowPhase        phase,
        List<StepRecord>     steps,
        ClarificationRequest pendingClarification,
        ConfirmationRequest  pendingConfirmation,
        Map<String, Object>  cumulativeContext,
        int                  clarificationRounds,
        CommandFailure       failure,
        Instant              createdAt,
        Instant              updatedAt) {

    public boolean isTerminal() {
        return phase.isTerminal();
    }
}
