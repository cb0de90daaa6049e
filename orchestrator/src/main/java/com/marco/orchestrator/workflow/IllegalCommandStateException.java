package com.marco.orchestrator.workflow;

import java.util.UUID;

/**
 * Thrown when the front-end answers a question the command is not asking,
 * e.g. confirming a command that is waiting for a clarification, or
 * cancelling a command that already finished.
 */
public class IllegalCommandStateException extends RuntimeException {

    private final WorkflowPhase phase;

    public IllegalCommandStateException(UUID id, WorkflowPhase phase, String attempted) {
        super("Command %s is %s; cannot %s".formatted(id, phase, attempted));
        this.phase = phase;
    }

    public WorkflowPhase getPhase() { return phase; }
}
