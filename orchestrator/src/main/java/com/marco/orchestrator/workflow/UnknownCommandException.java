package com.marco.orchestrator.workflow;

import java.util.UUID;

public class UnknownCommandException extends RuntimeException {
    public UnknownCommandException(UUID id) {
        super("No command with id: " + id);
    }
}
