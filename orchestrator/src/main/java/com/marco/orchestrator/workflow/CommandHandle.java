package com.marco.orchestrator.workflow;

import java.util.UUID;

/**
 * Opaque reference to a submitted command.
 */
public record CommandHandle(UUID id) {

    public static CommandHandle of(String id) {
        return new CommandHandle(UUID.fromString(id));
    }
}
