package com.marco.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /commands.
 *
 * Required: text
 * Optional: sessionContext — facts the front-end already knows (e.g. a
 *   course_id from an earlier command); seeded into the command's context.
 */
public record SubmitCommandRequest(String text, Map<String, Object> sessionContext) {

    public SubmitCommandRequest {
        if (sessionContext == null) sessionContext = Map.of();
    }
}
