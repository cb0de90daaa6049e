package com.marco.orchestrator.workflow;

import com.marco.orchestrator.intent.Intent;

import java.time.Instant;

/**
 * Outstanding request to confirm a destructive action.
 *
 * @param description what will happen, e.g. "fs.delete_file(path=tmp/a.txt)"
 * @param intent      the validated intent that runs if the user says yes
 * @param requestedAt when the question was raised; unanswered requests expire
 */
public record ConfirmationRequest(String description, Intent intent, Instant requestedAt) {}
