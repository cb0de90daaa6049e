package com.marco.orchestrator.api.dto;

/**
 * Request body for POST /commands/{id}/confirm.
 * A missing {@code approved} counts as a refusal.
 */
public record ConfirmRequest(boolean approved) {}
