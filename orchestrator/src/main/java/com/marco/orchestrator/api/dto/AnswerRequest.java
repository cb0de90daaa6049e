package com.marco.orchestrator.api.dto;

/** Request body for POST /commands/{id}/answer. */
public record AnswerRequest(String answer) {}
