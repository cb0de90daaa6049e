package com.marco.orchestrator.workflow;

import com.marco.orchestrator.intent.Intent;
import com.marco.orchestrator.module.ExecutionResult;

import java.time.Instant;

/**
 * One completed workflow step.
 */
public record StepRecord(int index, Intent intent, ExecutionResult result, int attempts, Instant completedAt) {}
