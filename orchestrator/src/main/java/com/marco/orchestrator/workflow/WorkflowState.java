package com.marco.orchestrator.workflow;

import com.marco.orchestrator.classifier.ClarificationExchange;
import com.marco.orchestrator.classifier.ClassificationContext;
import com.marco.orchestrator.intent.ClarificationRequest;
import com.marco.orchestrator.intent.Intent;
import com.marco.orchestrator.intent.IntentCandidate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Mutable state of one command, owned by the {@link WorkflowOrchestrator}.
 *
 * Only one thread touches it at a time: the worker running the command, or,
 * while the command is suspended, the thread delivering the user's answer.
 * Everyone else reads {@link #snapshot()} copies.
 */
class WorkflowState {

    final UUID    commandId;
    final String  rawInput;
    final Instant createdAt;

    WorkflowPhase phase = WorkflowPhase.CLASSIFYING;
    Instant       updatedAt;

    // Current step
    String                            currentText;
    boolean                           followUpStep;
    List<IntentCandidate>             candidates = List.of();
    final List<ClarificationExchange> clarifications = new ArrayList<>();
    Intent                            partialIntent;
    Intent                            resolvedIntent;
    Intent                            confirmedIntent;
    ClarificationRequest              pendingClarification;
    ConfirmationRequest               pendingConfirmation;

    // Whole command
    final List<StepRecord>    steps = new ArrayList<>();
    final Map<String, Object> cumulativeContext = new LinkedHashMap<>();
    int                       clarificationRounds;
    Duration                  activeTime = Duration.ZERO;
    CommandFailure            failure;

    WorkflowState(UUID commandId, String rawInput, Map<String, Object> sessionContext, Instant now) {
        this.commandId   = commandId;
        this.rawInput    = rawInput;
        this.currentText = rawInput;
        this.createdAt   = now;
        this.updatedAt   = now;
        if (sessionContext != null) {
            cumulativeContext.putAll(sessionContext);
        }
    }

    ClassificationContext classificationContext() {
        return new ClassificationContext(
                cumulativeContext,
                steps.stream().map(StepRecord::intent).toList(),
                clarifications,
                partialIntent,
                followUpStep);
    }

    /** Reset the per-step fields before classifying the next step. */
    void beginNextStep(String text) {
        currentText          = text;
        followUpStep         = true;
        candidates           = List.of();
        clarifications.clear();
        partialIntent        = null;
        resolvedIntent       = null;
        confirmedIntent      = null;
        pendingClarification = null;
        pendingConfirmation  = null;
    }

    WorkflowSnapshot snapshot() {
        return new WorkflowSnapshot(
                commandId,
                rawInput,
                phase,
                List.copyOf(steps),
                pendingClarification,
                pendingConfirmation,
                Collections.unmodifiableMap(new LinkedHashMap<>(cumulativeContext)),
                clarificationRounds,
                failure,
                createdAt,
                updatedAt);
    }
}
