package com.marco.orchestrator.workflow;

import com.marco.orchestrator.classifier.ClarificationExchange;
import com.marco.orchestrator.classifier.ClassifyResult;
import com.marco.orchestrator.classifier.IntentClassifier;
import com.marco.orchestrator.config.MarcoProperties;
import com.marco.orchestrator.disambiguation.DisambiguationEngine;
import com.marco.orchestrator.disambiguation.DisambiguationPolicy;
import com.marco.orchestrator.disambiguation.Resolution;
import com.marco.orchestrator.intent.ClarificationRequest;
import com.marco.orchestrator.intent.FieldError;
import com.marco.orchestrator.intent.Intent;
import com.marco.orchestrator.intent.IntentValidator;
import com.marco.orchestrator.intent.ValidationResult;
import com.marco.orchestrator.module.ExecutionResult;
import com.marco.orchestrator.module.ModuleExecutionException;
import com.marco.orchestrator.registry.CapabilityDescriptor;
import com.marco.orchestrator.registry.CapabilityRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The Master Control Program: drives each submitted command through
 * classification, disambiguation, validation, confirmation and dispatch.
 *
 * <p>Each command is an explicit state machine ({@link WorkflowPhase}) with
 * its own {@link WorkflowState}. A command runs on a worker thread until it
 * either terminates or suspends on the user (clarification / confirmation);
 * suspension releases the thread, and the front-end's {@link #answer} or
 * {@link #confirm} schedules the next segment. Steps inside one command run
 * strictly one after another.
 *
 * <p>Policies applied here and nowhere else:
 * <ul>
 *   <li>destructive actions are only dispatched after a positive confirmation;</li>
 *   <li>idempotent read-only actions are retried once on a transient failure
 *       or timeout, everything else is never retried;</li>
 *   <li>recoverable validation errors become field-targeted clarifications,
 *       structural ones fail the command as INVALID_INTENT;</li>
 *   <li>cancelling during a non-retryable dispatch ends UNCERTAIN, never
 *       silently as success or failure.</li>
 * </ul>
 */
@Service
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private final CapabilityRegistry   registry;
    private final IntentClassifier     classifier;
    private final DisambiguationEngine disambiguation;
    private final IntentValidator      validator;
    private final MeterRegistry        meterRegistry;
    private final Clock                clock;

    private final DisambiguationPolicy policy;
    private final Duration             dispatchTimeout;
    private final Duration             commandTimeout;
    private final Duration             confirmationTimeout;
    private final Duration             clarificationTimeout;
    private final Duration             retention;
    private final int                  maxSteps;

    private final Map<UUID, CommandRun> commands = new ConcurrentHashMap<>();

    // Bounded pool: one task per running command segment.
    private final ExecutorService workers;
    // Module calls run here so the worker can time them out and abandon them.
    private final ExecutorService dispatches = Executors.newCachedThreadPool(named("module-dispatch"));

    @Autowired
    public WorkflowOrchestrator(CapabilityRegistry registry,
                                IntentClassifier classifier,
                                DisambiguationEngine disambiguation,
                                IntentValidator validator,
                                MeterRegistry meterRegistry,
                                MarcoProperties properties) {
        this(registry, classifier, disambiguation, validator, meterRegistry, properties, Clock.systemUTC());
    }

    public WorkflowOrchestrator(CapabilityRegistry registry,
                                IntentClassifier classifier,
                                DisambiguationEngine disambiguation,
                                IntentValidator validator,
                                MeterRegistry meterRegistry,
                                MarcoProperties properties,
                                Clock clock) {
        this.registry       = registry;
        this.classifier     = classifier;
        this.disambiguation = disambiguation;
        this.validator      = validator;
        this.meterRegistry  = meterRegistry;
        this.clock          = clock;

        MarcoProperties.Workflow wf = properties.getWorkflow();
        this.policy              = properties.getDisambiguation().toPolicy();
        this.dispatchTimeout     = wf.getDispatchTimeout();
        this.commandTimeout      = wf.getCommandTimeout();
        this.confirmationTimeout  = wf.getConfirmationTimeout();
        this.clarificationTimeout = wf.getClarificationTimeout();
        this.retention           = wf.getRetention();
        this.maxSteps            = wf.getMaxSteps();
        this.workers             = Executors.newFixedThreadPool(wf.getWorkerThreads(), named("command-worker"));

        if (!registry.isClosed()) {
            throw new IllegalStateException("Capability registry must be closed before commands can be accepted");
        }
    }

    // ------------------------------------------------------------------
    // Front-end surface
    // ------------------------------------------------------------------

    /**
     * Accept a command and start processing it in the background.
     *
     * @param sessionContext facts known before the command starts (may be null);
     *                       copied into the command's cumulative context
     */
    public CommandHandle submitCommand(String text, Map<String, Object> sessionContext) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Command text must not be blank");
        }
        UUID id = UUID.randomUUID();
        CommandRun run = new CommandRun(new WorkflowState(id, text.strip(), sessionContext, clock.instant()));
        commands.put(id, run);
        log.info("Command {} submitted: '{}'", id, text.strip());

        synchronized (run) {
            startSegment(run);
        }
        return new CommandHandle(id);
    }

    public Optional<WorkflowSnapshot> getStatus(CommandHandle handle) {
        return Optional.ofNullable(commands.get(handle.id())).map(CommandRun::snapshot);
    }

    /**
     * Deliver the user's answer to an outstanding clarification question and
     * resume the command with a fresh classification attempt.
     *
     * @throws UnknownCommandException      if the handle is unknown or evicted
     * @throws IllegalCommandStateException if the command is not waiting for a clarification
     */
    public WorkflowSnapshot answer(CommandHandle handle, String answer) {
        CommandRun run = find(handle);
        synchronized (run) {
            WorkflowState s = requirePhase(run, WorkflowPhase.AWAITING_CLARIFICATION, "answer a clarification");
            if (answer == null || answer.isBlank()) {
                throw new IllegalArgumentException("Answer must not be blank");
            }
            ClarificationRequest req = s.pendingClarification;
            s.clarifications.add(new ClarificationExchange(req.question(), req.fields(), answer.strip()));
            s.partialIntent = req.context();
            s.pendingClarification = null;
            moveTo(run, WorkflowPhase.CLASSIFYING);
            log.info("Command {} resumed with clarification answer for {}", handle.id(), req.fields());
            startSegment(run);
            return run.snapshot();
        }
    }

    /**
     * Answer an outstanding destructive-action confirmation. A negative answer
     * cancels the command; nothing is dispatched.
     *
     * @throws UnknownCommandException      if the handle is unknown or evicted
     * @throws IllegalCommandStateException if the command is not waiting for a confirmation
     */
    public WorkflowSnapshot confirm(CommandHandle handle, boolean approved) {
        CommandRun run = find(handle);
        synchronized (run) {
            WorkflowState s = requirePhase(run, WorkflowPhase.CONFIRM_PENDING, "confirm");
            ConfirmationRequest req = s.pendingConfirmation;
            s.pendingConfirmation = null;
            if (!approved) {
                log.info("Command {}: user declined {}", handle.id(), req.description());
                stopOnCancel(run, null);
                return run.snapshot();
            }
            s.confirmedIntent = req.intent();
            moveTo(run, WorkflowPhase.DISPATCHING);
            log.info("Command {}: user confirmed {}", handle.id(), req.description());
            startSegment(run);
            return run.snapshot();
        }
    }

    /**
     * Cancel a command. A suspended command is cancelled immediately; a
     * running one is interrupted wherever it is blocked and settles on
     * CANCELLED, or UNCERTAIN if a non-retryable dispatch was in flight.
     * A command that already completed a mutating step ends DONE instead.
     *
     * @throws UnknownCommandException      if the handle is unknown or evicted
     * @throws IllegalCommandStateException if the command already finished
     */
    public WorkflowSnapshot cancel(CommandHandle handle) {
        CommandRun run = find(handle);
        synchronized (run) {
            if (run.isReleased()) {
                throw new IllegalCommandStateException(handle.id(), run.snapshot().phase(), "cancel");
            }
            WorkflowState s = run.state();
            run.requestCancel();
            if (s.phase.isSuspended()) {
                s.pendingClarification = null;
                s.pendingConfirmation = null;
                stopOnCancel(run, null);
            } else if (run.worker() != null) {
                run.worker().interrupt();
            }
            log.info("Command {} cancellation requested in phase {}", handle.id(), s.phase);
            return run.snapshot();
        }
    }

    // ------------------------------------------------------------------
    // Housekeeping
    // ------------------------------------------------------------------

    /**
     * Cancel confirmations and clarification questions nobody answered in
     * time, and evict finished commands whose retention period has passed.
     */
    @Scheduled(fixedDelayString = "${marco.workflow.sweep-interval-ms:30000}")
    public void sweep() {
        Instant now = clock.instant();
        for (Map.Entry<UUID, CommandRun> entry : commands.entrySet()) {
            CommandRun run = entry.getValue();
            synchronized (run) {
                WorkflowState s = run.state();
                if (s != null && s.phase == WorkflowPhase.CONFIRM_PENDING
                        && s.pendingConfirmation.requestedAt().plus(confirmationTimeout).isBefore(now)) {
                    Intent intent = s.pendingConfirmation.intent();
                    s.pendingConfirmation = null;
                    log.info("Command {}: confirmation for {} timed out", s.commandId, intent.describe());
                    stopOnCancel(run,
                            new CommandFailure(null, "Confirmation timed out; nothing was executed", intent));
                } else if (s != null && s.phase == WorkflowPhase.AWAITING_CLARIFICATION
                        && s.updatedAt.plus(clarificationTimeout).isBefore(now)) {
                    Intent partial = s.pendingClarification.context();
                    s.pendingClarification = null;
                    log.info("Command {}: clarification question went unanswered, abandoning", s.commandId);
                    stopOnCancel(run, new CommandFailure(null,
                            "Clarification question was not answered in time", partial));
                }
            }
            Instant finishedAt = run.finishedAt();
            if (finishedAt != null && finishedAt.plus(retention).isBefore(now)) {
                commands.remove(entry.getKey());
            }
        }
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
        dispatches.shutdownNow();
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    /** Caller holds the run's monitor. */
    private void startSegment(CommandRun run) {
        workers.submit(() -> runSegment(run));
    }

    private void runSegment(CommandRun run) {
        WorkflowState s;
        synchronized (run) {
            if (run.isReleased()) return;
            run.workerStarted(Thread.currentThread(), System.nanoTime());
            s = run.state();
        }
        MDC.put("commandId", s.commandId.toString());
        try {
            while (ownsRun(run)) {
                if (run.isCancelRequested()) {
                    stopOnCancel(run, null);
                    return;
                }
                Duration remaining = remainingBudget(run);
                if (remaining.isNegative() || remaining.isZero()) {
                    fail(run, FailureKind.TIMEOUT,
                            "Command exceeded its processing budget of " + commandTimeout, s.resolvedIntent);
                    return;
                }
                MDC.put("phase", s.phase.name());
                switch (s.phase) {
                    case CLASSIFYING    -> classify(run);
                    case DISAMBIGUATING -> disambiguate(run);
                    case VALIDATING     -> validate(run);
                    case DISPATCHING    -> dispatch(run);
                    case STEP_COMPLETE  -> completeStep(run);
                    default -> throw new IllegalStateException("Unexpected phase " + s.phase);
                }
            }
        } catch (InterruptedException e) {
            onInterrupted(run);
        } catch (RuntimeException e) {
            log.error("Unhandled error in command {} during {}: {}", s.commandId, s.phase, e.getMessage(), e);
            fail(run, FailureKind.INTERNAL, "Internal error: " + e.getMessage(), s.resolvedIntent);
        } finally {
            synchronized (run) {
                if (run.worker() == Thread.currentThread()) {
                    endSegment(run);
                }
            }
            // Clear a cancellation interrupt that arrived after the last blocking call.
            Thread.interrupted();
            MDC.clear();
        }
    }

    private void classify(CommandRun run) throws InterruptedException {
        WorkflowState s = run.state();
        ClassifyResult result = classifier.classify(s.currentText, s.classificationContext());

        if (!result.isAvailable()) {
            fail(run, FailureKind.CLASSIFIER_UNAVAILABLE,
                    "The language backend is unavailable (" + result.unavailableReason()
                            + "). Please retry or rephrase.", null);
            return;
        }
        if (s.followUpStep && result.candidates().isEmpty()) {
            log.info("Command {}: no further step after {} step(s)", s.commandId, s.steps.size());
            finish(run, WorkflowPhase.DONE, null);
            return;
        }
        s.candidates = result.candidates();
        moveTo(run, WorkflowPhase.DISAMBIGUATING);
    }

    private void disambiguate(CommandRun run) {
        WorkflowState s = run.state();
        Resolution resolution = disambiguation.resolve(s.candidates, policy, s.clarificationRounds);
        switch (resolution.kind()) {
            case RESOLVED -> {
                s.resolvedIntent = resolution.intent();
                moveTo(run, WorkflowPhase.VALIDATING);
            }
            case CLARIFY -> askUser(run, resolution.clarification());
            case UNRESOLVED -> fail(run, FailureKind.INTENT_UNRESOLVED, resolution.reason(),
                    resolution.bestEffort() == null ? null : resolution.bestEffort().intent());
        }
    }

    private void validate(CommandRun run) {
        WorkflowState s = run.state();
        Intent intent = s.resolvedIntent;
        CapabilityDescriptor descriptor = registry.lookup(intent.module()).orElse(null);
        ValidationResult result = validator.validate(intent, descriptor);

        if (result.isValid()) {
            s.resolvedIntent = result.intent();
            if (descriptor.isDestructive(intent.action())) {
                s.pendingConfirmation = new ConfirmationRequest(
                        result.intent().describe(), result.intent(), clock.instant());
                log.info("Command {}: {} is destructive, awaiting confirmation",
                        s.commandId, result.intent().describe());
                suspend(run, WorkflowPhase.CONFIRM_PENDING);
            } else {
                moveTo(run, WorkflowPhase.DISPATCHING);
            }
            return;
        }

        if (!result.isRecoverable()) {
            fail(run, FailureKind.INVALID_INTENT, result.summary(), intent);
            return;
        }
        if (s.clarificationRounds >= policy.maxClarificationRounds()) {
            fail(run, FailureKind.INTENT_UNRESOLVED,
                    "Clarification budget exhausted: " + result.summary(), intent);
            return;
        }
        askUser(run, new ClarificationRequest(validationQuestion(result, intent), List.of(), result.fields(), intent));
    }

    private void dispatch(CommandRun run) throws InterruptedException {
        WorkflowState s = run.state();
        Intent intent = s.resolvedIntent;

        if (registry.isDestructive(intent.module(), intent.action()) && !intent.equals(s.confirmedIntent)) {
            throw new IllegalStateException("Refusing to dispatch unconfirmed destructive action " + intent.describe());
        }

        boolean retryable   = registry.isRetryable(intent.module(), intent.action());
        int     maxAttempts = retryable ? 2 : 1;
        FailureKind lastKind  = FailureKind.MODULE_EXECUTION;
        String      lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Duration timeout = min(dispatchTimeout, remainingBudget(run));
            if (timeout.isNegative() || timeout.isZero()) {
                fail(run, FailureKind.TIMEOUT, "Command budget exhausted before " + intent.qualifiedName(), intent);
                return;
            }

            Future<ExecutionResult> call = dispatches.submit(withMdc(intent, () -> registry.execute(intent)));
            try {
                ExecutionResult result = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                s.steps.add(new StepRecord(s.steps.size() + 1, intent, result, attempt, clock.instant()));
                s.cumulativeContext.putAll(result.facts());
                log.info("Command {}: step {} {} done (attempt {})",
                        s.commandId, s.steps.size(), intent.qualifiedName(), attempt);
                moveTo(run, WorkflowPhase.STEP_COMPLETE);
                return;

            } catch (TimeoutException e) {
                call.cancel(true);
                lastKind  = FailureKind.TIMEOUT;
                lastError = "%s did not finish within %d ms".formatted(intent.qualifiedName(), timeout.toMillis());
                if (!retryable) {
                    finish(run, WorkflowPhase.UNCERTAIN, new CommandFailure(FailureKind.TIMEOUT,
                            lastError + "; its effect is unknown, please verify manually", intent));
                    return;
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                lastKind  = FailureKind.MODULE_EXECUTION;
                lastError = intent.qualifiedName() + " failed: " + cause.getMessage();
                boolean transientFailure = cause instanceof ModuleExecutionException me && me.isTransient();
                if (!retryable || !transientFailure) {
                    fail(run, FailureKind.MODULE_EXECUTION, lastError, intent);
                    return;
                }
            } catch (InterruptedException e) {
                call.cancel(true);
                throw e;
            }

            if (attempt < maxAttempts) {
                log.warn("Command {}: {} attempt {}/{} failed, retrying once: {}",
                        s.commandId, intent.qualifiedName(), attempt, maxAttempts, lastError);
            }
        }
        fail(run, lastKind, lastError, intent);
    }

    private void completeStep(CommandRun run) {
        WorkflowState s = run.state();
        ExecutionResult last = s.steps.get(s.steps.size() - 1).result();

        if (!last.followUp()) {
            finish(run, WorkflowPhase.DONE, null);
            return;
        }
        if (s.steps.size() >= maxSteps) {
            log.warn("Command {}: follow-up offered but the step limit of {} is reached", s.commandId, maxSteps);
            finish(run, WorkflowPhase.DONE, null);
            return;
        }
        String next = last.nextInput() == null || last.nextInput().isBlank() ? s.rawInput : last.nextInput();
        s.beginNextStep(next);
        moveTo(run, WorkflowPhase.CLASSIFYING);
    }

    private void onInterrupted(CommandRun run) {
        WorkflowState s = run.state();
        if (s == null) return;
        Intent inFlight = s.resolvedIntent;
        if (s.phase == WorkflowPhase.DISPATCHING && inFlight != null
                && !registry.isRetryable(inFlight.module(), inFlight.action())) {
            log.warn("Command {} cancelled while {} was in flight; outcome unknown", s.commandId, inFlight.describe());
            finish(run, WorkflowPhase.UNCERTAIN, new CommandFailure(null,
                    "Cancelled while " + inFlight.describe() + " was running; please verify its effect manually",
                    inFlight));
        } else {
            stopOnCancel(run, null);
        }
    }

    /**
     * End a command that is being stopped before it ran to completion. A
     * mutating step that already finished is never reported as cancelled:
     * the command ends DONE with the steps it did run.
     */
    private void stopOnCancel(CommandRun run, CommandFailure note) {
        WorkflowState s = run.state();
        Optional<StepRecord> mutation = s.steps.stream()
                .filter(step -> !registry.isRetryable(step.intent().module(), step.intent().action()))
                .reduce((first, second) -> second);
        if (mutation.isPresent()) {
            Intent done = mutation.get().intent();
            log.info("Command {} stopped after {} had already run; remaining work skipped",
                    s.commandId, done.describe());
            finish(run, WorkflowPhase.DONE, new CommandFailure(null,
                    "Stopped after " + done.describe() + " had already run; remaining steps were skipped", done));
        } else {
            finish(run, WorkflowPhase.CANCELLED, note);
        }
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    private void moveTo(CommandRun run, WorkflowPhase phase) {
        synchronized (run) {
            WorkflowState s = run.state();
            s.phase = phase;
            s.updatedAt = clock.instant();
            run.publish();
        }
    }

    private void askUser(CommandRun run, ClarificationRequest request) {
        WorkflowState s = run.state();
        s.pendingClarification = request;
        s.clarificationRounds++;
        log.info("Command {}: asking for clarification of {} (round {}/{})",
                s.commandId, request.fields(), s.clarificationRounds, policy.maxClarificationRounds());
        suspend(run, WorkflowPhase.AWAITING_CLARIFICATION);
    }

    /** Park the command on the user, unless a cancel slipped in first. */
    private void suspend(CommandRun run, WorkflowPhase phase) {
        synchronized (run) {
            if (run.isCancelRequested()) {
                stopOnCancel(run, null);
                return;
            }
            WorkflowState s = run.state();
            s.phase = phase;
            s.updatedAt = clock.instant();
            endSegment(run);
            run.publish();
        }
    }

    private void fail(CommandRun run, FailureKind kind, String message, Intent bestEffort) {
        finish(run, WorkflowPhase.FAILED, new CommandFailure(kind, message, bestEffort));
    }

    private void finish(CommandRun run, WorkflowPhase terminal, CommandFailure failure) {
        synchronized (run) {
            WorkflowState s = run.state();
            if (s == null) return;
            s.phase = terminal;
            s.failure = failure;
            s.updatedAt = clock.instant();
            if (run.worker() != null) {
                endSegment(run);
            }
            run.release(s.updatedAt);
            meterRegistry.counter("marco.commands.completed", "outcome", terminal.name().toLowerCase()).increment();
            if (failure != null && terminal == WorkflowPhase.FAILED) {
                log.warn("Command {} FAILED [{}]: {}", s.commandId, failure.kind(), failure.message());
            } else {
                log.info("Command {} {} after {} step(s)", s.commandId, terminal, s.steps.size());
            }
        }
    }

    /** Caller holds the monitor and is (or replaces) the worker. */
    private void endSegment(CommandRun run) {
        WorkflowState s = run.state();
        s.activeTime = s.activeTime.plusNanos(System.nanoTime() - run.segmentStartNanos());
        run.workerFinished();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private CommandRun find(CommandHandle handle) {
        CommandRun run = commands.get(handle.id());
        if (run == null) {
            throw new UnknownCommandException(handle.id());
        }
        return run;
    }

    private static WorkflowState requirePhase(CommandRun run, WorkflowPhase expected, String attempted) {
        WorkflowState s = run.state();
        WorkflowPhase actual = s == null ? run.snapshot().phase() : s.phase;
        if (actual != expected) {
            throw new IllegalCommandStateException(run.snapshot().commandId(), actual, attempted);
        }
        return s;
    }

    /** False once this thread suspended or finished the command; a later segment may own it by now. */
    private static boolean ownsRun(CommandRun run) {
        synchronized (run) {
            return !run.isReleased() && run.worker() == Thread.currentThread();
        }
    }

    private Duration remainingBudget(CommandRun run) {
        WorkflowState s = run.state();
        Duration spent = s.activeTime.plusNanos(System.nanoTime() - run.segmentStartNanos());
        return commandTimeout.minus(spent);
    }

    private static String validationQuestion(ValidationResult result, Intent intent) {
        List<FieldError> errors = result.errors();
        if (errors.size() == 1 && errors.get(0).code() == FieldError.Code.MISSING) {
            return "Which %s should I use for %s?".formatted(errors.get(0).field(), intent.qualifiedName());
        }
        return "I need valid values for %s to run %s (%s).".formatted(
                String.join(", ", result.fields()), intent.qualifiedName(), result.summary());
    }

    private static Callable<ExecutionResult> withMdc(
            Intent intent, Callable<ExecutionResult> body) {
        Map<String, String> parent = MDC.getCopyOfContextMap();
        return () -> {
            if (parent != null) MDC.setContextMap(parent);
            MDC.put("module", intent.module());
            MDC.put("action", intent.action());
            try {
                return body.call();
            } finally {
                MDC.clear();
            }
        };
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
