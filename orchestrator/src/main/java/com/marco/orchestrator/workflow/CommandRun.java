package com.marco.orchestrator.workflow;

import java.time.Instant;

/**
 * Book-keeping around one command's {@link WorkflowState}: the published
 * snapshot, the worker thread currently driving it and the cancellation flag.
 *
 * Every phase change that can race with {@code cancel}, {@code answer} or
 * {@code confirm} happens while holding this object's monitor.
 */
class CommandRun {

    private WorkflowState state;
    private volatile WorkflowSnapshot snapshot;
    private volatile boolean cancelRequested;
    private volatile Instant finishedAt;

    // Worker thread running the state machine; null while queued, suspended or finished.
    private Thread worker;
    private long segmentStartNanos;

    CommandRun(WorkflowState state) {
        this.state = state;
        this.snapshot = state.snapshot();
    }

    WorkflowState state() {
        return state;
    }

    WorkflowSnapshot snapshot() {
        return snapshot;
    }

    void publish() {
        WorkflowState s = state;
        if (s != null) {
            snapshot = s.snapshot();
        }
    }

    boolean isCancelRequested() {
        return cancelRequested;
    }

    void requestCancel() {
        cancelRequested = true;
    }

    Instant finishedAt() {
        return finishedAt;
    }

    /** Publish the terminal snapshot and drop the live state. */
    void release(Instant now) {
        publish();
        finishedAt = now;
        state = null;
    }

    boolean isReleased() {
        return state == null;
    }

    Thread worker() {
        return worker;
    }

    void workerStarted(Thread thread, long startNanos) {
        this.worker = thread;
        this.segmentStartNanos = startNanos;
    }

    long segmentStartNanos() {
        return segmentStartNanos;
    }

    void workerFinished() {
        this.worker = null;
    }
}
