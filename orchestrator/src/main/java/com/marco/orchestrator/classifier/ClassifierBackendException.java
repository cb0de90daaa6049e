package com.marco.orchestrator.classifier;

/**
 * Thrown by a {@link ClassifierBackend} when no reply could be obtained.
 *
 * Transient failures (network errors, HTTP 429 / 5xx, timeouts) are retried
 * once by {@link IntentClassifier}; semantic failures (bad request, auth
 * failure, empty reply) are surfaced straight away.
 */
public class ClassifierBackendException extends RuntimeException {

    private final boolean transientFailure;

    public ClassifierBackendException(boolean transientFailure, String message) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public ClassifierBackendException(boolean transientFailure, String message, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() { return transientFailure; }
}
