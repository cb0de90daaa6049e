package com.marco.orchestrator.module;

/**
 * Thrown by a module when an action fails.
 *
 * Unchecked so modules only catch it when they can translate a lower-level
 * failure; the orchestrator decides whether to retry or surface it.
 */
public class ModuleExecutionException extends RuntimeException {

    /**
     * TRANSIENT — network hiccup, rate limit, 5xx; safe to retry idempotent actions.
     * REJECTED  — the module refused the request (bad path, forbidden, not found).
     * FAILED    — anything else.
     */
    public enum Kind { TRANSIENT, REJECTED, FAILED }

    private final Kind kind;

    public ModuleExecutionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ModuleExecutionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public boolean isTransient() { return kind == Kind.TRANSIENT; }
}
