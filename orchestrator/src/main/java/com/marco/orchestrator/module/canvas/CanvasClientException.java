package com.marco.orchestrator.module.canvas;

/**
 * Thrown by {@link CanvasClient} when a request fails.
 *
 * {@code status} is the HTTP status code, or 0 when no response arrived.
 */
public class CanvasClientException extends RuntimeException {

    private final int status;

    public CanvasClientException(int status, String message) {
        super(message);
        this.status = status;
    }

    public CanvasClientException(String message, Throwable cause) {
        this(0, message, cause);
    }

    public CanvasClientException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() { return status; }

    /** No response, rate limited, or a server-side error. */
    public boolean isTransient() {
        return status == 0 || status == 429 || status >= 500;
    }

    public boolean isAuthFailure() {
        return status == 401 || status == 403;
    }
}
