package com.marco.orchestrator.intent;

/**
 * One field-level validation problem.
 *
 * @param field   parameter name, or "module" / "action" for structural errors
 * @param code    what went wrong
 * @param message human readable detail
 */
public record FieldError(String field, Code code, String message) {

    public enum Code { MISSING, WRONG_TYPE, UNKNOWN_PARAMETER, UNKNOWN_MODULE, UNKNOWN_ACTION }

    /** MISSING and WRONG_TYPE can be fixed by asking the user. */
    public boolean isRecoverable() {
        return code == Code.MISSING || code == Code.WRONG_TYPE;
    }
}
