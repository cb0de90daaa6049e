package com.marco.orchestrator.registry;

/**
 * Thrown when a module tries to register after the startup phase has ended.
 * Adding modules mid-session would leave in-flight workflows inconsistent.
 */
public class RegistrationClosedException extends RuntimeException {
    public RegistrationClosedException(String moduleName) {
        super("Capability registry is closed; cannot register module '" + moduleName + "'");
    }
}
