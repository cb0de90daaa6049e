package com.marco.orchestrator.module;

import com.marco.orchestrator.registry.CapabilityDescriptor;

import java.util.Map;

/**
 * Execution contract every capability module implements (file-system,
 * learning platform, future modules).
 *
 * Modules are Spring beans collected into the
 * {@link com.marco.orchestrator.registry.CapabilityRegistry} at startup.
 * The orchestrator only calls {@link #execute} with an intent that has
 * already been validated against {@link #capabilities()}, so parameter
 * values arrive with their declared types.
 *
 * <p>Implementations run on the orchestrator's dispatch executor and must
 * honour thread interruption: a cancelled command interrupts the call.
 */
public interface McpModule {

    /** Identity and schema; must return the same descriptor on every call. */
    CapabilityDescriptor capabilities();

    /**
     * Run one action.
     *
     * @throws ModuleExecutionException on any module-reported failure
     */
    ExecutionResult execute(String action, Map<String, Object> parameters) throws ModuleExecutionException;
}
