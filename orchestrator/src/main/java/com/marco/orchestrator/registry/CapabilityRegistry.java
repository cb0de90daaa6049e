package com.marco.orchestrator.registry;

import com.marco.orchestrator.intent.Intent;
import com.marco.orchestrator.intent.ParamSpec;
import com.marco.orchestrator.module.ExecutionResult;
import com.marco.orchestrator.module.McpModule;
import com.marco.orchestrator.module.ModuleExecutionException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide capability registry with a two-phase lifecycle.
 *
 * <ol>
 *   <li><b>Open</b> — {@link #register} adds modules. Lookups are refused.</li>
 *   <li><b>Closed</b> — {@link #close} freezes the module map. From then on
 *       the registry is immutable and safe for concurrent reads from every
 *       in-flight command; {@link #register} throws
 *       {@link RegistrationClosedException}.</li>
 * </ol>
 *
 * Under Spring every {@link McpModule} bean is collected via constructor
 * injection, registered, and the registry is closed before any command can
 * be submitted.
 */
@Component
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final MeterRegistry meterRegistry;

    // Mutable only while open; replaced by an immutable copy on close().
    private Map<String, McpModule> modules = new LinkedHashMap<>();
    private volatile boolean closed = false;

    /** Creates an open registry; call {@link #register} then {@link #close}. */
    public CapabilityRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Spring collects every {@code McpModule} bean and passes the list here.
     * Adding a new module only requires declaring it as {@code @Component}.
     */
    @Autowired
    public CapabilityRegistry(List<McpModule> allModules, MeterRegistry meterRegistry) {
        this(meterRegistry);
        allModules.forEach(this::register);
        close();
    }

    // ------------------------------------------------------------------
    // Startup phase
    // ------------------------------------------------------------------

    public synchronized void register(McpModule module) {
        CapabilityDescriptor descriptor = module.capabilities();
        if (closed) {
            throw new RegistrationClosedException(descriptor.name());
        }
        if (modules.containsKey(descriptor.name())) {
            throw new IllegalArgumentException("Module '" + descriptor.name() + "' is already registered");
        }
        modules.put(descriptor.name(), module);
        log.info("Registered module '{}' actions={} destructive={}",
                descriptor.name(), descriptor.actions().keySet(), descriptor.destructiveActions());
    }

    /** Ends the registration phase. Idempotent. */
    public synchronized void close() {
        if (closed) return;
        modules = Map.copyOf(modules);
        closed = true;
        log.info("Capability registry closed with {} module(s): {}", modules.size(), moduleNames());
    }

    public boolean isClosed() {
        return closed;
    }

    // ------------------------------------------------------------------
    // Lookup (closed phase only)
    // ------------------------------------------------------------------

    public Optional<CapabilityDescriptor> lookup(String moduleName) {
        requireClosed();
        McpModule module = modules.get(moduleName);
        return module == null ? Optional.empty() : Optional.of(module.capabilities());
    }

    public McpModule module(String moduleName) {
        requireClosed();
        McpModule module = modules.get(moduleName);
        if (module == null) {
            throw new ModuleNotFoundException(moduleName);
        }
        return module;
    }

    public boolean isDestructive(String moduleName, String action) {
        return lookup(moduleName).map(d -> d.isDestructive(action)).orElse(false);
    }

    /** True only for declared-idempotent, non-destructive actions. */
    public boolean isRetryable(String moduleName, String action) {
        return lookup(moduleName)
                .filter(d -> !d.isDestructive(action))
                .flatMap(d -> d.action(action))
                .map(ActionSpec::idempotent)
                .orElse(false);
    }

    /** Returns all registered module names (sorted). */
    public List<String> moduleNames() {
        return modules.keySet().stream().sorted().toList();
    }

    public List<CapabilityDescriptor> descriptors() {
        requireClosed();
        return modules.values().stream()
                .map(McpModule::capabilities)
                .sorted(Comparator.comparing(CapabilityDescriptor::name))
                .toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Execute a validated intent on its owning module.
     *
     * Every call is timed and counted:
     * <pre>
     *   marco.dispatch.calls{module, action, status="success|transient|rejected|failed|interrupted"}
     *   marco.dispatch.duration{module, action}
     * </pre>
     *
     * @throws ModuleExecutionException on module failure
     * @throws ModuleNotFoundException  if the module is not registered
     */
    public ExecutionResult execute(Intent intent) {
        McpModule module = module(intent.module());

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return module.execute(intent.action(), intent.parameters());
        } catch (ModuleExecutionException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            status = Thread.currentThread().isInterrupted() ? "interrupted" : "failed";
            throw new ModuleExecutionException(ModuleExecutionException.Kind.FAILED,
                    "Unexpected error in " + intent.qualifiedName() + ": " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("marco.dispatch.duration",
                    "module", intent.module(), "action", intent.action()));
            meterRegistry.counter("marco.dispatch.calls",
                    "module", intent.module(), "action", intent.action(), "status", status).increment();
        }
    }

    // ------------------------------------------------------------------
    // Capability documentation
    // ------------------------------------------------------------------

    /**
     * Render the AVAILABLE MODULES block injected into the classifier prompt.
     *
     * Derived from the live descriptors, so a newly registered module is
     * visible to the classifier without touching the prompt text.
     */
    public String buildCapabilityDocumentation() {
        StringBuilder sb = new StringBuilder("AVAILABLE MODULES:\n");
        for (CapabilityDescriptor d : descriptors()) {
            sb.append("\nmodule \"").append(d.name()).append("\" - ").append(d.description()).append('\n');
            for (ActionSpec a : d.actions().values()) {
                sb.append("  ").append(a.signature());
                if (d.isDestructive(a.name())) {
                    sb.append("  [destructive]");
                }
                sb.append("\n      ").append(a.description()).append('\n');
                for (ParamSpec p : a.params()) {
                    if (p.description() != null && !p.description().isBlank()) {
                        sb.append("      - ").append(p.name()).append(": ").append(p.description()).append('\n');
                    }
                }
            }
        }
        return sb.toString();
    }

    private void requireClosed() {
        if (!closed) {
            throw new IllegalStateException("Capability registry is still in its registration phase");
        }
    }
}
