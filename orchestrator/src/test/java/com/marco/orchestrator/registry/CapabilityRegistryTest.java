package com.marco.orchestrator.registry;

import com.marco.orchestrator.intent.Intent;
import com.marco.orchestrator.module.ExecutionResult;
import com.marco.orchestrator.module.ModuleExecutionException;
import com.marco.orchestrator.module.ScriptedModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for CapabilityRegistry. No Spring context.
 */
class CapabilityRegistryTest {

    SimpleMeterRegistry meters;
    ScriptedModule      demo;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        demo   = new ScriptedModule();
    }

    // ------------------------------------------------------------------
    // Registration phase
    // ------------------------------------------------------------------

    @Test
    void lookupAfterRegister_returnsDescriptor() {
        CapabilityRegistry registry = new CapabilityRegistry(List.of(demo), meters);

        assertThat(registry.lookup("demo")).contains(demo.capabilities());
        assertThat(registry.lookup("nope")).isEmpty();
        assertThat(registry.moduleNames()).containsExactly("demo");
    }

    @Test
    void registerAfterClose_fails() {
        CapabilityRegistry registry = new CapabilityRegistry(meters);
        registry.close();

        assertThatThrownBy(() -> registry.register(demo))
                .isInstanceOf(RegistrationClosedException.class);
    }

    @Test
    void duplicateModuleName_isRejected() {
        CapabilityRegistry registry = new CapabilityRegistry(meters);
        registry.register(demo);

        assertThatThrownBy(() -> registry.register(new ScriptedModule()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("demo");
    }

    @Test
    void lookupBeforeClose_isNotAllowed() {
        CapabilityRegistry registry = new CapabilityRegistry(meters);
        registry.register(demo);

        assertThatThrownBy(() -> registry.lookup("demo")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void closeIsIdempotent() {
        CapabilityRegistry registry = new CapabilityRegistry(List.of(demo), meters);
        registry.close();

        assertThat(registry.isClosed()).isTrue();
        assertThat(registry.lookup("demo")).isPresent();
    }

    // ------------------------------------------------------------------
    // Policy flags
    // ------------------------------------------------------------------

    @Test
    void destructiveAndRetryableFlags_followTheDescriptor() {
        CapabilityRegistry registry = new CapabilityRegistry(List.of(demo), meters);

        assertThat(registry.isDestructive("demo", "purge")).isTrue();
        assertThat(registry.isDestructive("demo", "ping")).isFalse();
        assertThat(registry.isRetryable("demo", "ping")).isTrue();
        assertThat(registry.isRetryable("demo", "create")).isFalse();   // not idempotent
        assertThat(registry.isRetryable("demo", "purge")).isFalse();    // destructive
        assertThat(registry.isRetryable("mail", "send")).isFalse();
    }

    @Test
    void descriptorDeclaringUnknownDestructiveAction_isRejected() {
        assertThatThrownBy(() -> new CapabilityDescriptor("x", "x", Map.of(), Set.of("drop")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("drop");
    }

    // ------------------------------------------------------------------
    // execute() and metrics
    // ------------------------------------------------------------------

    @Test
    void execute_success_isCountedAndTimed() {
        demo.on("ping", p -> ExecutionResult.of("pong", null));
        CapabilityRegistry registry = new CapabilityRegistry(List.of(demo), meters);

        ExecutionResult result = registry.execute(Intent.of("demo", "ping", Map.of()));

        assertThat(result.summary()).isEqualTo("pong");
        assertThat(meters.counter("marco.dispatch.calls",
                "module", "demo", "action", "ping", "status", "success").count()).isEqualTo(1.0);
        assertThat(meters.timer("marco.dispatch.duration", "module", "demo", "action", "ping").count())
                .isEqualTo(1);
    }

    @Test
    void execute_moduleFailure_keepsKindAndCountsStatus() {
        demo.on("ping", p -> {
            throw new ModuleExecutionException(ModuleExecutionException.Kind.TRANSIENT, "busy");
        });
        CapabilityRegistry registry = new CapabilityRegistry(List.of(demo), meters);

        assertThatThrownBy(() -> registry.execute(Intent.of("demo", "ping", Map.of())))
                .isInstanceOfSatisfying(ModuleExecutionException.class,
                        e -> assertThat(e.isTransient()).isTrue());
        assertThat(meters.counter("marco.dispatch.calls",
                "module", "demo", "action", "ping", "status", "transient").count()).isEqualTo(1.0);
    }

    @Test
    void execute_unknownModule_throwsNotFound() {
        CapabilityRegistry registry = new CapabilityRegistry(List.of(demo), meters);

        assertThatThrownBy(() -> registry.execute(Intent.of("mail", "send", Map.of())))
                .isInstanceOf(ModuleNotFoundException.class)
                .hasMessageContaining("mail");
    }

    @Test
    void capabilityDocumentation_listsActionsAndMarksDestructiveOnes() {
        CapabilityRegistry registry = new CapabilityRegistry(List.of(demo), meters);

        String doc = registry.buildCapabilityDocumentation();

        assertThat(doc).startsWith("AVAILABLE MODULES:")
                .contains("module \"demo\"")
                .contains("create(name: string)")
                .contains("purge(target: string)  [destructive]");
    }
}
