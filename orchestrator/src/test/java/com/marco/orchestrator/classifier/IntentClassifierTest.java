package com.marco.orchestrator.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marco.orchestrator.intent.Intent;
import com.marco.orchestrator.module.ScriptedModule;
import com.marco.orchestrator.registry.CapabilityRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for IntentClassifier's retry and fallback policy.
 * The backend is a hand-written fake; calls really run on the classifier's executor.
 */
class IntentClassifierTest {

    static final String LIST_SRC = """
            {"candidates": [{"module": "demo", "action": "ping", "parameters": {},
              "confidence": 0.9, "missing": [], "ambiguous": []}]}
            """;

    SimpleMeterRegistry meters;
    ClassifierPrompts   prompts;
    IntentClassifier    classifier;
    CountDownLatch      release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        meters  = new SimpleMeterRegistry();
        ObjectMapper json = new ObjectMapper();
        prompts = new ClassifierPrompts(new CapabilityRegistry(List.of(new ScriptedModule()), meters), json);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        if (classifier != null) classifier.shutdown();
    }

    IntentClassifier classifierWith(ClassifierBackend backend, Duration timeout) {
        classifier = new IntentClassifier(backend, prompts, new ObjectMapper(), meters, timeout);
        return classifier;
    }

    @Test
    void successfulCall_returnsCandidatesAfterOneAttempt() throws Exception {
        ClassifyResult result = classifierWith((s, u) -> LIST_SRC, Duration.ofSeconds(5))
                .classify("ping it", ClassificationContext.empty());

        assertThat(result.isAvailable()).isTrue();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.candidates()).singleElement()
                .satisfies(c -> assertThat(c.intent().qualifiedName()).isEqualTo("demo.ping"));
        assertThat(meters.counter("marco.classifier.calls", "status", "success").count()).isEqualTo(1.0);
    }

    @Test
    void twoConsecutiveTimeouts_unavailableAfterExactlyOneRetry() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ClassifierBackend hanging = (s, u) -> {
            calls.incrementAndGet();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return LIST_SRC;
        };

        ClassifyResult result = classifierWith(hanging, Duration.ofMillis(100))
                .classify("ping it", ClassificationContext.empty());

        assertThat(result.isAvailable()).isFalse();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.unavailableReason()).contains("timed out");
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void transientFailureThenSuccess_isRetriedOnce() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ClassifierBackend flaky = (s, u) -> {
            if (calls.incrementAndGet() == 1) {
                throw new ClassifierBackendException(true, "529 overloaded");
            }
            return LIST_SRC;
        };

        ClassifyResult result = classifierWith(flaky, Duration.ofSeconds(5))
                .classify("ping it", ClassificationContext.empty());

        assertThat(result.isAvailable()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(meters.counter("marco.classifier.calls", "status", "retry").count()).isEqualTo(1.0);
    }

    @Test
    void semanticFailure_isNotRetried() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ClassifierBackend rejecting = (s, u) -> {
            calls.incrementAndGet();
            throw new ClassifierBackendException(false, "401 invalid api key");
        };

        ClassifyResult result = classifierWith(rejecting, Duration.ofSeconds(5))
                .classify("ping it", ClassificationContext.empty());

        assertThat(result.isAvailable()).isFalse();
        assertThat(result.unavailableReason()).contains("401");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void unparseableReply_yieldsZeroConfidenceCandidateWithoutRetry() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ClassifyResult result = classifierWith((s, u) -> {
            calls.incrementAndGet();
            return "no idea";
        }, Duration.ofSeconds(5)).classify("ping it", ClassificationContext.empty());

        assertThat(result.isAvailable()).isTrue();
        assertThat(result.candidates()).singleElement().satisfies(c -> assertThat(c.confidence()).isZero());
        assertThat(calls.get()).isEqualTo(1);
        assertThat(meters.counter("marco.classifier.calls", "status", "unparseable").count()).isEqualTo(1.0);
    }

    @Test
    void userPrompt_carriesFactsStepsAndClarifications() {
        ClassificationContext ctx = new ClassificationContext(
                Map.of("course_id", 42),
                List.of(Intent.of("canvas", "find_course", Map.of("name", "bio"))),
                List.of(new ClarificationExchange("Which path?", Set.of("path"), "notes.txt")),
                null,
                true);

        String user = prompts.user("show assignments for bio", ctx);

        assertThat(user).contains("\"course_id\":42")
                .contains("canvas.find_course(name=bio)")
                .contains("A: notes.txt")
                .contains("follow-up step")
                .endsWith("show assignments for bio\n---\n");
        assertThat(prompts.system()).contains("module \"demo\"").doesNotContain("{{MODULE_DOCS}}");
    }
}
