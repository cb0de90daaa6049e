package com.marco.orchestrator.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marco.orchestrator.config.MarcoProperties;
import com.marco.orchestrator.intent.IntentCandidate;
import com.marco.orchestrator.registry.CapabilityRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Adapter between the workflow and the natural-language backend.
 *
 * Its job is normalisation, not inference:
 * <ol>
 *   <li>Each backend call is bounded by a timeout.</li>
 *   <li>A transient failure (timeout, network, 429/5xx) is retried once.
 *       A second consecutive failure, or any semantic failure, is returned as
 *       {@link ClassifyResult#unavailable}. Worst-case latency is two timeouts.</li>
 *   <li>The reply is parsed by {@link ClassifierResponseParser}; unparseable
 *       output comes back as a zero-confidence candidate rather than an error.</li>
 * </ol>
 *
 * Holds no mutable state besides its executor, so one instance serves every
 * in-flight command.
 */
@Component
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    private static final int MAX_ATTEMPTS = 2;

    private final ClassifierBackend backend;
    private final ClassifierPrompts prompts;
    private final ObjectMapper      json;
    private final MeterRegistry     meterRegistry;
    private final Duration          timeout;

    // Backend calls run here so the caller can stop waiting after the timeout.
    private final ExecutorService calls = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "classifier-call");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public IntentClassifier(ClassifierBackend backend,
                            CapabilityRegistry registry,
                            ObjectMapper objectMapper,
                            MeterRegistry meterRegistry,
                            MarcoProperties properties) {
        this(backend, new ClassifierPrompts(registry, objectMapper), objectMapper, meterRegistry,
                properties.getClassifier().getTimeout());
    }

    public IntentClassifier(ClassifierBackend backend,
                            ClassifierPrompts prompts,
                            ObjectMapper objectMapper,
                            MeterRegistry meterRegistry,
                            Duration timeout) {
        this.backend       = backend;
        this.prompts       = prompts;
        this.json          = objectMapper;
        this.meterRegistry = meterRegistry;
        this.timeout       = timeout;
    }

    /**
     * Classify one piece of user text.
     *
     * @throws InterruptedException if the calling thread is interrupted while
     *         waiting on the backend (command cancellation); the backend call
     *         is abandoned
     */
    public ClassifyResult classify(String text, ClassificationContext context) throws InterruptedException {
        String system = prompts.system();
        String user   = prompts.user(text, context);

        String lastFailure = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Future<String> call = calls.submit(() -> backend.complete(system, user));
            try {
                String reply = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                List<IntentCandidate> candidates = ClassifierResponseParser.parse(reply, text, json);
                count(ClassifierResponseParser.isFallback(candidates) ? "unparseable" : "success");
                log.debug("Classified '{}' into {} candidate(s) after {} attempt(s)",
                        text, candidates.size(), attempt);
                return ClassifyResult.of(candidates, attempt);

            } catch (TimeoutException e) {
                call.cancel(true);
                lastFailure = "classifier timed out after " + timeout.toMillis() + " ms";
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                lastFailure = String.valueOf(cause.getMessage());
                boolean transientFailure = cause instanceof ClassifierBackendException be && be.isTransient();
                if (!transientFailure) {
                    log.warn("Classifier backend failed (not retryable): {}", lastFailure);
                    count("unavailable");
                    return ClassifyResult.unavailable(lastFailure, attempt);
                }
            } catch (InterruptedException e) {
                call.cancel(true);
                throw e;
            }

            if (attempt < MAX_ATTEMPTS) {
                log.warn("Classifier attempt {}/{} failed, retrying once: {}", attempt, MAX_ATTEMPTS, lastFailure);
                count("retry");
            }
        }

        log.error("Classifier unavailable after {} attempts: {}", MAX_ATTEMPTS, lastFailure);
        count("unavailable");
        return ClassifyResult.unavailable(lastFailure, MAX_ATTEMPTS);
    }

    private void count(String status) {
        meterRegistry.counter("marco.classifier.calls", "status", status).increment();
    }

    @PreDestroy
    void shutdown() {
        calls.shutdownNow();
    }
}
