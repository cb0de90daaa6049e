package com.marco.orchestrator.classifier;

/**
 * The natural-language model behind the classifier.
 *
 * Implementations do one round trip and nothing else: no retries, no
 * parsing. Timeouts and the retry budget are enforced by
 * {@link IntentClassifier}.
 */
public interface ClassifierBackend {

    /**
     * Send one prompt pair and return the model's raw text reply.
     *
     * @throws ClassifierBackendException when the backend cannot produce a reply;
     *         {@link ClassifierBackendException#isTransient()} tells the caller
     *         whether a retry could help
     */
    String complete(String systemPrompt, String userPrompt);
}
