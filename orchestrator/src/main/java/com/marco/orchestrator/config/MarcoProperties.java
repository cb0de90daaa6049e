package com.marco.orchestrator.config;

import com.marco.orchestrator.disambiguation.DisambiguationPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * All {@code marco.*} settings. Defaults here match application.yml so the
 * class is usable as-is in unit tests.
 *
 * Secrets (classifier API key, Canvas token) are injected separately with
 * {@code @Value} so they never show up in a properties dump.
 */
@Component
@ConfigurationProperties(prefix = "marco")
public class MarcoProperties {

    private Classifier classifier = new Classifier();
    private Disambiguation disambiguation = new Disambiguation();
    private Workflow workflow = new Workflow();
    private Fs fs = new Fs();
    private Canvas canvas = new Canvas();

    public Classifier getClassifier() { return classifier; }
    public void setClassifier(Classifier classifier) { this.classifier = classifier; }

    public Disambiguation getDisambiguation() { return disambiguation; }
    public void setDisambiguation(Disambiguation disambiguation) { this.disambiguation = disambiguation; }

    public Workflow getWorkflow() { return workflow; }
    public void setWorkflow(Workflow workflow) { this.workflow = workflow; }

    public Fs getFs() { return fs; }
    public void setFs(Fs fs) { this.fs = fs; }

    public Canvas getCanvas() { return canvas; }
    public void setCanvas(Canvas canvas) { this.canvas = canvas; }

    public static class Classifier {
        private String baseUrl = "https://api.anthropic.com";
        private String model = "claude-sonnet-4-6";
        /** Per backend call; a retry gets a fresh timeout. */
        private Duration timeout = Duration.ofSeconds(20);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Disambiguation {
        private double acceptThreshold = 0.8;
        private double completeThreshold = 0.4;
        private int maxClarificationRounds = 3;

        public double getAcceptThreshold() { return acceptThreshold; }
        public void setAcceptThreshold(double acceptThreshold) { this.acceptThreshold = acceptThreshold; }
        public double getCompleteThreshold() { return completeThreshold; }
        public void setCompleteThreshold(double completeThreshold) { this.completeThreshold = completeThreshold; }
        public int getMaxClarificationRounds() { return maxClarificationRounds; }
        public void setMaxClarificationRounds(int maxClarificationRounds) { this.maxClarificationRounds = maxClarificationRounds; }

        public DisambiguationPolicy toPolicy() {
            return new DisambiguationPolicy(acceptThreshold, completeThreshold, maxClarificationRounds);
        }
    }

    public static class Workflow {
        private Duration dispatchTimeout = Duration.ofSeconds(30);
        /** Active processing budget per command; time spent waiting on the user is excluded. */
        private Duration commandTimeout = Duration.ofMinutes(2);
        private Duration confirmationTimeout = Duration.ofMinutes(5);
        /** How long an unanswered clarification question keeps its command alive. */
        private Duration clarificationTimeout = Duration.ofMinutes(30);
        /** How long a finished command's snapshot stays queryable. */
        private Duration retention = Duration.ofMinutes(15);
        private int maxSteps = 5;
        private int workerThreads = 4;

        public Duration getDispatchTimeout() { return dispatchTimeout; }
        public void setDispatchTimeout(Duration dispatchTimeout) { this.dispatchTimeout = dispatchTimeout; }
        public Duration getCommandTimeout() { return commandTimeout; }
        public void setCommandTimeout(Duration commandTimeout) { this.commandTimeout = commandTimeout; }
        public Duration getConfirmationTimeout() { return confirmationTimeout; }
        public void setConfirmationTimeout(Duration confirmationTimeout) { this.confirmationTimeout = confirmationTimeout; }
        public Duration getClarificationTimeout() { return clarificationTimeout; }
        public void setClarificationTimeout(Duration clarificationTimeout) { this.clarificationTimeout = clarificationTimeout; }
        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
        public int getMaxSteps() { return maxSteps; }
        public void setMaxSteps(int maxSteps) { this.maxSteps = maxSteps; }
        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    public static class Fs {
        private String root = ".";
        private long maxReadBytes = 1024 * 1024;
        private int maxMatches = 200;

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public long getMaxReadBytes() { return maxReadBytes; }
        public void setMaxReadBytes(long maxReadBytes) { this.maxReadBytes = maxReadBytes; }
        public int getMaxMatches() { return maxMatches; }
        public void setMaxMatches(int maxMatches) { this.maxMatches = maxMatches; }
    }

    public static class Canvas {
        private String baseUrl = "";
        private Duration requestTimeout = Duration.ofSeconds(15);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }
}
