package com.marco.orchestrator.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marco.orchestrator.intent.Intent;
import com.marco.orchestrator.registry.CapabilityRegistry;

/**
 * Prompts sent to the classifier backend.
 *
 * The module list comes from {@link CapabilityRegistry#buildCapabilityDocumentation()}
 * so the prompt always matches the registered module set.
 */
public class ClassifierPrompts {

    private final String systemPrompt;
    private final ObjectMapper json;

    public ClassifierPrompts(CapabilityRegistry registry, ObjectMapper json) {
        this.systemPrompt = SYSTEM_PROMPT.replace("{{MODULE_DOCS}}", registry.buildCapabilityDocumentation());
        this.json = json;
    }

    public String system() {
        return systemPrompt;
    }

    /**
     * Build the user message: the text to classify plus whatever the workflow
     * has learned so far.
     */
    public String user(String text, ClassificationContext ctx) {
        StringBuilder sb = new StringBuilder();

        if (!ctx.facts().isEmpty()) {
            sb.append("=== KNOWN FACTS ===\n").append(toJson(ctx.facts())).append("\n\n");
        }
        if (!ctx.completedSteps().isEmpty()) {
            sb.append("=== STEPS ALREADY EXECUTED ===\n");
            for (Intent step : ctx.completedSteps()) {
                sb.append("- ").append(step.describe()).append('\n');
            }
            sb.append('\n');
        }
        if (ctx.partialIntent() != null) {
            sb.append("=== PARTIAL INTENT BEING COMPLETED ===\n")
              .append(ctx.partialIntent().describe()).append("\n\n");
        }
        if (!ctx.clarifications().isEmpty()) {
            sb.append("=== CLARIFICATIONS FROM THE USER ===\n");
            for (ClarificationExchange c : ctx.clarifications()) {
                sb.append("Q: ").append(c.question()).append('\n')
                  .append("A: ").append(c.answer()).append('\n');
            }
            sb.append('\n');
        }
        if (ctx.followUp()) {
            sb.append("This is a follow-up step. Return the NEXT intent needed to finish the ")
              .append("request, or {\"candidates\": []} if nothing is left to do.\n\n");
        }

        sb.append("Now classify this command:\n---\n").append(text).append("\n---\n");
        return sb.toString();
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static final String SYSTEM_PROMPT = """
            You are the intent parser of Marco, a natural-language command agent.
            You turn a user's command into structured intents. Output *only* JSON.

            {{MODULE_DOCS}}

            OUTPUT FORMAT:
            {"candidates": [
              {"module": "<module>", "action": "<action>",
               "parameters": { ... },
               "confidence": <0.0 - 1.0>,
               "missing": ["<required parameter you could not fill>"],
               "ambiguous": ["<parameter you had to guess>"]}
            ]}

            RULES:
              - Rank candidates from most to least likely. Include alternatives only
                when the command is genuinely ambiguous.
              - Never invent parameter values. If the command does not say which file,
                course, etc. it means, list that parameter under "missing".
              - Use facts from KNOWN FACTS (e.g. course_id) to fill parameters.
              - Return {"candidates": []} when the command matches no module.

            EXAMPLES:
            User: "List all files in src"
            {"candidates": [{"module": "fs", "action": "list_dir", "parameters": {"path": "src"},
              "confidence": 0.95, "missing": [], "ambiguous": []}]}

            User: "Find TODO comments in pkg/"
            {"candidates": [{"module": "fs", "action": "find_pattern",
              "parameters": {"pattern": "TODO", "path": "pkg"},
              "confidence": 0.9, "missing": [], "ambiguous": []}]}

            User: "delete it"
            {"candidates": [{"module": "fs", "action": "delete_file", "parameters": {},
              "confidence": 0.7, "missing": ["path"], "ambiguous": []}]}
            """;
}
