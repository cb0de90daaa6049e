package com.marco.orchestrator.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marco.orchestrator.intent.Intent;
import com.marco.orchestrator.intent.IntentCandidate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the classifier backend's reply into {@link IntentCandidate}s.
 *
 * Accepted shapes (optionally wrapped in a ```json fence):
 * <pre>
 *   {"candidates": [ {candidate}, ... ]}
 *   [ {candidate}, ... ]
 *   {candidate}
 * </pre>
 * where a candidate is
 * <pre>
 *   {"module": "fs", "action": "list_dir", "parameters": {"path": "src"},
 *    "confidence": 0.93, "missing": [], "ambiguous": []}
 * </pre>
 *
 * A reply that does not fit is not dropped: it becomes a single candidate
 * with confidence 0 whose module and action are marked ambiguous.
 */
public final class ClassifierResponseParser {

    // Matches ```json ... ``` or ``` ... ```
    private static final Pattern JSON_FENCE = Pattern.compile(
            "```(?:json)?\\s*\\n?(.*?)\\n?```",
            Pattern.DOTALL
    );

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /** Fields marked ambiguous on the fallback candidate. */
    static final Set<String> UNPARSEABLE_FIELDS = Set.of("module", "action");

    private ClassifierResponseParser() {}

    public static List<IntentCandidate> parse(String reply, String rawInput, ObjectMapper json) {
        if (reply == null || reply.isBlank()) {
            return List.of(unparseable(rawInput));
        }
        try {
            JsonNode root = json.readTree(stripFence(reply));
            JsonNode list = root.isObject() && root.has("candidates") ? root.get("candidates") : root;

            List<IntentCandidate> candidates = new ArrayList<>();
            if (list.isArray()) {
                for (JsonNode node : list) {
                    candidates.add(toCandidate(node, rawInput, json));
                }
            } else {
                candidates.add(toCandidate(list, rawInput, json));
            }
            return candidates;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return List.of(unparseable(rawInput));
        }
    }

    /** Extract the body of the first fenced block, or the whole reply when there is none. */
    static String stripFence(String reply) {
        Matcher m = JSON_FENCE.matcher(reply);
        return m.find() ? m.group(1).strip() : reply.strip();
    }

    static IntentCandidate unparseable(String rawInput) {
        return new IntentCandidate(new Intent("", "", Map.of(), rawInput), 0.0, Set.of(), UNPARSEABLE_FIELDS);
    }

    /** True when {@code candidates} is the single zero-confidence stand-in for an unparseable reply. */
    public static boolean isFallback(List<IntentCandidate> candidates) {
        if (candidates.size() != 1) return false;
        IntentCandidate c = candidates.get(0);
        return c.confidence() == 0.0 && !c.intent().hasTarget()
                && c.ambiguousFields().equals(UNPARSEABLE_FIELDS);
    }

    private static IntentCandidate toCandidate(JsonNode node, String rawInput, ObjectMapper json) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("candidate is not an object: " + node);
        }
        JsonNode confidence = node.get("confidence");
        if (confidence == null || !confidence.isNumber()) {
            throw new IllegalArgumentException("candidate has no numeric confidence");
        }
        JsonNode params = node.get("parameters");
        Map<String, Object> parameters = params == null || params.isNull()
                ? Map.of()
                : json.convertValue(params, MAP_TYPE);

        Intent intent = new Intent(text(node, "module"), text(node, "action"), parameters, rawInput);
        return new IntentCandidate(intent, confidence.asDouble(),
                names(node.get("missing")), names(node.get("ambiguous")));
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? "" : v.asText();
    }

    private static Set<String> names(JsonNode array) {
        Set<String> out = new LinkedHashSet<>();
        if (array != null && array.isArray()) {
            array.forEach(n -> out.add(n.asText()));
        }
        return out;
    }
}
