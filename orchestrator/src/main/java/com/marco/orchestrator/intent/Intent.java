package com.marco.orchestrator.intent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The canonical unit of dispatch: (module, action, parameters).
 *
 * An Intent is immutable. The classifier may hand back an incomplete one
 * (blank module or action, missing parameters) inside an
 * {@link IntentCandidate}; only an Intent that passes
 * {@link IntentValidator#validate} is dispatch-eligible.
 *
 * @param module     target capability module, e.g. "fs"
 * @param action     operation within the module, e.g. "list_dir"
 * @param parameters parameter name to value (String, Number, Boolean or nested Map)
 * @param rawInput   the user's original text; kept for logs and clarification prompts,
 *                   never consulted when routing
 */
public record Intent(
        String              module,
        String              action,
        Map<String, Object> parameters,
        String              rawInput) {

    public Intent {
        module     = module == null ? "" : module.strip();
        action     = action == null ? "" : action.strip();
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        rawInput   = rawInput == null ? "" : rawInput;
    }

    public static Intent of(String module, String action, Map<String, Object> parameters) {
        return new Intent(module, action, parameters, "");
    }

    /** "fs.list_dir" — used in logs, metric tags and confirmation prompts. */
    public String qualifiedName() {
        return module + "." + action;
    }

    public boolean hasTarget() {
        return !module.isEmpty() && !action.isEmpty();
    }

    /** Returns a copy of this intent with {@code name} set to {@code value}. */
    public Intent withParameter(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(parameters);
        copy.put(name, value);
        return new Intent(module, action, copy, rawInput);
    }

    public Intent withParameters(Map<String, Object> replacement) {
        return new Intent(module, action, replacement, rawInput);
    }

    public Intent withRawInput(String text) {
        return new Intent(module, action, parameters, text);
    }

    /** Human readable form, e.g. {@code fs.delete_file(path=tmp/a.txt)}. */
    public String describe() {
        StringBuilder sb = new StringBuilder(qualifiedName()).append('(');
        String sep = "";
        for (Map.Entry<String, Object> e : parameters.entrySet()) {
            sb.append(sep).append(e.getKey()).append('=').append(e.getValue());
            sep = ", ";
        }
        return sb.append(')').toString();
    }
}
