package com.marco.orchestrator.registry;

import com.marco.orchestrator.intent.ParamSpec;

import java.util.List;
import java.util.Optional;

/**
 * Schema and retry metadata for one module action.
 *
 * @param name        action identifier, e.g. "list_dir"
 * @param description one sentence injected into the classifier prompt
 * @param params      parameter schema, in display order
 * @param idempotent  true for read-only actions the orchestrator may retry once
 *                    after a transient failure
 */
public record ActionSpec(
        String          name,
        String          description,
        List<ParamSpec> params,
        boolean         idempotent) {

    public ActionSpec {
        params = params == null ? List.of() : List.copyOf(params);
    }

    public static ActionSpec readOnly(String name, String description, ParamSpec... params) {
        return new ActionSpec(name, description, List.of(params), true);
    }

    public static ActionSpec mutating(String name, String description, ParamSpec... params) {
        return new ActionSpec(name, description, List.of(params), false);
    }

    public Optional<ParamSpec> param(String paramName) {
        return params.stream().filter(p -> p.name().equals(paramName)).findFirst();
    }

    /** "list_dir(path?: string)" */
    public String signature() {
        return name + "(" + String.join(", ", params.stream().map(ParamSpec::signature).toList()) + ")";
    }
}
