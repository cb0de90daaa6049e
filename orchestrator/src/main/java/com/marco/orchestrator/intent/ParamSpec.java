package com.marco.orchestrator.intent;

/**
 * Schema entry for one action parameter.
 *
 * @param name        parameter key as it appears in {@link Intent#parameters()}
 * @param type        declared value type
 * @param required    whether the action cannot run without it
 * @param description one line shown to the classifier and in clarification questions
 */
public record ParamSpec(String name, ParamType type, boolean required, String description) {

    public static ParamSpec required(String name, ParamType type, String description) {
        return new ParamSpec(name, type, true, description);
    }

    public static ParamSpec optional(String name, ParamType type, String description) {
        return new ParamSpec(name, type, false, description);
    }

    /** "path: string" or "path?: string" */
    public String signature() {
        return name + (required ? "" : "?") + ": " + type.name().toLowerCase();
    }
}
