package com.marco.orchestrator.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry entry for one module: what it can do and which of those
 * operations need a confirmation first.
 *
 * Built once per module at startup and read-only afterwards.
 */
public record CapabilityDescriptor(
        String                  name,
        String                  description,
        Map<String, ActionSpec> actions,
        Set<String>             destructiveActions) {

    public CapabilityDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("module name must not be blank");
        }
        actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions == null ? Map.of() : actions));
        destructiveActions = destructiveActions == null ? Set.of() : Set.copyOf(destructiveActions);
        for (String destructive : destructiveActions) {
            if (!actions.containsKey(destructive)) {
                throw new IllegalArgumentException(
                        "destructive action '" + destructive + "' is not declared by module '" + name + "'");
            }
        }
    }

    public static Builder builder(String name, String description) {
        return new Builder(name, description);
    }

    public Optional<ActionSpec> action(String actionName) {
        return Optional.ofNullable(actions.get(actionName));
    }

    public boolean isDestructive(String actionName) {
        return destructiveActions.contains(actionName);
    }

    public static final class Builder {
        private final String name;
        private final String description;
        private final Map<String, ActionSpec> actions = new LinkedHashMap<>();
        private final Set<String> destructive = new LinkedHashSet<>();

        private Builder(String name, String description) {
            this.name = name;
            this.description = description;
        }

        public Builder action(ActionSpec spec) {
            actions.put(spec.name(), spec);
            return this;
        }

        /** Declares an action that must be confirmed before dispatch. */
        public Builder destructiveAction(ActionSpec spec) {
            actions.put(spec.name(), spec);
            destructive.add(spec.name());
            return this;
        }

        public CapabilityDescriptor build() {
            return new CapabilityDescriptor(name, description, actions, destructive);
        }
    }
}
