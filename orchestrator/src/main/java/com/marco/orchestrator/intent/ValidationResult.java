package com.marco.orchestrator.intent;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of {@link IntentValidator#validate}.
 *
 * @param intent the normalised intent (coerced parameter types, unknown
 *               parameters dropped in lenient mode); the input intent when
 *               validation fails structurally
 * @param errors field-level problems, empty when the intent is dispatch-eligible
 */
public record ValidationResult(Intent intent, List<FieldError> errors) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult ok(Intent intent) {
        return new ValidationResult(intent, List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /** True when every error could be fixed by a clarification round. */
    public boolean isRecoverable() {
        return !errors.isEmpty() && errors.stream().allMatch(FieldError::isRecoverable);
    }

    public Set<String> fields() {
        Set<String> fields = new LinkedHashSet<>();
        errors.forEach(e -> fields.add(e.field()));
        return fields;
    }

    public String summary() {
        return String.join("; ", errors.stream().map(FieldError::message).toList());
    }
}
