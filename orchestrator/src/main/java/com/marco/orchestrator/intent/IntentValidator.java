package com.marco.orchestrator.intent;

import com.marco.orchestrator.registry.ActionSpec;
import com.marco.orchestrator.registry.CapabilityDescriptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates and normalises an intent against its module's descriptor.
 *
 * Checks, in order: module exists, action exists, required parameters are
 * present, values conform to the declared types, and no undeclared
 * parameters are present. Undeclared parameters are an error in strict mode
 * and silently dropped in lenient mode.
 *
 * Errors are reported per field so the orchestrator can ask the user about
 * exactly the fields that need fixing. Side-effect free and thread-safe.
 */
@Component
public class IntentValidator {

    private final boolean strict;

    public IntentValidator(@Value("${marco.workflow.strict-validation:true}") boolean strict) {
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * @param descriptor the registry entry for {@code intent.module()}, or null
     *                   when no such module is registered
     */
    public ValidationResult validate(Intent intent, CapabilityDescriptor descriptor) {
        if (descriptor == null || intent.module().isEmpty()) {
            return new ValidationResult(intent, List.of(new FieldError("module", FieldError.Code.UNKNOWN_MODULE,
                    "Unknown module '" + intent.module() + "'")));
        }
        ActionSpec spec = descriptor.action(intent.action()).orElse(null);
        if (spec == null) {
            return new ValidationResult(intent, List.of(new FieldError("action", FieldError.Code.UNKNOWN_ACTION,
                    "Module '" + descriptor.name() + "' has no action '" + intent.action() + "'")));
        }

        List<FieldError> errors = new ArrayList<>();
        Map<String, Object> normalised = new LinkedHashMap<>();

        for (ParamSpec param : spec.params()) {
            Object value = intent.parameters().get(param.name());
            if (isAbsent(value)) {
                if (param.required()) {
                    errors.add(new FieldError(param.name(), FieldError.Code.MISSING,
                            "Missing required parameter '" + param.name() + "'"));
                }
                continue;
            }
            Object coerced = coerce(value, param.type());
            if (coerced == null) {
                errors.add(new FieldError(param.name(), FieldError.Code.WRONG_TYPE,
                        "Parameter '%s' must be %s but was '%s'".formatted(
                                param.name(), param.type().name().toLowerCase(), value)));
            } else {
                normalised.put(param.name(), coerced);
            }
        }

        for (String name : intent.parameters().keySet()) {
            if (spec.param(name).isEmpty() && strict) {
                errors.add(new FieldError(name, FieldError.Code.UNKNOWN_PARAMETER,
                        "Action '" + intent.qualifiedName() + "' does not accept parameter '" + name + "'"));
            }
        }

        if (!errors.isEmpty()) {
            return new ValidationResult(intent.withParameters(normalised), errors);
        }
        return ValidationResult.ok(intent.withParameters(normalised));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static boolean isAbsent(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    /**
     * Coerce a value to the declared type, or return null when it does not fit.
     *
     * Classifiers often emit every value as a string, so numeric and boolean
     * strings are accepted for INTEGER / NUMBER / BOOLEAN.
     */
    static Object coerce(Object value, ParamType type) {
        return switch (type) {
            case STRING -> value instanceof Map<?, ?> || value instanceof List<?> ? null : value.toString();
            case BOOLEAN -> {
                if (value instanceof Boolean b) yield b;
                if (value instanceof String s) {
                    String t = s.strip().toLowerCase();
                    if (t.equals("true") || t.equals("yes")) yield Boolean.TRUE;
                    if (t.equals("false") || t.equals("no")) yield Boolean.FALSE;
                }
                yield null;
            }
            case INTEGER -> {
                BigDecimal n = toDecimal(value);
                if (n == null) yield null;
                try {
                    yield n.longValueExact();
                } catch (ArithmeticException e) {
                    yield null;
                }
            }
            case NUMBER -> {
                BigDecimal n = toDecimal(value);
                yield n == null ? null : n.doubleValue();
            }
            case OBJECT -> value instanceof Map<?, ?> ? value : null;
        };
    }

    private static BigDecimal toDecimal(Object value) {
        if (value instanceof Number n) {
            try {
                return new BigDecimal(n.toString());
            } catch (NumberFormatException e) {
                return null;   // NaN / Infinity
            }
        }
        if (value instanceof String s) {
            try {
                return new BigDecimal(s.strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
