package com.marco.orchestrator.intent;

import com.marco.orchestrator.registry.ActionSpec;
import com.marco.orchestrator.registry.CapabilityDescriptor;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for IntentValidator. No Spring context.
 */
class IntentValidatorTest {

    static final CapabilityDescriptor FS = CapabilityDescriptor.builder("fs", "files")
            .action(ActionSpec.readOnly("list_dir", "list",
                    ParamSpec.optional("path", ParamType.STRING, "dir")))
            .action(ActionSpec.readOnly("head", "first lines",
                    ParamSpec.required("path", ParamType.STRING, "file"),
                    ParamSpec.optional("lines", ParamType.INTEGER, "count"),
                    ParamSpec.optional("follow", ParamType.BOOLEAN, "tail -f")))
            .destructiveAction(ActionSpec.mutating("delete_file", "delete",
                    ParamSpec.required("path", ParamType.STRING, "file")))
            .build();

    IntentValidator strict  = new IntentValidator(true);
    IntentValidator lenient = new IntentValidator(false);

    // ------------------------------------------------------------------
    // Happy path and coercion
    // ------------------------------------------------------------------

    @Test
    void validIntent_passesWithNoErrors() {
        ValidationResult result = strict.validate(Intent.of("fs", "list_dir", Map.of("path", "src")), FS);

        assertThat(result.isValid()).isTrue();
        assertThat(result.intent().parameters()).containsEntry("path", "src");
    }

    @Test
    void optionalParameterMayBeOmitted() {
        assertThat(strict.validate(Intent.of("fs", "list_dir", Map.of()), FS).isValid()).isTrue();
    }

    @Test
    void stringNumbersAndBooleans_areCoercedToDeclaredTypes() {
        ValidationResult result = strict.validate(
                Intent.of("fs", "head", Map.of("path", "a.txt", "lines", "20", "follow", "yes")), FS);

        assertThat(result.isValid()).isTrue();
        assertThat(result.intent().parameters())
                .containsEntry("lines", 20L)
                .containsEntry("follow", true);
    }

    @Test
    void fractionalValueForInteger_isWrongType() {
        ValidationResult result = strict.validate(
                Intent.of("fs", "head", Map.of("path", "a.txt", "lines", 2.5)), FS);

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).singleElement()
                .satisfies(e -> {
                    assertThat(e.field()).isEqualTo("lines");
                    assertThat(e.code()).isEqualTo(FieldError.Code.WRONG_TYPE);
                });
        assertThat(result.isRecoverable()).isTrue();
    }

    // ------------------------------------------------------------------
    // Recoverable vs structural errors
    // ------------------------------------------------------------------

    @Test
    void missingRequiredParameter_isRecoverable() {
        ValidationResult result = strict.validate(Intent.of("fs", "delete_file", Map.of()), FS);

        assertThat(result.isValid()).isFalse();
        assertThat(result.isRecoverable()).isTrue();
        assertThat(result.fields()).containsExactly("path");
    }

    @Test
    void blankValue_countsAsMissing() {
        ValidationResult result = strict.validate(Intent.of("fs", "delete_file", Map.of("path", "  ")), FS);

        assertThat(result.errors()).extracting(FieldError::code).containsExactly(FieldError.Code.MISSING);
    }

    @Test
    void unknownModule_isNotRecoverable() {
        ValidationResult result = strict.validate(Intent.of("mail", "send", Map.of()), null);

        assertThat(result.isRecoverable()).isFalse();
        assertThat(result.errors()).extracting(FieldError::code).containsExactly(FieldError.Code.UNKNOWN_MODULE);
    }

    @Test
    void unknownAction_isNotRecoverable() {
        ValidationResult result = strict.validate(Intent.of("fs", "format_disk", Map.of()), FS);

        assertThat(result.isRecoverable()).isFalse();
        assertThat(result.summary()).contains("format_disk");
    }

    @Test
    void undeclaredParameter_strictRejects_lenientDrops() {
        Intent intent = Intent.of("fs", "list_dir", Map.of("path", "src", "recursive", true));

        ValidationResult strictResult = strict.validate(intent, FS);
        assertThat(strictResult.isValid()).isFalse();
        assertThat(strictResult.isRecoverable()).isFalse();
        assertThat(strictResult.errors()).extracting(FieldError::code)
                .containsExactly(FieldError.Code.UNKNOWN_PARAMETER);

        ValidationResult lenientResult = lenient.validate(intent, FS);
        assertThat(lenientResult.isValid()).isTrue();
        assertThat(lenientResult.intent().parameters()).containsOnlyKeys("path");
    }
}
