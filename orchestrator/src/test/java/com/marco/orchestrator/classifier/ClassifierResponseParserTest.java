package com.marco.orchestrator.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marco.orchestrator.intent.IntentCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClassifierResponseParserTest {

    final ObjectMapper json = new ObjectMapper();

    @Test
    void parse_candidatesEnvelope() {
        List<IntentCandidate> result = ClassifierResponseParser.parse("""
                {"candidates": [
                  {"module": "fs", "action": "list_dir", "parameters": {"path": "src"},
                   "confidence": 0.95, "missing": [], "ambiguous": []},
                  {"module": "fs", "action": "find_pattern", "parameters": {},
                   "confidence": 0.3, "missing": ["pattern"], "ambiguous": ["path"]}
                ]}
                """, "list files in src", json);

        assertThat(result).hasSize(2);
        IntentCandidate first = result.get(0);
        assertThat(first.intent().qualifiedName()).isEqualTo("fs.list_dir");
        assertThat(first.intent().parameters()).containsEntry("path", "src");
        assertThat(first.intent().rawInput()).isEqualTo("list files in src");
        assertThat(first.confidence()).isEqualTo(0.95);
        assertThat(result.get(1).missingFields()).containsExactly("pattern");
        assertThat(result.get(1).ambiguousFields()).containsExactly("path");
    }

    @Test
    void parse_fencedBareArray() {
        String reply = """
                Here you go:
                ```json
                [{"module": "canvas", "action": "list_courses", "confidence": 0.9}]
                ```
                """;

        List<IntentCandidate> result = ClassifierResponseParser.parse(reply, "my courses", json);

        assertThat(result).singleElement()
                .satisfies(c -> assertThat(c.intent().qualifiedName()).isEqualTo("canvas.list_courses"));
    }

    @Test
    void parse_singleObject() {
        List<IntentCandidate> result = ClassifierResponseParser.parse(
                "{\"module\": \"fs\", \"action\": \"read_file\", \"parameters\": {\"path\": \"a.md\"}, \"confidence\": 1.7}",
                "show a.md", json);

        assertThat(result).singleElement().satisfies(c -> assertThat(c.confidence()).isEqualTo(1.0));
    }

    @Test
    void parse_emptyCandidateList_isNotAFallback() {
        List<IntentCandidate> result = ClassifierResponseParser.parse("{\"candidates\": []}", "thanks", json);

        assertThat(result).isEmpty();
        assertThat(ClassifierResponseParser.isFallback(result)).isFalse();
    }

    @Test
    void garbage_becomesZeroConfidenceCandidate() {
        List<IntentCandidate> result = ClassifierResponseParser.parse("I am not sure what you mean.", "blah", json);

        assertThat(result).singleElement().satisfies(c -> {
            assertThat(c.confidence()).isZero();
            assertThat(c.intent().hasTarget()).isFalse();
            assertThat(c.ambiguousFields()).containsExactlyInAnyOrder("module", "action");
            assertThat(c.intent().rawInput()).isEqualTo("blah");
        });
        assertThat(ClassifierResponseParser.isFallback(result)).isTrue();
    }

    @Test
    void candidateWithoutConfidence_isTreatedAsUnparseable() {
        List<IntentCandidate> result = ClassifierResponseParser.parse(
                "{\"module\": \"fs\", \"action\": \"list_dir\"}", "ls", json);

        assertThat(ClassifierResponseParser.isFallback(result)).isTrue();
    }
}
