package com.yamlguard.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yamlguard.api.LintResult;
import com.yamlguard.api.error.LintError;
import com.yamlguard.api.error.Severity;
import com.yamlguard.plugins.yaml.IndentationError;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonLinesFormatterTest {

    private final JsonLinesFormatter formatter = new JsonLinesFormatter();
    private final ObjectMapper mapper = new ObjectMapper();

    private static LintResult result(LintError... errors) {
        return LintResult.builder().errors(List.of(errors)).build();
    }

    @Test
    void writesOneObjectPerFinding() throws Exception {
        LintResult result = result(new IndentationError(2, 5, 3, 5, "a",
                "key indentation mismatch: expected column 3, found 5", Severity.ERROR));

        List<String> lines = formatter.formatFile(Path.of("deploy.yaml"), result);

        assertThat(lines).hasSize(1);
        assertThat(lines.get(0)).startsWith("{\"file\":\"deploy.yaml\",\"type\":\"indentation\"");
        JsonNode node = mapper.readTree(lines.get(0));
        assertThat(node.get("expected").asInt()).isEqualTo(3);
        assertThat(node.get("actual").asInt()).isEqualTo(5);
        assertThat(node.get("path").asText()).isEqualTo("a");
        assertThat(node.get("severity").asText()).isEqualTo("error");
    }

    @Test
    void summaryHonoursFailOnThreshold() throws Exception {
        Map<Path, LintResult> results = new LinkedHashMap<>();
        results.put(Path.of("a.yaml"), result(new LintError(LintError.TYPE_PARSE, Severity.INFO, "note", 1, 1)));
        results.put(Path.of("b.yaml"), result());

        JsonNode lenient = mapper.readTree(formatter.formatSummary(results, Severity.ERROR));
        JsonNode strict = mapper.readTree(formatter.formatSummary(results, Severity.INFO));

        assertThat(lenient.get("type").asText()).isEqualTo("summary");
        assertThat(lenient.get("files").asInt()).isEqualTo(2);
        assertThat(lenient.get("info").asLong()).isEqualTo(1);
        assertThat(lenient.get("errors").asLong()).isZero();
        assertThat(lenient.get("success").asBoolean()).isTrue();
        assertThat(strict.get("success").asBoolean()).isFalse();
    }

    @Test
    void fatalFindingsCountAsErrors() throws Exception {
        Map<Path, LintResult> results = Map.of(Path.of("x.yaml"),
                result(new LintError(LintError.TYPE_FILE, Severity.FATAL, "Error processing file: io", 1, 1)));

        JsonNode summary = mapper.readTree(formatter.formatSummary(results, Severity.ERROR));

        assertThat(summary.get("errors").asLong()).isEqualTo(1);
        assertThat(summary.get("success").asBoolean()).isFalse();
    }
}
