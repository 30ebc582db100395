package com.yamlguard.plugins.yaml.analyzers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.yamlguard.plugins.yaml.IndentationError;
import java.util.List;
import org.junit.jupiter.api.Test;

class HeuristicLineAnalyzerTest {

    private final HeuristicLineAnalyzer analyzer = new HeuristicLineAnalyzer(2);

    @Test
    void continuationSnapsToClosestOpenColumn() {
        List<IndentationError> errors = analyzer.analyze("a: value\n       continuation\n");

        assertThat(errors)
                .extracting(IndentationError::getLine, IndentationError::getExpectedIndent,
                        IndentationError::getActualIndent, IndentationError::getMessage)
                .containsExactly(tuple(2, 3, 8, "indentation mismatch: expected column 3, found 8"));
        assertThat(errors.get(0).getPath()).isEqualTo("root");
    }

    @Test
    void equallyCloseColumnsPreferTheShallowerOne() {
        List<IndentationError> errors = analyzer.analyze("a: value\n continuation\n");

        assertThat(errors).extracting(IndentationError::getExpectedIndent).containsExactly(1);
    }

    @Test
    void reportsNestedKeyWithPath() {
        List<IndentationError> errors = analyzer.analyze("a:\n  b:\n     c: 1\n");

        assertThat(errors)
                .extracting(IndentationError::getLine, IndentationError::getExpectedIndent,
                        IndentationError::getActualIndent, IndentationError::getPath, IndentationError::getMessage)
                .containsExactly(tuple(3, 5, 6, "a.b", "key indentation mismatch: expected column 5, found 6"));
    }

    @Test
    void reportsMisplacedSequenceItem() {
        List<IndentationError> errors = analyzer.analyze("list:\n   - x\n");

        assertThat(errors)
                .extracting(IndentationError::getExpectedIndent, IndentationError::getActualIndent,
                        IndentationError::getPath)
                .containsExactly(tuple(3, 4, "list"));
        assertThat(errors.get(0).getMessage()).startsWith("sequence item indentation mismatch");
    }

    @Test
    void acceptsListOfMappings() {
        String text = "items:\n  - name: a\n    value: 1\n  - name: b\n    value: 2\n";

        assertThat(analyzer.analyze(text)).isEmpty();
    }

    @Test
    void skipsBlockScalarBodiesAndFlowContinuations() {
        String text = "a: |\n      free text\n   more\nb: [1,\n      2]\nc: 1\n";

        assertThat(analyzer.analyze(text)).isEmpty();
    }

    @Test
    void documentMarkerStartsFresh() {
        List<IndentationError> errors = analyzer.analyze("a:\n    b: 1\n---\na:\n  b: 1\n");

        assertThat(errors).extracting(IndentationError::getLine).containsExactly(2);
    }

    @Test
    void ignoresCommentsAndColonsInsideQuotes() {
        String text = "a:\n     # comment\n  \"b: c\": 1\n  d: 'x: y'\n";

        assertThat(analyzer.analyze(text)).isEmpty();
    }

    @Test
    void countsTabsAsSingleColumns() {
        List<IndentationError> errors = analyzer.analyze("a:\n\tb: 1\n");

        assertThat(errors)
                .extracting(IndentationError::getExpectedIndent, IndentationError::getActualIndent)
                .containsExactly(tuple(3, 2));
    }

    @Test
    void toleratesEmptyAndUnbalancedInput() {
        assertThat(analyzer.analyze("")).isEmpty();
        assertThat(analyzer.analyze("a: [\n")).isEmpty();
        assertThat(analyzer.analyze("- - - :\n  ]]]\n:")).isNotNull();
    }

    @Test
    void recognisesLexicalCues() {
        assertThat(HeuristicLineAnalyzer.isSequenceItem("- x")).isTrue();
        assertThat(HeuristicLineAnalyzer.isSequenceItem("-1")).isFalse();
        assertThat(HeuristicLineAnalyzer.keyIndicator("url: http://x")).isEqualTo(3);
        assertThat(HeuristicLineAnalyzer.keyIndicator("http://x")).isEqualTo(-1);
        assertThat(HeuristicLineAnalyzer.isBlockScalarHeader(">-")).isTrue();
        assertThat(HeuristicLineAnalyzer.isBlockScalarHeader("|2 # note")).isTrue();
        assertThat(HeuristicLineAnalyzer.isBlockScalarHeader("| x")).isFalse();
        assertThat(HeuristicLineAnalyzer.bracketBalance("{a: [1, \"]\"")).isEqualTo(2);
    }
}
