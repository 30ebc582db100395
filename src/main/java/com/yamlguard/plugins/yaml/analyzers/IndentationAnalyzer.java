package com.yamlguard.plugins.yaml.analyzers;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.yamlguard.api.error.Severity;
import com.yamlguard.plugins.yaml.IndentationError;
import com.yamlguard.plugins.yaml.StructureEvent;
import com.yamlguard.plugins.yaml.TokenStream;
import com.yamlguard.plugins.yaml.YamlPath;
import com.yamlguard.util.LoggerUtil;

/**
 * Structural indentation walker over a {@link TokenStream}.
 * <p>
 * Keeps one expected column per open key or sequence item. Opening pushes
 * {@code parent + step}, the matching {@code LEVEL_END} pops it again, so the
 * expectation at any depth depends only on the depth. Instances hold
 * configuration only and may be shared between threads.
 */
public class IndentationAnalyzer {
    private static final Logger logger = LoggerUtil.getLogger(IndentationAnalyzer.class);

    private final int indentStep;
    private final boolean strict;

    public IndentationAnalyzer(int indentStep, boolean strict) {
        this.indentStep = validateStep(indentStep);
        this.strict = strict;
    }

    public int getIndentStep() {
        return indentStep;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Mismatched placements as errors, ascending by line then column.
     */
    public List<IndentationError> analyze(TokenStream stream) {
        List<IndentationError> errors = new ArrayList<>();
        for (Placement placement : place(stream)) {
            if (!placement.matches()) {
                errors.add(toError(placement));
            }
        }
        errors.sort(IndentationError.DOCUMENT_ORDER);
        logger.fine(() -> "Structural analysis found " + errors.size() + " indentation errors");
        return errors;
    }

    /**
     * Required column of every leading key, item and value, in document order.
     */
    public List<Placement> place(TokenStream stream) {
        Walk walk = new Walk();
        for (StructureEvent event : stream.getEvents()) {
            walk.accept(event);
        }
        return walk.placements;
    }

    private IndentationError toError(Placement placement) {
        StructureEvent event = placement.getEvent();
        int actual = placement.getActualColumn();
        String message = event.getKind().label() + " indentation mismatch: expected column "
                + placement.getExpectedColumn() + ", found " + actual;
        return new IndentationError(event.getLine() + 1, actual, placement.getExpectedColumn(), actual,
                placement.getPath(), message, Severity.ERROR);
    }

    static int validateStep(int indentStep) {
        if (indentStep < 1 || indentStep > 8) {
            throw new IllegalArgumentException("Indent step must be between 1 and 8, got " + indentStep);
        }
        return indentStep;
    }

    /**
     * Per-call stacks. {@code path} always holds one entry less than {@code indents}.
     */
    private final class Walk {
        private final List<Integer> indents = new ArrayList<>(List.of(0));
        private final List<String> path = new ArrayList<>();
        private final List<Placement> placements = new ArrayList<>();

        private void accept(StructureEvent event) {
            Placement placement = switch (event.getKind()) {
                case SEQUENCE_ITEM_START -> open(event, YamlPath.indexSegment(event.getIndex()));
                case MAPPING_KEY_START -> open(event, event.getKey());
                case MAPPING_VALUE_START -> place(event);
                case LEVEL_END -> close();
            };
            if (placement != null) {
                placements.add(placement);
            }
        }

        private Placement open(StructureEvent event, String segment) {
            Placement placement = place(event);
            indents.add(top() + indentStep);
            path.add(segment);
            return placement;
        }

        private Placement place(StructureEvent event) {
            if (!event.isLeading()) {
                return null;
            }
            return new Placement(event, top() + 1, YamlPath.render(path));
        }

        private Placement close() {
            if (indents.size() > 1) {
                indents.remove(indents.size() - 1);
                path.remove(path.size() - 1);
            }
            return null;
        }

        private int top() {
            return indents.get(indents.size() - 1);
        }
    }
}
