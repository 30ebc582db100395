package com.yamlguard.plugins.yaml.analyzers;

import java.io.StringReader;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

import com.yamlguard.util.LoggerUtil;

/**
 * Checks that two texts describe the same YAML documents: same node kinds, tags,
 * scalar values and entry order. Formatting and comments are ignored.
 */
public class DocumentComparator {
    private static final Logger logger = LoggerUtil.getLogger(DocumentComparator.class);

    public boolean sameDocuments(String left, String right) {
        try {
            Iterator<Node> leftDocs = compose(left).iterator();
            Iterator<Node> rightDocs = compose(right).iterator();
            Map<Node, Set<Node>> visited = new IdentityHashMap<>();
            while (leftDocs.hasNext() && rightDocs.hasNext()) {
                if (!sameNode(leftDocs.next(), rightDocs.next(), visited)) {
                    return false;
                }
            }
            return !leftDocs.hasNext() && !rightDocs.hasNext();
        } catch (YAMLException e) {
            logger.fine("Documents could not be composed for comparison: " + e.getMessage());
            return false;
        }
    }

    private static Iterable<Node> compose(String text) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(true);
        // aliased nodes are compared once per pair, see sameNode
        options.setMaxAliasesForCollections(Integer.MAX_VALUE);
        return new Yaml(options).composeAll(new StringReader(text));
    }

    private static boolean sameNode(Node left, Node right, Map<Node, Set<Node>> visited) {
        if (left == null || right == null) {
            return left == right;
        }
        if (!visited.computeIfAbsent(left, k -> Collections.newSetFromMap(new IdentityHashMap<>()))
                .add(right)) {
            return true;
        }
        if (left.getNodeId() != right.getNodeId() || !Objects.equals(left.getTag(), right.getTag())) {
            return false;
        }
        if (left instanceof ScalarNode) {
            ScalarNode l = (ScalarNode) left;
            ScalarNode r = (ScalarNode) right;
            return Objects.equals(l.getValue(), r.getValue());
        }
        if (left instanceof SequenceNode) {
            List<Node> l = ((SequenceNode) left).getValue();
            List<Node> r = ((SequenceNode) right).getValue();
            if (l.size() != r.size()) {
                return false;
            }
            for (int i = 0; i < l.size(); i++) {
                if (!sameNode(l.get(i), r.get(i), visited)) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof MappingNode) {
            List<NodeTuple> l = ((MappingNode) left).getValue();
            List<NodeTuple> r = ((MappingNode) right).getValue();
            if (l.size() != r.size()) {
                return false;
            }
            for (int i = 0; i < l.size(); i++) {
                if (!sameNode(l.get(i).getKeyNode(), r.get(i).getKeyNode(), visited)
                        || !sameNode(l.get(i).getValueNode(), r.get(i).getValueNode(), visited)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }
}
