package com.yamlguard.plugins.yaml;

import java.util.Iterator;

/**
 * Renders path segments as {@code spec.containers[0].name}.
 */
public final class YamlPath {
    public static final String ROOT = "root";

    private YamlPath() {
    }

    public static String indexSegment(int index) {
        return "[" + index + "]";
    }

    /**
     * @param segments keys and {@code [i]} markers, outermost first
     */
    public static String render(Iterable<String> segments) {
        StringBuilder sb = new StringBuilder();
        Iterator<String> it = segments.iterator();
        while (it.hasNext()) {
            String segment = it.next();
            if (sb.length() > 0 && !segment.startsWith("[")) {
                sb.append('.');
            }
            sb.append(segment);
        }
        return sb.length() == 0 ? ROOT : sb.toString();
    }
}
