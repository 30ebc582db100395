package com.yamlguard.plugins.yaml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A document split into lines, keeping each line's terminator so the text can be
 * reassembled byte for byte. Recognises the same line breaks as the YAML parser.
 */
public final class TextLines {
    private final List<String> contents;
    private final List<String> terminators;

    private TextLines(List<String> contents, List<String> terminators) {
        this.contents = contents;
        this.terminators = terminators;
    }

    public static TextLines of(String text) {
        List<String> contents = new ArrayList<>();
        List<String> terminators = new ArrayList<>();
        int start = 0;
        int i = 0;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                contents.add(text.substring(start, i));
                terminators.add("\r\n");
                i += 2;
                start = i;
            } else if (isBreak(c)) {
                contents.add(text.substring(start, i));
                terminators.add(String.valueOf(c));
                i++;
                start = i;
            } else {
                i++;
            }
        }
        if (start < length) {
            contents.add(text.substring(start));
            terminators.add("");
        }
        return new TextLines(Collections.unmodifiableList(contents), Collections.unmodifiableList(terminators));
    }

    private static boolean isBreak(char c) {
        return c == '\n' || c == '\r' || c == '\u0085' || c == '\u2028' || c == '\u2029';
    }

    public int size() {
        return contents.size();
    }

    public String content(int index) {
        return contents.get(index);
    }

    public String terminator(int index) {
        return terminators.get(index);
    }

    public List<String> contents() {
        return contents;
    }

    /**
     * Number of leading whitespace characters. Tabs count as one column.
     */
    public static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    public static boolean isBlank(String line) {
        return line.isBlank();
    }

    public static boolean isCommentOnly(String line) {
        return line.stripLeading().startsWith("#");
    }
}
