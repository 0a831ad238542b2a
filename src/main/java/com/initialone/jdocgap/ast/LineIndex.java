package com.initialone.jdocgap.ast;

import java.util.Arrays;

/** Line start offsets of a text, for offset -> line and (line, column) -> offset lookups. */
final class LineIndex {

    private final int[] lineStarts;
    private final int length;

    LineIndex(String content) {
        int count = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') count++;
        }
        int[] starts = new int[count];
        int k = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') starts[k++] = i + 1;
        }
        this.lineStarts = starts;
        this.length = content.length();
    }

    /** 1-based line of a character offset: number of '\n' before it, plus one. */
    int lineOf(int offset) {
        int pos = Arrays.binarySearch(lineStarts, Math.max(0, offset));
        return pos >= 0 ? pos + 1 : -pos - 1;
    }

    /** Offset of a 1-based (line, column) position, clamped to the text. */
    int offsetOf(int line, int column) {
        int l = Math.max(1, Math.min(line, lineStarts.length));
        return Math.min(length, lineStarts[l - 1] + Math.max(0, column - 1));
    }

    /** Counts '\n' before {@code offset}, plus one; same rule as {@link #lineOf(int)}. */
    static int lineAt(String content, int offset) {
        int line = 1;
        int end = Math.min(offset, content.length());
        for (int i = 0; i < end; i++) {
            if (content.charAt(i) == '\n') line++;
        }
        return line;
    }
}
