package com.initialone.jdocgap.scan;

/**
 * Locates the end of a colon-terminated definition header ({@code def f(a,\n b):}).
 * Brackets and string literals are skipped so that colons inside them do not count.
 */
public final class DefinitionHeader {

    private DefinitionHeader() {}

    /** Index of the header's terminating ':' at bracket depth 0, or -1 if none is found. */
    public static int colonOffset(String content, int offset) {
        int depth = 0;
        int i = Math.max(0, offset);
        int n = content.length();
        while (i < n) {
            char c = content.charAt(i);
            switch (c) {
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth = Math.max(0, depth - 1);
                case '#' -> {
                    // comment to end of line
                    int eol = content.indexOf('\n', i);
                    if (eol < 0) return -1;
                    i = eol;
                    continue;
                }
                case '"', '\'' -> {
                    i = skipString(content, i);
                    continue;
                }
                case ':' -> {
                    if (depth == 0) return i;
                }
                default -> { }
            }
            i++;
        }
        return -1;
    }

    /** Zero-based index of the line holding the header's colon, or the offset's own line. */
    public static int headerLineIndex(String content, int offset) {
        int colon = colonOffset(content, offset);
        int at = colon >= 0 ? colon : Math.min(offset, content.length());
        int line = 0;
        for (int i = 0; i < at; i++) {
            if (content.charAt(i) == '\n') line++;
        }
        return line;
    }

    private static int skipString(String s, int start) {
        char q = s.charAt(start);
        boolean triple = start + 2 < s.length() && s.charAt(start + 1) == q && s.charAt(start + 2) == q;
        int i = start + (triple ? 3 : 1);
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (triple) {
                if (c == q && i + 2 < s.length() && s.charAt(i + 1) == q && s.charAt(i + 2) == q) {
                    return i + 3;
                }
            } else {
                if (c == q) return i + 1;
                if (c == '\n') return i;
            }
            i++;
        }
        return s.length();
    }
}
