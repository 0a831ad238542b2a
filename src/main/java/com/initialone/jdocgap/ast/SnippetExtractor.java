package com.initialone.jdocgap.ast;

import com.initialone.jdocgap.model.SymbolRecord;

/** Cuts the source around a definition so prompts stay small. */
public class SnippetExtractor {

    static final int MAX_LINES = 60;
    static final int HEAD_LINES = 24;
    static final int TAIL_LINES = 8;

    public static String snippetOf(String content, SymbolRecord symbol) {
        if (content == null || content.isEmpty()) return "";
        String[] lines = content.split("\\R", -1);
        int from = Math.min(symbol.line() - 1, lines.length);
        int to = Math.min(lines.length, from + MAX_LINES);
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            sb.append(lines[i]).append('\n');
        }
        return trimCode(sb.toString(), HEAD_LINES, TAIL_LINES);
    }

    /** Keeps the first head and last tail lines, folding the middle into one marker line. */
    static String trimCode(String code, int head, int tail) {
        if (code == null) return "";
        String[] lines = code.split("\\R", -1);
        if (lines.length <= head + tail + 5) return code; // short enough as is
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Math.min(head, lines.length); i++) {
            sb.append(lines[i]).append('\n');
        }
        sb.append("... (trimmed) ...\n");
        for (int i = Math.max(lines.length - tail, 0); i < lines.length; i++) {
            sb.append(lines[i]).append('\n');
        }
        return sb.toString();
    }
}
