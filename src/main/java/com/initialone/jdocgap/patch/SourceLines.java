package com.initialone.jdocgap.patch;

import java.util.ArrayList;
import java.util.List;

/**
 * File content split into lines, each remembering its own terminator, so that a rewrite keeps
 * {@code \r\n} files as {@code \r\n} and a missing final newline stays missing.
 */
final class SourceLines {

    private final List<String> text = new ArrayList<>();
    private final List<String> ends = new ArrayList<>();
    private final List<Integer> starts = new ArrayList<>();
    private final String eol;

    private SourceLines(String eol) {
        this.eol = eol;
    }

    static SourceLines of(String content) {
        SourceLines s = new SourceLines(content.contains("\r\n") ? "\r\n" : "\n");
        int i = 0;
        int n = content.length();
        while (i < n) {
            int nl = content.indexOf('\n', i);
            s.starts.add(i);
            if (nl < 0) {
                s.text.add(content.substring(i));
                s.ends.add("");
                break;
            }
            int end = nl;
            String term = "\n";
            if (end > i && content.charAt(end - 1) == '\r') {
                end--;
                term = "\r\n";
            }
            s.text.add(content.substring(i, end));
            s.ends.add(term);
            i = nl + 1;
        }
        return s;
    }

    int size() {
        return text.size();
    }

    String eol() {
        return eol;
    }

    String line(int idx) {
        return text.get(idx);
    }

    /** Offset of the line's first char in the original content. Only valid before any insert. */
    int startOf(int idx) {
        return starts.get(idx);
    }

    /** Zero-based line holding the original offset. */
    int indexOf(int offset) {
        int lo = 0, hi = starts.size() - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (starts.get(mid) <= offset) lo = mid; else hi = mid - 1;
        }
        return lo;
    }

    /** Inserts lines before index {@code idx}; {@code idx == size()} appends. */
    void insertAt(int idx, List<String> lines) {
        if (lines.isEmpty()) return;
        if (idx == text.size() && idx > 0 && ends.get(idx - 1).isEmpty()) {
            // appending after an unterminated last line
            ends.set(idx - 1, eol);
            List<String> newEnds = new ArrayList<>();
            for (int i = 0; i < lines.size(); i++) newEnds.add(i == lines.size() - 1 ? "" : eol);
            text.addAll(idx, lines);
            ends.addAll(idx, newEnds);
            starts.clear();
            return;
        }
        List<String> newEnds = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) newEnds.add(eol);
        text.addAll(idx, lines);
        ends.addAll(idx, newEnds);
        starts.clear();
    }

    String join() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < text.size(); i++) {
            sb.append(text.get(i)).append(ends.get(i));
        }
        return sb.toString();
    }
}
