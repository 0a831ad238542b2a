package com.initialone.jdocgap.scan;

import com.initialone.jdocgap.lang.LanguageProfile;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a definition at a given offset already carries documentation.
 *
 * <p>Looks at up to {@code window} physical lines directly above the definition's line,
 * nearest first. Blank lines are skipped but use up the window. A line that opens a comment of
 * the language means documented. Any other line that does not start with a comment
 * continuation token ends the scan.
 *
 * <p>This is adjacency only: a comment that belongs to an earlier symbol and is separated from
 * the definition by blank lines alone is still taken as documentation.
 *
 * <p>For languages that keep documentation in the body (Python docstrings) the first
 * non-blank line after the header is checked as well.
 */
public final class DocPresence {

    public static final int DEFAULT_WINDOW = 5;

    private static final int WINDOW = Math.max(1, parseIntProp("jdocgap.presence.window", DEFAULT_WINDOW));

    private DocPresence() {}

    public static boolean isDocumented(String content, int offset, LanguageProfile profile) {
        return isDocumented(content, offset, profile, WINDOW);
    }

    public static boolean isDocumented(String content, int offset, LanguageProfile profile, int window) {
        if (content == null || content.isEmpty()) return false;
        int at = Math.max(0, Math.min(offset, content.length()));

        for (String line : linesAbove(content, at, window)) {
            String t = line.strip();
            if (t.isEmpty()) continue;
            if (profile.opensComment(t)) return true;
            if (!LanguageProfile.isContinuation(t)) break;
        }

        return profile.docInsideBody() && hasBodyDocstring(content, at, profile);
    }

    /** Up to {@code window} full lines above the line containing {@code at}, nearest first. */
    static List<String> linesAbove(String content, int at, int window) {
        List<String> out = new ArrayList<>(window);
        int lineStart = content.lastIndexOf('\n', at - 1) + 1;
        int end = lineStart - 1; // index of the '\n' that closes the previous line
        while (end >= 0 && out.size() < window) {
            int start = content.lastIndexOf('\n', end - 1) + 1;
            out.add(content.substring(start, end));
            end = start - 1;
        }
        return out;
    }

    static boolean hasBodyDocstring(String content, int offset, LanguageProfile profile) {
        int colon = DefinitionHeader.colonOffset(content, offset);
        if (colon < 0) return false;

        int eol = content.indexOf('\n', colon);
        String rest = content.substring(colon + 1, eol < 0 ? content.length() : eol).strip();
        if (!rest.isEmpty() && !rest.startsWith("#")) {
            // one-line body: def f(): """doc"""
            return startsWithDocstring(rest, profile);
        }

        int i = eol;
        while (i >= 0 && i < content.length()) {
            int next = content.indexOf('\n', i + 1);
            String line = content.substring(i + 1, next < 0 ? content.length() : next).strip();
            if (!line.isEmpty()) {
                return startsWithDocstring(line, profile);
            }
            i = next;
        }
        return false;
    }

    private static boolean startsWithDocstring(String trimmed, LanguageProfile profile) {
        String t = trimmed;
        int k = 0;
        while (k < t.length() && k < 2 && "rRuUbBfF".indexOf(t.charAt(k)) >= 0) k++;
        t = t.substring(k);
        for (String m : profile.docstringMarkers()) {
            if (t.startsWith(m)) return true;
        }
        return false;
    }

    private static int parseIntProp(String key, int def) {
        try {
            String v = System.getProperty(key);
            return (v == null || v.isBlank()) ? def : Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }
}
