package com.initialone.jdocgap.llm;

import com.initialone.jdocgap.lang.Language;

import java.util.ArrayList;
import java.util.List;

/** Turns a model's free-text answer into a comment in the target language's syntax. */
public final class CommentFormatter {

    private CommentFormatter() {}

    public static String format(String raw, Language language) {
        List<String> body = bodyLines(raw);
        if (body.isEmpty()) return "";

        StringBuilder sb = new StringBuilder();
        switch (language) {
            case PYTHON:
                if (body.size() == 1) {
                    return "\"\"\"" + body.get(0) + "\"\"\"";
                }
                sb.append("\"\"\"\n");
                for (String l : body) sb.append(l).append('\n');
                sb.append("\"\"\"");
                return sb.toString();
            case GO:
                return prefixed(body, "//");
            case RUST:
                return prefixed(body, "///");
            case JAVASCRIPT:
            case TYPESCRIPT:
            case JAVA:
            case CPP:
            case C:
                sb.append("/**\n");
                for (String l : body) {
                    sb.append(l.isEmpty() ? " *" : " * " + l).append('\n');
                }
                sb.append(" */");
                return sb.toString();
            default:
                return prefixed(body, "//");
        }
    }

    /**
     * Strips code fences, comment shells and leading comment tokens, keeping the comment body.
     * Leading and trailing blank lines are dropped, inner blank lines kept.
     */
    static List<String> bodyLines(String raw) {
        if (raw == null) return List.of();
        String t = raw.strip();

        // ```lang ... ```
        if (t.startsWith("```")) {
            int first = t.indexOf('\n');
            t = first > 0 ? t.substring(first + 1) : "";
            int lastTicks = t.lastIndexOf("```");
            if (lastTicks >= 0) t = t.substring(0, lastTicks);
            t = t.strip();
        }
        if (t.startsWith("/**") || t.startsWith("/*")) {
            int from = t.startsWith("/**") && !t.startsWith("/**/") ? 3 : 2;
            int end = t.lastIndexOf("*/");
            t = t.substring(from, end >= from ? end : t.length()).strip();
        }
        for (String q : new String[]{"\"\"\"", "'''"}) {
            if (t.startsWith(q)) {
                t = t.substring(3);
                if (t.endsWith(q)) t = t.substring(0, t.length() - 3);
                t = t.strip();
            }
        }

        List<String> out = new ArrayList<>();
        for (String line : t.split("\\r?\\n", -1)) {
            String ln = line.strip();
            if (ln.startsWith("///")) ln = ln.substring(3).strip();
            else if (ln.startsWith("//")) ln = ln.substring(2).strip();
            else if (ln.startsWith("*") && !ln.startsWith("*/")) ln = ln.substring(1).strip();
            else if (ln.startsWith("#")) ln = ln.substring(1).strip();
            // keep the comment from terminating early
            ln = ln.replace("*/", "* /").replace("\"\"\"", "\"\" \"");
            out.add(ln);
        }
        while (!out.isEmpty() && out.get(0).isEmpty()) out.remove(0);
        while (!out.isEmpty() && out.get(out.size() - 1).isEmpty()) out.remove(out.size() - 1);
        return out;
    }

    private static String prefixed(List<String> body, String token) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < body.size(); i++) {
            if (i > 0) sb.append('\n');
            String l = body.get(i);
            sb.append(l.isEmpty() ? token : token + " " + l);
        }
        return sb.toString();
    }
}
