package com.initialone.jdocgap.scan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ordered glob patterns that exclude files and prune directories.
 *
 * <ul>
 *   <li>{@code *} any run of characters except {@code /}</li>
 *   <li>{@code **} any run of characters including {@code /}; {@code **}{@code /} may match no directory at all</li>
 *   <li>{@code ?} exactly one character except {@code /}</li>
 * </ul>
 *
 * Paths are matched relative to the analysis root using {@code /} separators, and once more
 * with the root's own directory name in front, so that analyzing {@code build/} itself still
 * excludes {@code build/output.py} under {@code **}{@code /build/**}.
 */
public class IgnoreRules {

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "**/node_modules/**",
            "**/venv/**",
            "**/env/**",
            "**/.git/**",
            "**/__pycache__/**",
            "**/target/**",
            "**/build/**",
            "**/dist/**"
    );

    private final List<String> globs;
    private final List<Pattern> compiled;

    public IgnoreRules(List<String> globs) {
        this.globs = globs == null ? List.of() : List.copyOf(globs);
        List<Pattern> ps = new ArrayList<>(this.globs.size());
        for (String g : this.globs) {
            ps.add(Pattern.compile(toRegex(g)));
        }
        this.compiled = ps;
    }

    public static IgnoreRules defaults() {
        return new IgnoreRules(DEFAULT_PATTERNS);
    }

    public static IgnoreRules none() {
        return new IgnoreRules(List.of());
    }

    public List<String> patterns() {
        return Collections.unmodifiableList(globs);
    }

    /** Whether a file under {@code root} is excluded. */
    public boolean isIgnoredFile(Path root, Path file) {
        String rel = relative(root, file);
        return matches(rel) || matchesUnderRootName(root, rel, false);
    }

    /** Whether a directory under {@code root} (and so its whole subtree) is pruned. */
    public boolean isIgnoredDirectory(Path root, Path dir) {
        String rel = relative(root, dir);
        if (rel.isEmpty()) return false;
        return matches(rel) || matches(rel + "/") || matchesUnderRootName(root, rel, true);
    }

    /** Matches an already-relativized, {@code /}-separated path. */
    public boolean matches(String relPath) {
        for (Pattern p : compiled) {
            if (p.matcher(relPath).matches()) return true;
        }
        return false;
    }

    private boolean matchesUnderRootName(Path root, String rel, boolean directory) {
        if (root == null) return false;
        Path name = root.toAbsolutePath().normalize().getFileName();
        if (name == null) return false;
        String prefixed = name.toString() + "/" + rel;
        return matches(prefixed) || (directory && matches(prefixed + "/"));
    }

    private static String relative(Path root, Path p) {
        Path rel;
        try {
            rel = root == null ? p : root.toAbsolutePath().normalize().relativize(p.toAbsolutePath().normalize());
        } catch (IllegalArgumentException e) {
            rel = p;
        }
        return rel.toString().replace('\\', '/');
    }

    static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i);
            if (c == '*') {
                boolean dbl = i + 1 < n && glob.charAt(i + 1) == '*';
                if (dbl) {
                    boolean slash = i + 2 < n && glob.charAt(i + 2) == '/';
                    if (slash) {
                        sb.append("(?:.*/)?");
                        i += 3;
                    } else {
                        sb.append(".*");
                        i += 2;
                    }
                } else {
                    sb.append("[^/]*");
                    i++;
                }
            } else if (c == '?') {
                sb.append("[^/]");
                i++;
            } else {
                if ("\\.[]{}()+-^$|".indexOf(c) >= 0) sb.append('\\');
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }
}
