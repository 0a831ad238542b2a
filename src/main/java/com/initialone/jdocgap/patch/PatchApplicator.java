package com.initialone.jdocgap.patch;

import com.initialone.jdocgap.lang.Language;
import com.initialone.jdocgap.model.SymbolKind;
import com.initialone.jdocgap.model.SymbolRecord;
import com.initialone.jdocgap.scan.DefinitionHeader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Writes generated comments into source files.
 *
 * <p>Python comments go after the definition header, indented one level deeper than the
 * definition. Everything else goes on the lines right above the definition at its indentation.
 * Classes in Python keep the comment's own indentation unless {@code pythonClassReindent} is set.
 *
 * <p>All positions come from the content the symbols were found in. Insertions are applied
 * bottom-up so earlier positions stay valid.
 */
public class PatchApplicator {

    private final boolean pythonClassReindent;
    private final String indentUnit;

    public PatchApplicator() {
        this(false);
    }

    public PatchApplicator(boolean pythonClassReindent) {
        this.pythonClassReindent = pythonClassReindent;
        this.indentUnit = " ".repeat(Math.max(0, parseIntProp("jdocgap.python.indent", 4)));
    }

    /** Single insertion; empty when the symbol's line is not in the content. */
    public Optional<String> insert(String content, SymbolRecord symbol, String comment) {
        Applied applied = apply(content, List.of(new Insertion(symbol, comment)));
        return applied.patched.isEmpty() ? Optional.empty() : Optional.of(applied.content);
    }

    /** Applies every insertion to the content; duplicates by (line, name) are applied once. */
    public Applied apply(String content, List<Insertion> insertions) {
        SourceLines src = SourceLines.of(content);
        Applied out = new Applied();

        List<Planned> plan = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Insertion ins : insertions) {
            SymbolRecord s = ins.symbol();
            if (!seen.add(s.line() + "\u0000" + s.name())) {
                continue;
            }
            if (s.line() > src.size() || ins.comment().isBlank()) {
                out.failed.add(s);
                continue;
            }
            Planned p = plan(content, src, ins);
            if (p == null) {
                out.failed.add(s);
                continue;
            }
            plan.add(p);
        }

        // bottom-up, stable for equal positions
        plan.sort(Comparator.comparingInt((Planned p) -> p.index).reversed());
        for (Planned p : plan) {
            src.insertAt(p.index, p.lines);
            out.patched.add(p.symbol);
        }
        out.content = src.join();
        return out;
    }

    /** Reads, patches and rewrites one file. Failures are reported, never thrown. */
    public PatchReport patchFile(Path file, List<Insertion> insertions) {
        PatchReport report = new PatchReport();
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("[patch] cannot read " + file + ": " + e.getMessage());
            insertions.forEach(i -> report.failed(i.symbol()));
            return report;
        }

        Applied applied = apply(content, insertions);
        applied.failed.forEach(s -> {
            System.err.println("[patch] skipped " + s);
            report.failed(s);
        });
        if (applied.patched.isEmpty()) {
            return report;
        }

        try {
            writeReplacing(file, applied.content);
        } catch (IOException e) {
            System.err.println("[patch] cannot write " + file + ": " + e.getMessage());
            applied.patched.forEach(report::failed);
            return report;
        }
        applied.patched.forEach(report::patched);
        report.modified(file);
        return report;
    }

    /** Groups the insertions by file and patches each file; one failing file does not stop the rest. */
    public PatchReport patchAll(List<Insertion> insertions) {
        Map<Path, List<Insertion>> byFile = new LinkedHashMap<>();
        for (Insertion ins : insertions) {
            byFile.computeIfAbsent(ins.symbol().sourceFile(), k -> new ArrayList<>()).add(ins);
        }
        PatchReport total = new PatchReport();
        for (Map.Entry<Path, List<Insertion>> e : byFile.entrySet()) {
            PatchReport r = patchFile(e.getKey(), e.getValue());
            System.out.println("[patch] " + e.getKey() + " -> " + r);
            total.merge(r);
        }
        return total;
    }

    private Planned plan(String content, SourceLines src, Insertion ins) {
        SymbolRecord s = ins.symbol();
        int defIdx = s.line() - 1;
        String defIndent = leadingWhitespace(src.line(defIdx));

        if (s.language() != Language.PYTHON) {
            return new Planned(s, defIdx, indent(ins.comment(), defIndent));
        }

        int offset = s.offset();
        if (offset < src.startOf(defIdx) || offset > src.startOf(defIdx) + src.line(defIdx).length()) {
            offset = src.startOf(defIdx) + defIndent.length();
        }
        int colon = DefinitionHeader.colonOffset(content, offset);
        if (colon < 0) {
            return null;
        }
        int headerIdx = src.indexOf(colon);
        String rest = src.line(headerIdx).substring(colon - src.startOf(headerIdx) + 1).strip();
        if (!rest.isEmpty() && !rest.startsWith("#")) {
            // body on the header line; a docstring below it would not parse
            return null;
        }

        boolean reindent = s.kind() == SymbolKind.FUNCTION || pythonClassReindent;
        String prefix = reindent ? defIndent + indentUnit : "";
        return new Planned(s, headerIdx + 1, indent(ins.comment(), prefix));
    }

    private static List<String> indent(String comment, String prefix) {
        List<String> out = new ArrayList<>();
        for (String l : comment.split("\\r?\\n", -1)) {
            out.add(l.isBlank() ? "" : prefix + l);
        }
        return out;
    }

    private static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) i++;
        return line.substring(0, i);
    }

    private static void writeReplacing(Path file, String content) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(dir, "." + file.getFileName(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            if (Files.getFileAttributeView(file, PosixFileAttributeView.class) != null) {
                Files.setPosixFilePermissions(tmp, Files.getPosixFilePermissions(file));
            }
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException amnse) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static int parseIntProp(String key, int def) {
        try {
            String v = System.getProperty(key);
            return (v == null || v.isBlank()) ? def : Integer.parseInt(v.trim());
        } catch (Exception e) {
            return def;
        }
    }

    /** Result of {@link #apply}: the new content plus which symbols made it in. */
    public static final class Applied {
        private String content;
        private final List<SymbolRecord> patched = new ArrayList<>();
        private final List<SymbolRecord> failed = new ArrayList<>();

        public String content()              { return content; }
        public List<SymbolRecord> patched()  { return patched; }
        public List<SymbolRecord> failed()   { return failed; }
    }

    private static final class Planned {
        final SymbolRecord symbol;
        final int index;
        final List<String> lines;

        Planned(SymbolRecord symbol, int index, List<String> lines) {
            this.symbol = symbol;
            this.index = index;
            this.lines = lines;
        }
    }
}
