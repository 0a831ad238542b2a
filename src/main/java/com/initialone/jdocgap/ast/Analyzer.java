package com.initialone.jdocgap.ast;

import com.initialone.jdocgap.lang.Language;
import com.initialone.jdocgap.lang.LanguageClassifier;
import com.initialone.jdocgap.model.AnalysisResult;
import com.initialone.jdocgap.model.SymbolRecord;
import com.initialone.jdocgap.scan.IgnoreRules;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Entry point of the analysis side.
 *
 * <ul>
 *   <li>per file: the syntax-tree engine when the language has a loaded grammar, the regex
 *       engine otherwise (or when the grammar chokes on this file)</li>
 *   <li>ignored, unclassified or unsupported files give an empty list, never an error</li>
 *   <li>unreadable files give an empty list plus a diagnostic</li>
 *   <li>directory walks prune ignored directories and keep only files with findings</li>
 * </ul>
 */
public class Analyzer {

    private final LanguageRegistry registry;
    private final IgnoreRules ignore;
    private final Set<Language> supported;
    private final SyntaxTreeEngine treeEngine = new SyntaxTreeEngine();
    private final RegexEngine regexEngine = new RegexEngine();

    public Analyzer(LanguageRegistry registry, IgnoreRules ignore, Set<Language> supported) {
        this.registry = registry;
        this.ignore = ignore == null ? IgnoreRules.none() : ignore;
        this.supported = (supported == null || supported.isEmpty())
                ? EnumSet.allOf(Language.class)
                : EnumSet.copyOf(supported);
    }

    public Analyzer(LanguageRegistry registry, IgnoreRules ignore) {
        this(registry, ignore, null);
    }

    /** Analyzes one file; ignore patterns are matched against the path as given. */
    public List<SymbolRecord> analyzeFile(Path file) {
        AnalysisResult sink = new AnalysisResult();
        return analyzeFile(null, file, sink);
    }

    /**
     * Walks {@code dir}, pruning ignored directories. Files without findings are left out.
     */
    public AnalysisResult analyzeDirectory(Path dir) {
        return analyzeDirectory(dir, () -> false);
    }

    /**
     * Same as {@link #analyzeDirectory(Path)}; {@code cancelled} is polled between files and
     * stops the walk early, returning what was found so far.
     */
    public AnalysisResult analyzeDirectory(Path dir, BooleanSupplier cancelled) {
        AnalysisResult result = new AnalysisResult();
        List<Path> pruned = new ArrayList<>();
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                    if (ignore.isIgnoredDirectory(dir, d)) {
                        pruned.add(d);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (cancelled.getAsBoolean()) {
                        return FileVisitResult.TERMINATE;
                    }
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    result.put(file, analyzeFile(dir, file, result));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    diagnostic(result, "cannot visit " + file + " -> " + exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ioe) {
            diagnostic(result, "walk failed at " + dir + " -> " + ioe.getMessage());
        }
        if (!pruned.isEmpty()) {
            System.out.println("[analyze] pruned " + pruned.size() + " ignored director"
                    + (pruned.size() == 1 ? "y" : "ies"));
        }
        return result;
    }

    /**
     * Analyzes content that is already in memory. Used for re-checking a patched text; no
     * ignore or support filtering happens here.
     */
    public List<SymbolRecord> analyzeSource(Path file, String content, Language language) {
        AnalysisResult sink = new AnalysisResult();
        return analyzeContent(file, content, language, sink);
    }

    private List<SymbolRecord> analyzeFile(Path root, Path file, AnalysisResult sink) {
        if (ignore.isIgnoredFile(root, file)) return List.of();

        Optional<Language> lang = LanguageClassifier.classify(file);
        if (lang.isEmpty() || !supported.contains(lang.get())) return List.of();

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            diagnostic(sink, "read error at " + file + " -> " + e);
            return List.of();
        }
        return analyzeContent(file, content, lang.get(), sink);
    }

    private List<SymbolRecord> analyzeContent(Path file, String content, Language language, AnalysisResult sink) {
        LanguageRegistry.Entry entry = registry.entry(language);
        Optional<Grammar> grammar = entry.grammar().grammar();
        if (grammar.isPresent()) {
            try {
                return treeEngine.analyze(file, content, entry.profile(), grammar.get());
            } catch (SyntaxParseException | RuntimeException e) {
                diagnostic(sink, "parse error at " + file + ", using regex rules -> " + e.getMessage());
            }
        }
        return regexEngine.analyze(file, content, entry.profile(), entry.rules());
    }

    private static void diagnostic(AnalysisResult sink, String message) {
        System.err.println("[analyze] " + message);
        sink.addDiagnostic(message);
    }
}
