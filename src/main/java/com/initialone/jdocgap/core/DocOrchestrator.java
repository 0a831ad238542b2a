package com.initialone.jdocgap.core;

import com.initialone.jdocgap.ast.Analyzer;
import com.initialone.jdocgap.ast.SnippetExtractor;
import com.initialone.jdocgap.llm.DocClient;
import com.initialone.jdocgap.llm.RuleDocClient;
import com.initialone.jdocgap.llm.SynthesisException;
import com.initialone.jdocgap.model.AnalysisResult;
import com.initialone.jdocgap.model.CommentMap;
import com.initialone.jdocgap.model.SymbolKind;
import com.initialone.jdocgap.model.SymbolRecord;
import com.initialone.jdocgap.patch.Insertion;
import com.initialone.jdocgap.patch.PatchApplicator;
import com.initialone.jdocgap.patch.PatchReport;
import com.initialone.jdocgap.vcs.ChangePublisher;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * analyze -> synthesize -> patch -> publish, strictly one step after the other.
 * The dry run stops after synthesis and never touches the files.
 */
public class DocOrchestrator {

    private final Analyzer analyzer;
    private final DocClient client;
    private final PatchApplicator patcher;
    private final ChangePublisher publisher;

    /** {@code publisher} may be null when changes are never published. */
    public DocOrchestrator(Analyzer analyzer, DocClient client, PatchApplicator patcher, ChangePublisher publisher) {
        this.analyzer = analyzer;
        this.client = client == null ? new RuleDocClient() : client;
        this.patcher = patcher;
        this.publisher = publisher;
    }

    public AnalysisResult analyze(Path dir) {
        System.out.println("[analyze] scanning " + dir.toAbsolutePath());
        AnalysisResult result = analyzer.analyzeDirectory(dir);
        System.out.println("[analyze] undocumented symbols=" + result.symbolCount() + " in files=" + result.fileCount());
        return result;
    }

    /** One comment per (file, symbol name). Provider failures fall back to the rule-based comment. */
    public CommentMap synthesize(AnalysisResult result) {
        CommentMap comments = new CommentMap();
        for (Map.Entry<Path, List<SymbolRecord>> e : result.files().entrySet()) {
            Path file = e.getKey();
            String content = readOrEmpty(file);
            for (SymbolRecord s : e.getValue()) {
                if (comments.contains(file, s.name())) continue;
                comments.put(file, s.name(), commentFor(s, content));
            }
        }
        return comments;
    }

    public String dryRun(Path dir) {
        AnalysisResult result = analyze(dir);
        return DryRunSummary.render(result, synthesize(result));
    }

    public WorkflowReport run(Path dir, boolean createChange) {
        AnalysisResult result = analyze(dir);
        CommentMap comments = synthesize(result);

        List<Insertion> insertions = new ArrayList<>();
        for (Map.Entry<Path, List<SymbolRecord>> e : result.files().entrySet()) {
            Path file = e.getKey();
            // the map holds the comment written for the first record of each name
            Map<String, SymbolKind> keyKind = new HashMap<>();
            Map<String, String> otherKind = new HashMap<>();
            String content = null;
            for (SymbolRecord s : e.getValue()) {
                Optional<String> c = comments.get(file, s.name());
                if (c.isEmpty()) continue;
                SymbolKind first = keyKind.computeIfAbsent(s.name(), k -> s.kind());
                if (first == s.kind()) {
                    insertions.add(new Insertion(s, c.get()));
                    continue;
                }
                // a constructor sharing its class's name gets a function comment, not the class one
                if (content == null) content = readOrEmpty(file);
                String text = content;
                insertions.add(new Insertion(s,
                        otherKind.computeIfAbsent(s.name(), k -> commentFor(s, text))));
            }
        }
        PatchReport patch = patcher.patchAll(insertions);
        System.out.println("[patch] done. " + patch);

        String url = null;
        if (createChange && publisher != null && !patch.modifiedFiles().isEmpty()) {
            Optional<String> change = publisher.createDocumentationChange(patch.modifiedFiles(), patch.patched().size());
            url = change.orElse(null);
        }
        return new WorkflowReport(result, comments, patch, url);
    }

    private String commentFor(SymbolRecord s, String content) {
        String context = SnippetExtractor.snippetOf(content, s);
        try {
            String c = client.synthesize(s, s.language(), context);
            if (c != null && !c.isBlank()) return c;
            System.err.println("[synth] empty comment for " + s + ", using rule-based text");
        } catch (SynthesisException | RuntimeException ex) {
            System.err.println("[synth] " + s + " failed: " + ex.getMessage() + ", using rule-based text");
        }
        return RuleDocClient.comment(s.name(), s.kind(), s.language());
    }

    private static String readOrEmpty(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("[synth] cannot read " + file + " for context: " + e.getMessage());
            return "";
        }
    }
}
