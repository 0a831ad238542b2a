package com.initialone.jdocgap.core;

import com.initialone.jdocgap.ast.Analyzer;
import com.initialone.jdocgap.ast.GrammarSlot;
import com.initialone.jdocgap.ast.JavaParserGrammar;
import com.initialone.jdocgap.ast.LanguageRegistry;
import com.initialone.jdocgap.llm.DocClient;
import com.initialone.jdocgap.llm.RuleDocClient;
import com.initialone.jdocgap.llm.SynthesisException;
import com.initialone.jdocgap.model.AnalysisResult;
import com.initialone.jdocgap.model.CommentMap;
import com.initialone.jdocgap.model.SymbolKind;
import com.initialone.jdocgap.lang.Language;
import com.initialone.jdocgap.patch.PatchApplicator;
import com.initialone.jdocgap.scan.IgnoreRules;
import com.initialone.jdocgap.vcs.ChangePublisher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DocOrchestratorTest {

    private static final String PY = "def calculate_sum(a, b):\n    return a + b\n\n"
            + "class DataProcessor:\n    def __init__(self, config):\n        self.config = config\n";
    private static final String JS = "function load(url) {\n  return url;\n}\n\nclass Store {\n  save() {}\n}\n";
    private static final String GO = "package geo\n\nfunc Area(w, h int) int {\n\treturn w * h\n}\n";

    /** Remembers what it was asked to publish. */
    static class RecordingPublisher implements ChangePublisher {
        final List<List<Path>> calls = new ArrayList<>();
        int symbols;

        @Override
        public Optional<String> createDocumentationChange(List<Path> filesModified, int symbolCount) {
            calls.add(filesModified);
            symbols = symbolCount;
            return Optional.of("https://github.com/acme/widgets/pull/1");
        }
    }

    private static Path write(Path root, String rel, String content) throws IOException {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    private static Analyzer analyzer() {
        return new Analyzer(LanguageRegistry.regexOnly(), IgnoreRules.defaults());
    }

    private static DocOrchestrator orchestrator(DocClient client, ChangePublisher publisher) {
        return new DocOrchestrator(analyzer(), client, new PatchApplicator(), publisher);
    }

    @Test
    void dryRunLeavesFilesUntouched(@TempDir Path root) throws IOException {
        Path py = write(root, "calc.py", PY);
        Path js = write(root, "web/store.js", JS);
        byte[] pyBefore = Files.readAllBytes(py);
        byte[] jsBefore = Files.readAllBytes(js);

        String summary = orchestrator(new RuleDocClient(), null).dryRun(root);

        assertArrayEquals(pyBefore, Files.readAllBytes(py));
        assertArrayEquals(jsBefore, Files.readAllBytes(js));
        assertTrue(summary.contains("File: " + py), summary);
        assertTrue(summary.contains("  - function: calculate_sum"), summary);
        assertTrue(summary.contains("  - class: DataProcessor"), summary);
        assertTrue(summary.contains("Total files to modify: 2"), summary);
        assertTrue(summary.contains("Total functions/classes to document: 5"), summary);
        assertTrue(summary.contains("Generated comments preview:"), summary);
    }

    @Test
    void runPatchesAndReanalysisFindsNothing(@TempDir Path root) throws IOException {
        write(root, "calc.py", PY);
        write(root, "web/store.js", JS);
        write(root, "geo/area.go", GO);

        WorkflowReport report = orchestrator(new RuleDocClient(), null).run(root, false);

        assertTrue(report.patch().failed().isEmpty(), report.patch().failed().toString());
        assertEquals(3, report.patch().modifiedFiles().size());
        assertTrue(report.changeUrl().isEmpty());

        AnalysisResult again = analyzer().analyzeDirectory(root);
        assertTrue(again.isEmpty(), "still undocumented: " + again.files());
    }

    @Test
    void publisherGetsModifiedFilesWhenRequested(@TempDir Path root) throws IOException {
        Path py = write(root, "calc.py", "def f():\n    pass\n");
        RecordingPublisher publisher = new RecordingPublisher();

        WorkflowReport report = orchestrator(new RuleDocClient(), publisher).run(root, true);

        assertEquals(List.of(List.of(py)), publisher.calls);
        assertEquals(1, publisher.symbols);
        assertEquals(Optional.of("https://github.com/acme/widgets/pull/1"), report.changeUrl());
    }

    @Test
    void publisherIsNotCalledWithoutChanges(@TempDir Path root) throws IOException {
        write(root, "calc.py", "# Documented.\ndef f():\n    pass\n");
        RecordingPublisher publisher = new RecordingPublisher();

        WorkflowReport report = orchestrator(new RuleDocClient(), publisher).run(root, true);

        assertTrue(publisher.calls.isEmpty());
        assertTrue(report.changeUrl().isEmpty());
    }

    @Test
    void publisherIsNotCalledWhenNotRequested(@TempDir Path root) throws IOException {
        write(root, "calc.py", "def f():\n    pass\n");
        RecordingPublisher publisher = new RecordingPublisher();

        orchestrator(new RuleDocClient(), publisher).run(root, false);

        assertTrue(publisher.calls.isEmpty());
    }

    @Test
    void failingProviderFallsBackToRuleComments(@TempDir Path root) throws IOException {
        Path py = write(root, "calc.py", "def calculate_sum(a, b):\n    return a + b\n");
        DocClient failing = (s, lang, ctx) -> {
            throw new SynthesisException("provider down");
        };

        CommentMap comments = orchestrator(failing, null).synthesize(analyzer().analyzeDirectory(root));

        assertEquals(Optional.of(RuleDocClient.comment("calculate_sum", SymbolKind.FUNCTION, Language.PYTHON)),
                comments.get(py, "calculate_sum"));
    }

    @Test
    void blankProviderAnswerFallsBackToRuleComments(@TempDir Path root) throws IOException {
        Path js = write(root, "a.js", "function load() {}\n");
        DocClient blank = (s, lang, ctx) -> "  ";

        CommentMap comments = orchestrator(blank, null).synthesize(analyzer().analyzeDirectory(root));

        assertEquals(Optional.of(RuleDocClient.comment("load", SymbolKind.FUNCTION, Language.JAVASCRIPT)),
                comments.get(js, "load"));
    }

    @Test
    void providerSeesTheDefinitionAsContext(@TempDir Path root) throws IOException {
        write(root, "a.py", "x = 1\n\ndef area(w, h):\n    return w * h\n");
        List<String> contexts = new ArrayList<>();
        DocClient capturing = (s, lang, ctx) -> {
            contexts.add(ctx);
            return "\"\"\"Area.\"\"\"";
        };

        orchestrator(capturing, null).synthesize(analyzer().analyzeDirectory(root));

        assertEquals(1, contexts.size());
        assertTrue(contexts.get(0).startsWith("def area(w, h):"), contexts.get(0));
    }

    @Test
    void constructorSharingTheClassNameGetsAFunctionComment(@TempDir Path root) throws IOException {
        Path java = write(root, "A.java", "public class A {\n    public A() {}\n}\n");
        LanguageRegistry registry = new LanguageRegistry(
                Map.of(Language.JAVA, GrammarSlot.parsed(new JavaParserGrammar())));
        DocOrchestrator o = new DocOrchestrator(new Analyzer(registry, IgnoreRules.none()),
                new RuleDocClient(), new PatchApplicator(), null);

        WorkflowReport report = o.run(root, false);

        assertEquals(2, report.patch().patched().size());
        String out = Files.readString(java, StandardCharsets.UTF_8);
        assertEquals("/**\n * A class\n *\n * TODO: Add class description\n */\n"
                + "public class A {\n"
                + "    /**\n     * A\n     *\n     * @param TODO: Add parameter descriptions\n"
                + "     * @return TODO: Add return description\n     */\n"
                + "    public A() {}\n}\n", out);
        assertEquals(1, report.comments().commentsOf(java).size());
    }
}
