package com.initialone.jdocgap.patch;

import com.initialone.jdocgap.lang.Language;
import com.initialone.jdocgap.model.SymbolKind;
import com.initialone.jdocgap.model.SymbolRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatchApplicatorTest {

    private final PatchApplicator patcher = new PatchApplicator();

    private static SymbolRecord fn(String name, String content, String definition, Language lang) {
        return at(name, SymbolKind.FUNCTION, content, definition, lang);
    }

    private static SymbolRecord at(String name, SymbolKind kind, String content, String definition, Language lang) {
        int offset = content.indexOf(definition);
        assertTrue(offset >= 0, "fixture must contain " + definition);
        int line = 1;
        for (int i = 0; i < offset; i++) if (content.charAt(i) == '\n') line++;
        return new SymbolRecord(name, kind, Path.of("mem"), line, offset, lang);
    }

    @Test
    void pythonDocstringGoesAfterTheHeaderOneLevelDeeper() {
        String src = "def f(a):\n    return a\n";
        String out = patcher.insert(src, fn("f", src, "def f", Language.PYTHON), "\"\"\"Do f.\"\"\"").orElseThrow();
        assertEquals("def f(a):\n    \"\"\"Do f.\"\"\"\n    return a\n", out);
    }

    @Test
    void nestedPythonMethodKeepsItsOwnIndentation() {
        String src = "class A:\n    def m(self):\n        pass\n";
        String out = patcher.insert(src, fn("m", src, "def m", Language.PYTHON), "\"\"\"M.\"\"\"").orElseThrow();
        assertEquals("class A:\n    def m(self):\n        \"\"\"M.\"\"\"\n        pass\n", out);
    }

    @Test
    void multiLineCommentIsIndentedLineByLine() {
        String src = "def f():\n    pass\n";
        String out = patcher.insert(src, fn("f", src, "def f", Language.PYTHON), "\"\"\"\nDo f.\n\nMore.\n\"\"\"").orElseThrow();
        assertEquals("def f():\n    \"\"\"\n    Do f.\n\n    More.\n    \"\"\"\n    pass\n", out);
    }

    @Test
    void pythonHeaderSpanningLines() {
        String src = "def f(a,\n      b):\n    return a\n";
        String out = patcher.insert(src, fn("f", src, "def f", Language.PYTHON), "\"\"\"Doc.\"\"\"").orElseThrow();
        assertEquals("def f(a,\n      b):\n    \"\"\"Doc.\"\"\"\n    return a\n", out);
    }

    @Test
    void pythonClassKeepsLegacyPlacementByDefault() {
        String src = "class A:\n    x = 1\n";
        SymbolRecord a = at("A", SymbolKind.CLASS, src, "class A", Language.PYTHON);

        assertEquals("class A:\n\"\"\"A class.\"\"\"\n    x = 1\n",
                new PatchApplicator(false).insert(src, a, "\"\"\"A class.\"\"\"").orElseThrow());
        assertEquals("class A:\n    \"\"\"A class.\"\"\"\n    x = 1\n",
                new PatchApplicator(true).insert(src, a, "\"\"\"A class.\"\"\"").orElseThrow());
    }

    @Test
    void inlinePythonBodyIsLeftAlone() {
        String src = "def f(): return 1\n";
        assertTrue(patcher.insert(src, fn("f", src, "def f", Language.PYTHON), "\"\"\"Doc.\"\"\"").isEmpty());
    }

    @Test
    void otherLanguagesGoAboveAtTheDefinitionIndentation() {
        String src = "class S {\n  load() {}\n}\n";
        String out = patcher.insert(src, fn("load", src, "load()", Language.JAVASCRIPT), "/**\n * Load.\n */").orElseThrow();
        assertEquals("class S {\n  /**\n   * Load.\n   */\n  load() {}\n}\n", out);
    }

    @Test
    void decoratedMethodCommentGoesAboveTheDecorators() {
        String src = "class C {\n  @Log()\n  @Dec()\n  run(): void {}\n}\n";
        SymbolRecord run = fn("run", src, "@Log()", Language.TYPESCRIPT);
        String out = patcher.insert(src, run, "/**\n * Run.\n */").orElseThrow();
        assertEquals("class C {\n  /**\n   * Run.\n   */\n  @Log()\n  @Dec()\n  run(): void {}\n}\n", out);
    }

    @Test
    void batchOrderDoesNotMatter() {
        String src = "def a():\n    return 1\n\ndef b():\n    return 2\n";
        Insertion ia = new Insertion(fn("a", src, "def a", Language.PYTHON), "\"\"\"A.\"\"\"");
        Insertion ib = new Insertion(fn("b", src, "def b", Language.PYTHON), "\"\"\"B.\"\"\"");
        String expected = "def a():\n    \"\"\"A.\"\"\"\n    return 1\n\ndef b():\n    \"\"\"B.\"\"\"\n    return 2\n";

        assertEquals(expected, patcher.apply(src, List.of(ia, ib)).content());
        assertEquals(expected, patcher.apply(src, List.of(ib, ia)).content());
    }

    @Test
    void crlfFilesStayCrlf() {
        String src = "function a() {}\r\nfunction b() {}\r\n";
        Insertion ia = new Insertion(fn("a", src, "function a", Language.JAVASCRIPT), "/**\n * A.\n */");
        Insertion ib = new Insertion(fn("b", src, "function b", Language.JAVASCRIPT), "// B.");
        String out = patcher.apply(src, List.of(ia, ib)).content();
        assertEquals("/**\r\n * A.\r\n */\r\nfunction a() {}\r\n// B.\r\nfunction b() {}\r\n", out);
    }

    @Test
    void missingFinalNewlineStaysMissing() {
        String src = "func F() {}";
        String out = patcher.insert(src, fn("F", src, "func F", Language.GO), "// F does things.").orElseThrow();
        assertEquals("// F does things.\nfunc F() {}", out);
    }

    @Test
    void lineOutsideTheFileIsReportedUnpatched() {
        String src = "def f():\n    pass\n";
        SymbolRecord stale = new SymbolRecord("g", SymbolKind.FUNCTION, Path.of("mem"), 40, 900, Language.PYTHON);
        PatchApplicator.Applied applied = patcher.apply(src, List.of(new Insertion(stale, "\"\"\"G.\"\"\"")));
        assertEquals(src, applied.content());
        assertEquals(List.of(stale), applied.failed());
        assertTrue(applied.patched().isEmpty());
    }

    @Test
    void duplicateLineAndNameIsAppliedOnce() {
        String src = "function a() {}\n";
        SymbolRecord s = fn("a", src, "function a", Language.JAVASCRIPT);
        PatchApplicator.Applied applied = patcher.apply(src,
                List.of(new Insertion(s, "// A."), new Insertion(s, "// A.")));
        assertEquals("// A.\nfunction a() {}\n", applied.content());
        assertEquals(1, applied.patched().size());
    }

    @Test
    void patchFileRewritesInPlace(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("m.py");
        String src = "def f(a):\n    return a\n";
        Files.writeString(file, src, StandardCharsets.UTF_8);
        SymbolRecord s = new SymbolRecord("f", SymbolKind.FUNCTION, file, 1, 0, Language.PYTHON);

        PatchReport report = patcher.patchFile(file, List.of(new Insertion(s, "\"\"\"Do f.\"\"\"")));

        assertEquals(List.of(file), report.modifiedFiles());
        assertEquals(List.of(s), report.patched());
        assertEquals("def f(a):\n    \"\"\"Do f.\"\"\"\n    return a\n", Files.readString(file));
        try (var files = Files.list(dir)) {
            assertEquals(1, files.count(), "no temp file left behind");
        }
    }

    @Test
    void unreadableFileIsReportedNotThrown(@TempDir Path dir) {
        Path missing = dir.resolve("gone.py");
        SymbolRecord s = new SymbolRecord("f", SymbolKind.FUNCTION, missing, 1, 0, Language.PYTHON);
        PatchReport report = patcher.patchAll(List.of(new Insertion(s, "\"\"\"Doc.\"\"\"")));
        assertEquals(List.of(s), report.failed());
        assertTrue(report.modifiedFiles().isEmpty());
    }

    @Test
    void oneBadFileDoesNotStopTheBatch(@TempDir Path dir) throws IOException {
        Path good = dir.resolve("ok.js");
        Files.writeString(good, "function ok() {}\n");
        SymbolRecord bad = new SymbolRecord("x", SymbolKind.FUNCTION, dir.resolve("gone.js"), 1, 0, Language.JAVASCRIPT);
        SymbolRecord ok = new SymbolRecord("ok", SymbolKind.FUNCTION, good, 1, 0, Language.JAVASCRIPT);

        PatchReport report = patcher.patchAll(List.of(new Insertion(bad, "// X."), new Insertion(ok, "// Ok.")));

        assertEquals(List.of(bad), report.failed());
        assertEquals(List.of(ok), report.patched());
        assertEquals("// Ok.\nfunction ok() {}\n", Files.readString(good));
    }
}
