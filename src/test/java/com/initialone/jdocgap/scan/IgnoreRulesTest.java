package com.initialone.jdocgap.scan;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IgnoreRulesTest {

    @Test
    void defaultPatternsExcludeBuildOutput() {
        IgnoreRules rules = IgnoreRules.defaults();
        assertTrue(rules.matches("build/output.py"));
        assertTrue(rules.matches("web/node_modules/lib/index.js"));
        assertFalse(rules.matches("src/app.py"));
        assertFalse(rules.matches("builder/app.py"));
    }

    @Test
    void singleStarStopsAtSlash() {
        IgnoreRules rules = new IgnoreRules(List.of("*.py"));
        assertTrue(rules.matches("a.py"));
        assertFalse(rules.matches("dir/a.py"));
    }

    @Test
    void doubleStarCrossesDirectories() {
        IgnoreRules rules = new IgnoreRules(List.of("**/*.py"));
        assertTrue(rules.matches("a/b/c.py"));
        assertTrue(rules.matches("c.py"), "**/ may match no directory");
    }

    @Test
    void questionMarkIsExactlyOneChar() {
        IgnoreRules rules = new IgnoreRules(List.of("file?.py"));
        assertTrue(rules.matches("file1.py"));
        assertFalse(rules.matches("file10.py"));
        assertFalse(rules.matches("file/.py"));
    }

    @Test
    void dotsAreLiteral() {
        IgnoreRules rules = new IgnoreRules(List.of("setup.py"));
        assertTrue(rules.matches("setup.py"));
        assertFalse(rules.matches("setupxpy"));
    }

    @Test
    void directoriesArePrunedRelativeToRoot(@TempDir Path root) {
        IgnoreRules rules = IgnoreRules.defaults();
        assertTrue(rules.isIgnoredDirectory(root, root.resolve("node_modules")));
        assertTrue(rules.isIgnoredDirectory(root, root.resolve("pkg").resolve("__pycache__")));
        assertFalse(rules.isIgnoredDirectory(root, root.resolve("src")));
        assertFalse(rules.isIgnoredDirectory(root, root), "the root itself is never pruned");
        assertTrue(rules.isIgnoredFile(root, root.resolve("build").resolve("output.py")));
    }

    @Test
    void noneMatchesNothing() {
        assertFalse(IgnoreRules.none().matches("build/output.py"));
    }

    @Test
    void rootNameTakesPartInMatching(@TempDir Path tmp) {
        Path root = tmp.resolve("build");
        IgnoreRules rules = IgnoreRules.defaults();
        assertTrue(rules.isIgnoredFile(root, root.resolve("output.py")));
        assertTrue(rules.isIgnoredDirectory(root, root.resolve("gen")));
        assertFalse(rules.isIgnoredDirectory(root, root), "the root itself is never pruned");

        Path src = tmp.resolve("src");
        assertFalse(rules.isIgnoredFile(src, src.resolve("output.py")));
    }
}
