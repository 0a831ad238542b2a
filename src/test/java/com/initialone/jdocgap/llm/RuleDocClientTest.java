package com.initialone.jdocgap.llm;

import com.initialone.jdocgap.lang.Language;
import com.initialone.jdocgap.model.SymbolKind;
import com.initialone.jdocgap.model.SymbolRecord;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RuleDocClientTest {

    @Test
    void namesBecomeSentences() {
        assertEquals("Calculate sum", RuleDocClient.toSentence("calculate_sum"));
        assertEquals("Calculate sum", RuleDocClient.toSentence("calculateSum"));
        assertEquals("Init", RuleDocClient.toSentence("__init__"));
        assertEquals("Http server", RuleDocClient.toSentence("HttpServer"));
    }

    @Test
    void pythonFunctionDocstring() {
        String c = RuleDocClient.comment("calculate_sum", SymbolKind.FUNCTION, Language.PYTHON);
        assertTrue(c.startsWith("\"\"\"\nCalculate sum."), c);
        assertTrue(c.contains("Args:"), c);
        assertTrue(c.contains("Returns:"), c);
        assertTrue(c.endsWith("\"\"\""), c);
    }

    @Test
    void languageSpecificShells() {
        assertTrue(RuleDocClient.comment("load", SymbolKind.FUNCTION, Language.TYPESCRIPT).startsWith("/**\n * Load"));
        assertTrue(RuleDocClient.comment("Store", SymbolKind.CLASS, Language.JAVA).contains("Store class"));
        assertTrue(RuleDocClient.comment("Add", SymbolKind.FUNCTION, Language.GO).startsWith("// Add "));
        assertTrue(RuleDocClient.comment("build", SymbolKind.FUNCTION, Language.RUST).startsWith("/// Build"));
    }

    @Test
    void synthesizeNeverReturnsBlank() {
        RuleDocClient client = new RuleDocClient();
        for (Language l : Language.values()) {
            SymbolRecord s = new SymbolRecord("run", SymbolKind.FUNCTION, Path.of("x"), 1, 0, l);
            assertFalse(client.synthesize(s, l, "").isBlank(), "blank comment for " + l);
        }
    }
}
