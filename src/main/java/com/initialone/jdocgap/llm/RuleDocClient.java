package com.initialone.jdocgap.llm;

import com.initialone.jdocgap.lang.Language;
import com.initialone.jdocgap.model.SymbolKind;
import com.initialone.jdocgap.model.SymbolRecord;

import java.util.Locale;

/**
 * Offline, deterministic comments built from the symbol name. Also the fallback whenever a
 * real provider fails.
 *
 * <p>Python docstrings are returned without body indentation; the patcher indents them.
 */
public class RuleDocClient implements DocClient {

    @Override
    public String synthesize(SymbolRecord symbol, Language language, String context) {
        return comment(symbol.name(), symbol.kind(), language);
    }

    public static String comment(String name, SymbolKind kind, Language language) {
        String s = toSentence(name);
        boolean fn = kind == SymbolKind.FUNCTION;
        switch (language) {
            case PYTHON:
                return fn
                        ? "\"\"\"\n" + s + ".\n\nArgs:\n    TODO: Add parameter descriptions\n\nReturns:\n    TODO: Add return description\n\"\"\""
                        : "\"\"\"\n" + s + " class.\n\nTODO: Add class description\n\"\"\"";
            case JAVASCRIPT:
            case TYPESCRIPT:
                return fn
                        ? "/**\n * " + s + "\n *\n * @param {} TODO: Add parameter descriptions\n * @returns {} TODO: Add return description\n */"
                        : "/**\n * " + s + " class\n *\n * TODO: Add class description\n */";
            case JAVA:
            case CPP:
            case C:
                return fn
                        ? "/**\n * " + s + "\n *\n * @param TODO: Add parameter descriptions\n * @return TODO: Add return description\n */"
                        : "/**\n * " + s + " class\n *\n * TODO: Add class description\n */";
            case GO:
                return fn
                        ? "// " + name + " " + lowerFirst(s) + ".\n// TODO: Add parameter and return descriptions"
                        : "// " + name + " TODO: Add struct/interface description";
            case RUST:
                return fn
                        ? "/// " + s + "\n/// TODO: Add function description\n/// TODO: Add parameter and return descriptions"
                        : "/// " + s + " TODO: Add struct/trait description";
            default:
                return "// TODO: Add documentation for " + name;
        }
    }

    /** calculateSum / calculate_sum / __init__ -> "Calculate sum" / "Calculate sum" / "Init" */
    static String toSentence(String name) {
        String spaced = name.replaceAll("([a-z0-9])([A-Z])", "$1 $2")
                .replace('_', ' ')
                .trim()
                .replaceAll("\\s+", " ")
                .toLowerCase(Locale.ROOT);
        if (spaced.isEmpty()) return name;
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }

    private static String lowerFirst(String s) {
        return s.isEmpty() ? s : Character.toLowerCase(s.charAt(0)) + s.substring(1);
    }
}
