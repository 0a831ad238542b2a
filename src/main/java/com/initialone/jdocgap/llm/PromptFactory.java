package com.initialone.jdocgap.llm;

import com.initialone.jdocgap.lang.Language;
import com.initialone.jdocgap.model.SymbolRecord;

public class PromptFactory {

    static final int MAX_CONTEXT_CHARS = 4000;

    public static String systemPrompt(Language language) {
        return "You are a senior " + displayName(language) + " engineer. "
                + "Write a 1-3 sentence documentation comment for the given definition. "
                + "Do not hallucinate external behavior. Mention side-effects if obvious. "
                + "Output only the comment body, without comment markers ("
                + markerHint(language) + ").";
    }

    public static String docPrompt(SymbolRecord symbol, Language language, String context) {
        String code = context == null ? "" : context;
        if (code.length() > MAX_CONTEXT_CHARS) {
            code = code.substring(0, MAX_CONTEXT_CHARS) + "\n... (trimmed) ...";
        }
        return """
                Document the %s `%s` (%s).
                Style: %s

                Code:
                ```%s
                %s
                ```
                """.formatted(
                symbol.kind().label(),
                symbol.name(),
                language.tag(),
                styleHint(language),
                language.tag(),
                code);
    }

    private static String styleHint(Language language) {
        switch (language) {
            case PYTHON:
                return "docstring (PEP 257), summary line first";
            case JAVASCRIPT:
            case TYPESCRIPT:
                return "JSDoc";
            case JAVA:
            case CPP:
            case C:
                return "Javadoc";
            case GO:
                return "Go doc comment starting with the identifier name";
            case RUST:
                return "rustdoc";
            default:
                return "plain";
        }
    }

    private static String markerHint(Language language) {
        switch (language) {
            case PYTHON:
                return "no triple quotes";
            case GO:
                return "no //";
            case RUST:
                return "no ///";
            default:
                return "no /** */";
        }
    }

    private static String displayName(Language language) {
        switch (language) {
            case CPP:
                return "C++";
            case JAVASCRIPT:
                return "JavaScript";
            case TYPESCRIPT:
                return "TypeScript";
            default:
                String t = language.tag();
                return Character.toUpperCase(t.charAt(0)) + t.substring(1);
        }
    }
}
