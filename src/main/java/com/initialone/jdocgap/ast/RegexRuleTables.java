package com.initialone.jdocgap.ast;

import com.initialone.jdocgap.lang.Language;

import java.util.List;
import java.util.regex.Pattern;

import static com.initialone.jdocgap.model.SymbolKind.CLASS;
import static com.initialone.jdocgap.model.SymbolKind.FUNCTION;

/** Ordered fallback rules per language. C and C++ have none. */
final class RegexRuleTables {

    static final List<RegexRule> PYTHON = List.of(
            new RegexRule("def\\s+(\\w+)\\s*\\(", FUNCTION),
            new RegexRule("class\\s+(\\w+)\\s*[\\(:]", CLASS)
    );

    static final List<RegexRule> JAVASCRIPT = List.of(
            new RegexRule("function\\s+(\\w+)\\s*\\(", FUNCTION),
            new RegexRule("const\\s+(\\w+)\\s*=\\s*\\(", FUNCTION),
            new RegexRule("let\\s+(\\w+)\\s*=\\s*\\(", FUNCTION),
            new RegexRule("var\\s+(\\w+)\\s*=\\s*\\(", FUNCTION),
            new RegexRule("(\\w+)\\s*:\\s*function", FUNCTION),
            new RegexRule("class\\s+(\\w+)\\s*[{\\s]", CLASS)
    );

    static final List<RegexRule> GO = List.of(
            new RegexRule("func\\s+(?:\\([^)]*\\)\\s*)?(\\w+)\\s*\\(", FUNCTION),
            new RegexRule("type\\s+(\\w+)\\s+(?:struct|interface)\\b", CLASS)
    );

    static final List<RegexRule> RUST = List.of(
            new RegexRule("fn\\s+(\\w+)\\s*[<(]", FUNCTION),
            new RegexRule("(?:struct|trait|enum)\\s+(\\w+)", CLASS)
    );

    static final List<RegexRule> JAVA = List.of(
            new RegexRule("(?:class|interface|enum|record)\\s+(\\w+)", CLASS),
            new RegexRule(Pattern.compile(
                    "^[ \\t]*(?:(?:public|protected|private|static|final|abstract|synchronized|native|default|strictfp)\\s+)*"
                            + "(?:<[^>]+>\\s+)?[\\w.$<>\\[\\]?, ]+?\\s+"
                            + "(?!(?:if|for|while|switch|catch|return|new|else|throw)\\b)(\\w+)"
                            + "\\s*\\([^;{}]*\\)\\s*(?:throws\\s+[\\w.$, ]+)?\\{",
                    Pattern.MULTILINE), FUNCTION)
    );

    private RegexRuleTables() {}

    static List<RegexRule> forLanguage(Language language) {
        switch (language) {
            case PYTHON:
                return PYTHON;
            case JAVASCRIPT:
            case TYPESCRIPT:
                return JAVASCRIPT;
            case GO:
                return GO;
            case RUST:
                return RUST;
            case JAVA:
                return JAVA;
            default:
                return List.of();
        }
    }
}
