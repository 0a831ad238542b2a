package com.initialone.jdocgap.ast;

import com.initialone.jdocgap.model.SymbolKind;

import java.util.regex.Pattern;

/** One fallback pattern; capture group 1 is the definition's name. */
public final class RegexRule {

    private final Pattern pattern;
    private final SymbolKind kind;

    public RegexRule(String regex, SymbolKind kind) {
        this(Pattern.compile(regex), kind);
    }

    public RegexRule(Pattern pattern, SymbolKind kind) {
        this.pattern = pattern;
        this.kind = kind;
    }

    public Pattern pattern() { return pattern; }
    public SymbolKind kind() { return kind; }

    @Override
    public String toString() {
        return kind.label() + " " + pattern.pattern();
    }
}
