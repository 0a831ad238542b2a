package com.initialone.jdocgap.model;

public enum SymbolKind {
    FUNCTION("function"),
    CLASS("class");

    private final String label;

    SymbolKind(String label) {
        this.label = label;
    }

    /** "function" or "class", as printed in reports */
    public String label() {
        return label;
    }
}
