package com.initialone.jdocgap.patch;

import com.initialone.jdocgap.model.SymbolRecord;

import java.util.Objects;

/** One comment to be written next to one symbol. */
public final class Insertion {

    private final SymbolRecord symbol;
    private final String comment;

    public Insertion(SymbolRecord symbol, String comment) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.comment = comment == null ? "" : comment;
    }

    public SymbolRecord symbol() { return symbol; }
    public String comment()      { return comment; }
}
