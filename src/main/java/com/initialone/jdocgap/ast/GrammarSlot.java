package com.initialone.jdocgap.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of loading a grammar, fixed when the registry is built: either {@code parsed} with a
 * working grammar or {@code unavailable} with the reason. Never re-evaluated per file.
 */
public final class GrammarSlot {

    private static final GrammarSlot NONE = new GrammarSlot(null, "no grammar for this language");

    private final Grammar grammar;
    private final String reason;

    private GrammarSlot(Grammar grammar, String reason) {
        this.grammar = grammar;
        this.reason = reason;
    }

    public static GrammarSlot parsed(Grammar grammar) {
        return new GrammarSlot(Objects.requireNonNull(grammar, "grammar"), null);
    }

    public static GrammarSlot unavailable(String reason) {
        return new GrammarSlot(null, reason == null ? "unavailable" : reason);
    }

    /** Slot for languages that never had a grammar. */
    public static GrammarSlot none() {
        return NONE;
    }

    public boolean isAvailable() {
        return grammar != null;
    }

    public Optional<Grammar> grammar() {
        return Optional.ofNullable(grammar);
    }

    /** Why the grammar is missing; null when available. */
    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return isAvailable() ? "Parsed(" + grammar.language() + ")" : "Unavailable(" + reason + ")";
    }
}
