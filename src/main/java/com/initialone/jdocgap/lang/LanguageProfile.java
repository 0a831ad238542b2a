package com.initialone.jdocgap.lang;

import java.util.List;

/**
 * Comment syntax of one language.
 *
 * <p>{@code lineComment}, {@code blockOpen}/{@code blockClose} and {@code docComment} may be
 * null when the language has no such token. {@code docstringMarkers} are the string delimiters
 * that open an in-body docstring (Python only).
 */
public class LanguageProfile {

    /** Tokens a line may start with and still be part of a comment block. */
    public static final List<String> CONTINUATION_TOKENS = List.of("//", "#", "/*", "*", "///");

    private final Language language;
    private final List<String> extensions;
    private final String lineComment;
    private final String blockOpen;
    private final String blockClose;
    private final String docComment;
    private final List<String> docstringMarkers;
    private final boolean docInsideBody;

    public LanguageProfile(Language language,
                           List<String> extensions,
                           String lineComment,
                           String blockOpen,
                           String blockClose,
                           String docComment,
                           List<String> docstringMarkers,
                           boolean docInsideBody) {
        this.language = language;
        this.extensions = List.copyOf(extensions);
        this.lineComment = lineComment;
        this.blockOpen = blockOpen;
        this.blockClose = blockClose;
        this.docComment = docComment;
        this.docstringMarkers = docstringMarkers == null ? List.of() : List.copyOf(docstringMarkers);
        this.docInsideBody = docInsideBody;
    }

    public Language language()             { return language; }
    public List<String> extensions()       { return extensions; }
    public String lineComment()            { return lineComment; }
    public String blockOpen()              { return blockOpen; }
    public String blockClose()             { return blockClose; }
    public String docComment()             { return docComment; }
    public List<String> docstringMarkers() { return docstringMarkers; }
    public boolean docInsideBody()         { return docInsideBody; }

    /**
     * True when a trimmed, non-empty line opens (or closes) a comment of this language:
     * starts with the line/doc token, or contains a block marker or docstring marker.
     */
    public boolean opensComment(String trimmed) {
        if (docComment != null && trimmed.startsWith(docComment)) return true;
        if (lineComment != null && trimmed.startsWith(lineComment)) return true;
        if (blockOpen != null && trimmed.contains(blockOpen)) return true;
        if (blockClose != null && trimmed.contains(blockClose)) return true;
        for (String m : docstringMarkers) {
            if (trimmed.contains(m)) return true;
        }
        return false;
    }

    /** Line starts with one of {@link #CONTINUATION_TOKENS}. */
    public static boolean isContinuation(String trimmed) {
        for (String t : CONTINUATION_TOKENS) {
            if (trimmed.startsWith(t)) return true;
        }
        return false;
    }
}
