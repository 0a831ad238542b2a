package com.initialone.jdocgap.ast;

import com.initialone.jdocgap.lang.Language;

/** A concrete-syntax parser for one language that produces a {@link SyntaxArena}. */
public interface Grammar {

    Language language();

    NodeKinds kinds();

    /**
     * Parses the whole file content. Offsets in the returned arena are character offsets into
     * {@code content}.
     *
     * @throws SyntaxParseException when the parser cannot produce a tree for this content
     */
    SyntaxArena parse(String content) throws SyntaxParseException;
}
