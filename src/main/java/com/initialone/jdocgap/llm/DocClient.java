package com.initialone.jdocgap.llm;

import com.initialone.jdocgap.lang.Language;
import com.initialone.jdocgap.model.SymbolRecord;

/** Produces a documentation comment for one undocumented symbol. */
public interface DocClient {
    /**
     * Generate the comment for a function or class.
     * @param symbol the undocumented definition
     * @param language language of the file; decides the comment syntax
     * @param context a bounded code excerpt around the definition, may be empty
     * @return comment text in the language's comment syntax, never blank
     * @throws SynthesisException on network, payload or empty-answer errors
     */
    String synthesize(SymbolRecord symbol, Language language, String context) throws SynthesisException;
}
