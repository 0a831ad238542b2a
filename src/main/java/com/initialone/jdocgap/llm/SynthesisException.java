package com.initialone.jdocgap.llm;

/** A provider could not produce a comment. Callers fall back to {@link RuleDocClient}. */
public class SynthesisException extends Exception {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
