package com.initialone.jdocgap.ast;

/** A grammar could not parse one file; the file is retried with the regex engine. */
public class SyntaxParseException extends Exception {

    public SyntaxParseException(String message) {
        super(message);
    }

    public SyntaxParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
