package com.initialone.jdocgap.model;

import com.initialone.jdocgap.lang.Language;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An undocumented function, method or class found in one file.
 *
 * <p>{@code line} is 1-based, {@code offset} is a zero-based character index into the file
 * content as it was analyzed. Once the file is rewritten the record is stale.
 */
public final class SymbolRecord {

    private final String name;
    private final SymbolKind kind;
    private final Path sourceFile;
    private final int line;
    private final int offset;
    private final Language language;

    public SymbolRecord(String name, SymbolKind kind, Path sourceFile, int line, int offset, Language language) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("symbol name must not be empty");
        }
        if (line < 1) {
            throw new IllegalArgumentException("line must be 1-based, got " + line);
        }
        this.name = name;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sourceFile = sourceFile;
        this.line = line;
        this.offset = offset;
        this.language = Objects.requireNonNull(language, "language");
    }

    public String name()       { return name; }
    public SymbolKind kind()   { return kind; }
    public Path sourceFile()   { return sourceFile; }
    public int line()          { return line; }
    public int offset()        { return offset; }
    public Language language() { return language; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolRecord r)) return false;
        return line == r.line
                && offset == r.offset
                && name.equals(r.name)
                && kind == r.kind
                && Objects.equals(sourceFile, r.sourceFile)
                && language == r.language;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, sourceFile, line, offset, language);
    }

    @Override
    public String toString() {
        return kind.label() + " " + name + " @" + sourceFile + ":" + line;
    }
}
