package com.initialone.jdocgap.lang;

import java.util.Locale;
import java.util.Optional;

/** Language tags understood by the analyzers. */
public enum Language {
    PYTHON("python"),
    JAVASCRIPT("javascript"),
    TYPESCRIPT("typescript"),
    JAVA("java"),
    CPP("cpp"),
    C("c"),
    GO("go"),
    RUST("rust");

    private final String tag;

    Language(String tag) {
        this.tag = tag;
    }

    /** lower-case tag, e.g. "python" */
    public String tag() {
        return tag;
    }

    public static Optional<Language> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (Language l : values()) {
            if (l.tag.equals(t)) return Optional.of(l);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return tag;
    }
}
