package com.initialone.jdocgap.lang;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Built-in comment syntax per language. */
public final class LanguageProfiles {

    private static final Map<Language, LanguageProfile> PROFILES = new EnumMap<>(Language.class);
    static {
        register(new LanguageProfile(Language.PYTHON, LanguageClassifier.extensionsOf(Language.PYTHON),
                "#", null, null, null, List.of("\"\"\"", "'''"), true));
        register(cFamily(Language.JAVASCRIPT));
        register(cFamily(Language.TYPESCRIPT));
        register(cFamily(Language.JAVA));
        register(cFamily(Language.CPP));
        register(cFamily(Language.C));
        // Go doc comments are plain // lines
        register(new LanguageProfile(Language.GO, LanguageClassifier.extensionsOf(Language.GO),
                "//", null, null, null, List.of(), false));
        register(new LanguageProfile(Language.RUST, LanguageClassifier.extensionsOf(Language.RUST),
                "//", null, null, "///", List.of(), false));
    }

    private LanguageProfiles() {}

    public static LanguageProfile of(Language language) {
        return PROFILES.get(language);
    }

    private static LanguageProfile cFamily(Language l) {
        return new LanguageProfile(l, LanguageClassifier.extensionsOf(l), "//", "/*", "*/", "/**", List.of(), false);
    }

    private static void register(LanguageProfile p) {
        PROFILES.put(p.language(), p);
    }
}
