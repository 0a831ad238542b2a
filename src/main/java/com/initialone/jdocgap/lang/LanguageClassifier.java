package com.initialone.jdocgap.lang;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Maps a file name extension to a {@link Language}. */
public final class LanguageClassifier {

    private static final Map<String, Language> BY_EXTENSION = new LinkedHashMap<>();
    static {
        BY_EXTENSION.put(".py",  Language.PYTHON);
        BY_EXTENSION.put(".js",  Language.JAVASCRIPT);
        BY_EXTENSION.put(".jsx", Language.JAVASCRIPT);
        BY_EXTENSION.put(".ts",  Language.TYPESCRIPT);
        BY_EXTENSION.put(".tsx", Language.TYPESCRIPT);
        BY_EXTENSION.put(".java", Language.JAVA);
        BY_EXTENSION.put(".cpp", Language.CPP);
        BY_EXTENSION.put(".cc",  Language.CPP);
        BY_EXTENSION.put(".cxx", Language.CPP);
        BY_EXTENSION.put(".c",   Language.C);
        BY_EXTENSION.put(".go",  Language.GO);
        BY_EXTENSION.put(".rs",  Language.RUST);
    }

    private LanguageClassifier() {}

    public static Optional<Language> classify(Path path) {
        if (path == null || path.getFileName() == null) return Optional.empty();
        return classify(path.getFileName().toString());
    }

    public static Optional<Language> classify(String fileName) {
        if (fileName == null) return Optional.empty();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) return Optional.empty();
        String ext = fileName.substring(dot).toLowerCase(Locale.ROOT);
        return Optional.ofNullable(BY_EXTENSION.get(ext));
    }

    /** Extensions registered for a language, in table order. */
    public static List<String> extensionsOf(Language language) {
        List<String> out = new ArrayList<>();
        BY_EXTENSION.forEach((ext, lang) -> {
            if (lang == language) out.add(ext);
        });
        return out;
    }
}
