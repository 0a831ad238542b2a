package com.initialone.jdocgap.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** file -> (symbol name -> comment text already in the language's comment syntax). */
public class CommentMap {

    private final Map<Path, Map<String, String>> byFile = new LinkedHashMap<>();

    public void put(Path file, String symbolName, String comment) {
        byFile.computeIfAbsent(file, k -> new LinkedHashMap<>()).put(symbolName, comment);
    }

    public Optional<String> get(Path file, String symbolName) {
        Map<String, String> m = byFile.get(file);
        return m == null ? Optional.empty() : Optional.ofNullable(m.get(symbolName));
    }

    public boolean contains(Path file, String symbolName) {
        return get(file, symbolName).isPresent();
    }

    public Map<String, String> commentsOf(Path file) {
        Map<String, String> m = byFile.get(file);
        return m == null ? Map.of() : Collections.unmodifiableMap(m);
    }

    public Map<Path, Map<String, String>> files() {
        return Collections.unmodifiableMap(byFile);
    }

    public boolean isEmpty() {
        return byFile.isEmpty();
    }
}
