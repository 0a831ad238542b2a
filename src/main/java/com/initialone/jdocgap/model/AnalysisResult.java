package com.initialone.jdocgap.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * file -> undocumented symbols in discovery order. Files without findings are never added.
 * Diagnostics collect per-file problems that were skipped over (unreadable file, parser crash).
 */
public class AnalysisResult {

    private final Map<Path, List<SymbolRecord>> byFile = new LinkedHashMap<>();
    private final List<String> diagnostics = new ArrayList<>();

    /** Adds the file's findings; an empty list is ignored so the map stays sparse. */
    public void put(Path file, List<SymbolRecord> symbols) {
        if (symbols == null || symbols.isEmpty()) return;
        byFile.put(file, List.copyOf(symbols));
    }

    public void addDiagnostic(String message) {
        diagnostics.add(message);
    }

    public Map<Path, List<SymbolRecord>> files() {
        return Collections.unmodifiableMap(byFile);
    }

    public List<SymbolRecord> symbolsOf(Path file) {
        return byFile.getOrDefault(file, List.of());
    }

    public List<String> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean isEmpty() {
        return byFile.isEmpty();
    }

    public int fileCount() {
        return byFile.size();
    }

    public int symbolCount() {
        int n = 0;
        for (List<SymbolRecord> l : byFile.values()) n += l.size();
        return n;
    }
}
