package com.initialone.jdocgap.core;

import com.initialone.jdocgap.model.AnalysisResult;
import com.initialone.jdocgap.model.CommentMap;
import com.initialone.jdocgap.model.SymbolRecord;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Plain-text report of what a run would change. */
public final class DryRunSummary {

    static final int PREVIEW_FILES = 3;
    static final int PREVIEW_SYMBOLS_PER_FILE = 2;

    private DryRunSummary() {}

    public static String render(AnalysisResult result, CommentMap comments) {
        List<String> out = new ArrayList<>();
        out.add("Documentation Dry Run Summary");
        out.add("=".repeat(50));
        out.add("");

        int totalFiles = 0;
        int totalSymbols = 0;
        for (Map.Entry<Path, List<SymbolRecord>> e : result.files().entrySet()) {
            List<SymbolRecord> withComment = new ArrayList<>();
            for (SymbolRecord s : e.getValue()) {
                if (comments.contains(e.getKey(), s.name())) withComment.add(s);
            }
            if (withComment.isEmpty()) continue;

            totalFiles++;
            totalSymbols += withComment.size();
            out.add("File: " + e.getKey());
            for (SymbolRecord s : withComment) {
                out.add("  - " + s.kind().label() + ": " + s.name());
            }
            out.add("");
        }

        out.add("Total files to modify: " + totalFiles);
        out.add("Total functions/classes to document: " + totalSymbols);
        out.add("");
        out.add("Generated comments preview:");
        out.add("-".repeat(30));

        int files = 0;
        for (Map.Entry<Path, List<SymbolRecord>> e : result.files().entrySet()) {
            if (files >= PREVIEW_FILES) break;
            int shown = 0;
            for (SymbolRecord s : e.getValue()) {
                if (shown >= PREVIEW_SYMBOLS_PER_FILE) break;
                Optional<String> c = comments.get(e.getKey(), s.name());
                if (c.isEmpty()) continue;
                out.add("");
                out.add(s.name() + ":");
                out.add(c.get());
                shown++;
            }
            if (shown > 0) files++;
        }
        return String.join("\n", out);
    }
}
