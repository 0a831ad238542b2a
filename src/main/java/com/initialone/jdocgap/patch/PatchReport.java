package com.initialone.jdocgap.patch;

import com.initialone.jdocgap.model.SymbolRecord;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** What a patch batch did: which symbols got a comment, which did not, which files changed. */
public class PatchReport {

    private final List<SymbolRecord> patched = new ArrayList<>();
    private final List<SymbolRecord> failed = new ArrayList<>();
    private final Set<Path> modifiedFiles = new LinkedHashSet<>();

    void patched(SymbolRecord s)  { patched.add(s); }
    void failed(SymbolRecord s)   { failed.add(s); }
    void modified(Path file)      { modifiedFiles.add(file); }

    public void merge(PatchReport other) {
        patched.addAll(other.patched);
        failed.addAll(other.failed);
        modifiedFiles.addAll(other.modifiedFiles);
    }

    public List<SymbolRecord> patched() {
        return Collections.unmodifiableList(patched);
    }

    public List<SymbolRecord> failed() {
        return Collections.unmodifiableList(failed);
    }

    public List<Path> modifiedFiles() {
        return List.copyOf(modifiedFiles);
    }

    @Override
    public String toString() {
        return "patched=" + patched.size() + " failed=" + failed.size() + " files=" + modifiedFiles.size();
    }
}
