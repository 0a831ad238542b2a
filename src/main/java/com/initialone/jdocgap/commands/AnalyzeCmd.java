package com.initialone.jdocgap.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.initialone.jdocgap.config.DocGapConfig;
import com.initialone.jdocgap.core.DocOrchestrator;
import com.initialone.jdocgap.model.AnalysisResult;
import com.initialone.jdocgap.model.SymbolRecord;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "analyze",
        description = "Find undocumented functions and classes; prints a table or, with --dry-run, the change summary."
)
public class AnalyzeCmd extends BaseDocCmd implements Callable<Integer> {

    @CommandLine.Option(names = "--dry-run",
            description = "Show what would be changed without making changes")
    boolean dryRun;

    @CommandLine.Option(names = "--json",
            description = "Also write the findings to this JSON file")
    Path jsonOut;

    static class Finding {
        public String file;
        public int line;
        public String kind;
        public String name;
        public String language;
    }

    @Override
    public Integer call() throws Exception {
        Path dir = directory();
        DocGapConfig cfg = config();
        DocOrchestrator orchestrator = orchestrator(cfg, dir, false);

        if (dryRun) {
            System.out.println(orchestrator.dryRun(dir));
            return 0;
        }

        AnalysisResult result = orchestrator.analyze(dir);
        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<Path, List<SymbolRecord>> e : result.files().entrySet()) {
            System.out.println(e.getKey());
            for (SymbolRecord s : e.getValue()) {
                System.out.printf("  %5d  %-8s %s%n", s.line(), s.kind().label(), s.name());
                Finding f = new Finding();
                f.file = String.valueOf(e.getKey());
                f.line = s.line();
                f.kind = s.kind().label();
                f.name = s.name();
                f.language = s.language().tag();
                findings.add(f);
            }
        }
        if (result.isEmpty()) {
            System.out.println("[analyze] everything is documented.");
        }

        if (jsonOut != null) {
            ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            om.writeValue(jsonOut.toFile(), findings);
            System.out.println("[analyze] findings -> " + jsonOut.toAbsolutePath());
        }
        return 0;
    }
}
