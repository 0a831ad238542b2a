package com.initialone.jdocgap.commands;

import com.initialone.jdocgap.config.DocGapConfig;
import com.initialone.jdocgap.core.WorkflowReport;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "generate",
        description = "Write generated comments into the files and open a pull request."
)
public class GenerateCmd extends BaseDocCmd implements Callable<Integer> {

    @CommandLine.Option(names = "--no-pr", description = "Skip creating the pull request")
    boolean noPr;

    @Override
    public Integer call() {
        Path dir = directory();
        DocGapConfig cfg = config();
        boolean createPr = !noPr;

        WorkflowReport report = orchestrator(cfg, dir, createPr).run(dir, createPr);

        if (report.changeUrl().isPresent()) {
            System.out.println("[generate] pull request created: " + report.changeUrl().get());
        } else if (!createPr) {
            System.out.println("[generate] documentation generation completed. " + report.patch());
        } else {
            System.out.println("[generate] no changes were made or pull request creation failed. " + report.patch());
        }
        return report.patch().failed().isEmpty() ? 0 : 1;
    }
}
