package com.initialone.jdocgap.commands;

import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "preview",
        description = "Dry run: generate comments and print the summary without writing anything."
)
public class PreviewCmd extends BaseDocCmd implements Callable<Integer> {

    @Override
    public Integer call() {
        Path dir = directory();
        System.out.println(orchestrator(config(), dir, false).dryRun(dir));
        return 0;
    }
}
