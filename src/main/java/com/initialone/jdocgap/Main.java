package com.initialone.jdocgap;

import com.initialone.jdocgap.commands.AnalyzeCmd;
import com.initialone.jdocgap.commands.GenerateCmd;
import com.initialone.jdocgap.commands.PreviewCmd;
import com.initialone.jdocgap.commands.SetupCmd;
import com.initialone.jdocgap.config.ConfigException;
import picocli.CommandLine;

@CommandLine.Command(
        name = "jdocgap",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true,
        sortOptions = false,
        description = {
                "Find undocumented functions and classes and write comments for them. Typical flow:",
                "  setup → analyze → preview → generate",
                "",
                "Providers: rule | openai | local",
                "Local provider: --local-api openai|ollama + --endpoint http://host:port",
                "Env: OPENAI_API_KEY / OPENAI_BASE_URL / LOCAL_LLM_API_KEY / GITHUB_TOKEN"
        },
        subcommands = {
                SetupCmd.class, AnalyzeCmd.class, PreviewCmd.class, GenerateCmd.class
        }
)
public class Main implements Runnable {

    static final int EXIT_CONFIG = 2;

    public void run() { System.out.println("Use a subcommand. Try --help."); }

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        CommandLine cli = new CommandLine(new Main());
        cli.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof ConfigException) {
                cmd.getErr().println("[config] " + ex.getMessage());
                return EXIT_CONFIG;
            }
            throw ex;
        });
        return cli;
    }
}
