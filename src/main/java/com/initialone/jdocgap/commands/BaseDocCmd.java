package com.initialone.jdocgap.commands;

import com.initialone.jdocgap.ast.Analyzer;
import com.initialone.jdocgap.ast.LanguageRegistry;
import com.initialone.jdocgap.config.ConfigException;
import com.initialone.jdocgap.config.ConfigLoader;
import com.initialone.jdocgap.config.DocGapConfig;
import com.initialone.jdocgap.core.DocOrchestrator;
import com.initialone.jdocgap.llm.DocClient;
import com.initialone.jdocgap.llm.LlmOptions;
import com.initialone.jdocgap.llm.LocalDocClient;
import com.initialone.jdocgap.llm.OpenAiDocClient;
import com.initialone.jdocgap.llm.RuleDocClient;
import com.initialone.jdocgap.patch.PatchApplicator;
import com.initialone.jdocgap.vcs.GitHubChangePublisher;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/** Options and wiring shared by the subcommands. */
abstract class BaseDocCmd {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    LlmOptions llm;

    @CommandLine.Option(names = {"-d", "--directory"}, defaultValue = ".",
            description = "Directory to analyze (default: ${DEFAULT-VALUE})")
    String directory;

    @CommandLine.Option(names = {"-c", "--config"},
            description = "JSON configuration file (default: built-in settings)")
    Path configFile;

    Path directory() {
        Path dir = Paths.get(directory);
        if (!Files.isDirectory(dir)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Not a directory: " + dir.toAbsolutePath());
        }
        return dir;
    }

    DocGapConfig config() {
        return ConfigLoader.load(configFile);
    }

    DocOrchestrator orchestrator(DocGapConfig cfg, Path dir, boolean publish) {
        Analyzer analyzer = new Analyzer(LanguageRegistry.shared(), cfg.ignoreRules(), cfg.languages());
        return new DocOrchestrator(
                analyzer,
                buildDocClient(llm, cfg),
                new PatchApplicator(cfg.pythonClassReindent),
                publish ? new GitHubChangePublisher(dir, cfg.github) : null);
    }

    /** Picks the comment provider named by {@code --provider}. */
    static DocClient buildDocClient(LlmOptions llm, DocGapConfig cfg) {
        String provider = llm.provider == null ? "rule" : llm.provider.trim();
        if ("openai".equalsIgnoreCase(provider)) {
            try {
                return llm.endpoint == null
                        ? new OpenAiDocClient(llm.model, llm.timeoutSec, cfg.llm.maxTokens, cfg.llm.temperature)
                        : new OpenAiDocClient(System.getenv("OPENAI_API_KEY"), llm.endpoint, llm.model,
                                llm.timeoutSec, cfg.llm.maxTokens, cfg.llm.temperature);
            } catch (IllegalStateException e) {
                throw new ConfigException(e.getMessage(), e);
            }
        }
        if ("local".equalsIgnoreCase(provider)) {
            return new LocalDocClient(llm.localApi, llm.endpoint, llm.model,
                    llm.timeoutSec, cfg.llm.maxTokens, cfg.llm.temperature);
        }
        if ("rule".equalsIgnoreCase(provider) || "dummy".equalsIgnoreCase(provider)) {
            return new RuleDocClient();
        }
        throw new ConfigException("unknown provider: " + provider + " (expected rule | openai | local)");
    }
}
