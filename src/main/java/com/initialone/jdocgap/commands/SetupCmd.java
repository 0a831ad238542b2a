package com.initialone.jdocgap.commands;

import com.initialone.jdocgap.ast.GrammarSlot;
import com.initialone.jdocgap.ast.LanguageRegistry;
import com.initialone.jdocgap.config.ConfigException;
import com.initialone.jdocgap.config.ConfigLoader;
import com.initialone.jdocgap.config.DocGapConfig;
import com.initialone.jdocgap.lang.Language;
import com.initialone.jdocgap.llm.LlmOptions;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "setup",
        description = "Check the configuration, the GitHub token, the comment provider and the parsers."
)
public class SetupCmd implements Callable<Integer> {

    static final int EXIT_PROBLEM = 2;

    @CommandLine.Mixin
    LlmOptions llm;

    @CommandLine.Option(names = {"-c", "--config"},
            description = "JSON configuration file to check (default: built-in settings)")
    Path configFile;

    @Override
    public Integer call() {
        boolean ok = true;
        System.out.println("[setup] checking environment");

        DocGapConfig cfg;
        if (configFile == null) {
            System.out.println("[setup] config: none given, using defaults");
            cfg = new DocGapConfig();
        } else if (!Files.isRegularFile(configFile)) {
            System.out.println("[setup] config: " + configFile.toAbsolutePath() + " not found, using defaults");
            cfg = new DocGapConfig();
        } else {
            try {
                cfg = ConfigLoader.load(configFile);
                System.out.println("[setup] config: " + configFile.toAbsolutePath() + " OK");
            } catch (ConfigException e) {
                System.out.println("[setup] config: INVALID " + e.getMessage());
                cfg = new DocGapConfig();
                ok = false;
            }
        }

        String token = System.getenv(cfg.github.tokenEnv);
        if (token != null && !token.isBlank()) {
            System.out.println("[setup] github token: " + cfg.github.tokenEnv + " is set");
        } else {
            System.out.println("[setup] github token: " + cfg.github.tokenEnv
                    + " is not set, pull requests will be skipped");
        }

        try {
            BaseDocCmd.buildDocClient(llm, cfg);
            System.out.println("[setup] provider: " + llm.provider + " OK");
        } catch (ConfigException e) {
            System.out.println("[setup] provider: " + llm.provider + " NOT USABLE " + e.getMessage());
            ok = false;
        }

        LanguageRegistry registry = LanguageRegistry.shared();
        for (Language l : Language.values()) {
            GrammarSlot slot = registry.grammar(l);
            String state = slot.isAvailable() ? "parser" : "regex fallback (" + slot.reason() + ")";
            String enabled = cfg.languages().contains(l) ? "" : " [disabled in config]";
            System.out.printf("[setup]   %-11s %s%s%n", l.tag(), state, enabled);
        }

        System.out.println(ok
                ? "[setup] done. Run 'jdocgap preview' to see what would be documented."
                : "[setup] problems found, see above.");
        return ok ? 0 : EXIT_PROBLEM;
    }
}
