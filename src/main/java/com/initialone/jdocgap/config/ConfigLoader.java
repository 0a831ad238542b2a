package com.initialone.jdocgap.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigLoader {

    private static final ObjectMapper OM = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Defaults when {@code file} is null; otherwise the file must exist and hold a JSON object. */
    public static DocGapConfig load(Path file) {
        DocGapConfig cfg;
        if (file == null) {
            cfg = new DocGapConfig();
        } else {
            if (!Files.isRegularFile(file)) {
                throw new ConfigException("config file not found: " + file.toAbsolutePath());
            }
            try {
                cfg = OM.readValue(file.toFile(), DocGapConfig.class);
            } catch (IOException e) {
                throw new ConfigException("cannot read config " + file + ": " + e.getMessage(), e);
            }
            if (cfg == null) {
                throw new ConfigException("config file is empty: " + file);
            }
        }
        validate(cfg);
        return cfg;
    }

    static void validate(DocGapConfig cfg) {
        cfg.languages();
        if (cfg.github == null) cfg.github = new DocGapConfig.GitHub();
        if (cfg.llm == null) cfg.llm = new DocGapConfig.Llm();
        if (cfg.llm.maxTokens <= 0) {
            throw new ConfigException("llm.maxTokens must be positive, got " + cfg.llm.maxTokens);
        }
        if (cfg.llm.temperature < 0 || cfg.llm.temperature > 2) {
            throw new ConfigException("llm.temperature must be within [0, 2], got " + cfg.llm.temperature);
        }
        if (cfg.github.tokenEnv == null || cfg.github.tokenEnv.isBlank()) {
            throw new ConfigException("github.tokenEnv must name an environment variable");
        }
    }
}
