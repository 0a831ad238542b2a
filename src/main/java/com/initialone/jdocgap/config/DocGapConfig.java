package com.initialone.jdocgap.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.initialone.jdocgap.lang.Language;
import com.initialone.jdocgap.scan.IgnoreRules;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Settings read from {@code docgap.json}. Every field has a default, so an empty object
 * (or no file at all) is a valid configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DocGapConfig {

    public List<String> supportedLanguages = new ArrayList<>(List.of(
            "python", "javascript", "typescript", "java", "cpp", "c", "go", "rust"));
    public List<String> ignorePatterns = new ArrayList<>(IgnoreRules.DEFAULT_PATTERNS);
    public boolean pythonClassReindent = false;
    public GitHub github = new GitHub();
    public Llm llm = new Llm();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GitHub {
        public String tokenEnv = "GITHUB_TOKEN";
        public String baseBranch = "main";
        public String prTitlePrefix = "docs:";
        public String prBodyTemplate =
                "Adds documentation comments to {symbols} undocumented functions and classes.\n\n"
                        + "Files modified:\n{files_modified}";
        /** "owner/repo"; when null it is read from the origin remote URL */
        public String repository;
        public String apiBase = "https://api.github.com";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Llm {
        public int maxTokens = 256;
        public double temperature = 0.2;
    }

    /** Languages named in {@link #supportedLanguages}; an unknown tag is a configuration error. */
    public Set<Language> languages() {
        Set<Language> out = EnumSet.noneOf(Language.class);
        if (supportedLanguages == null) return EnumSet.allOf(Language.class);
        for (String tag : supportedLanguages) {
            Language lang = Language.fromTag(tag)
                    .orElseThrow(() -> new ConfigException("unknown language in supportedLanguages: " + tag));
            out.add(lang);
        }
        return out;
    }

    public IgnoreRules ignoreRules() {
        return ignorePatterns == null ? IgnoreRules.none() : new IgnoreRules(ignorePatterns);
    }
}
