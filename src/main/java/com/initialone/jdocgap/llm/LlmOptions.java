package com.initialone.jdocgap.llm;

import picocli.CommandLine;

// shared by every command that synthesizes comments
public class LlmOptions {

    @CommandLine.Option(names="--provider", defaultValue="rule",
            description = "rule | openai | local")
    public String provider;

    @CommandLine.Option(names="--model", defaultValue="gpt-4o-mini",
            description = "Model name (OpenAI/Ollama)")
    public String model;

    @CommandLine.Option(names="--local-api", defaultValue="ollama",
            description = "When --provider=local: openai | ollama")
    public String localApi;

    @CommandLine.Option(
            names = "--endpoint",
            description = "Override base URL. " +
                    "e.g., https://api.openai.com or http://localhost:11434"
    )
    public String endpoint; // null keeps the provider's default

    @CommandLine.Option(names="--timeout-sec", defaultValue="180",
            description = "HTTP call timeout seconds")
    public int timeoutSec;
}
