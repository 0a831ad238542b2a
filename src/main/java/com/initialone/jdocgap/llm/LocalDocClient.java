package com.initialone.jdocgap.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.initialone.jdocgap.lang.Language;
import com.initialone.jdocgap.model.SymbolRecord;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Local model server. {@code api} is either "openai" (OpenAI-compatible
 * {@code /v1/chat/completions}, e.g. LM Studio, llama.cpp) or "ollama" ({@code /api/chat}).
 */
public class LocalDocClient implements DocClient {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient http;
    private final String apiKey;   // optional for local servers
    private final String api;
    private final String baseUrl;
    private final String model;
    private final int maxTokens;
    private final double temperature;
    private final ObjectMapper om = new ObjectMapper();

    public LocalDocClient(String api, String baseUrl, String model, int timeoutSeconds, int maxTokens, double temperature) {
        // LOCAL_LLM_API_KEY first, then OPENAI_API_KEY; most local servers need none
        String key = System.getenv("LOCAL_LLM_API_KEY");
        if (key == null || key.isEmpty()) {
            key = System.getenv("OPENAI_API_KEY");
        }
        this.apiKey = (key != null && !key.isEmpty()) ? key : null;

        this.api = "openai".equalsIgnoreCase(api) ? "openai" : "ollama";
        String defBase = "openai".equals(this.api) ? "http://localhost:1234" : "http://localhost:11434";
        this.baseUrl = normalizeBase((baseUrl == null || baseUrl.isEmpty()) ? defBase : baseUrl);
        this.model = (model == null || model.isEmpty()) ? "local-model" : model;
        this.maxTokens = maxTokens <= 0 ? 256 : maxTokens;
        this.temperature = temperature;
        this.http = new OkHttpClient.Builder().callTimeout(Math.max(1, timeoutSeconds), TimeUnit.SECONDS).build();
    }

    @Override
    public String synthesize(SymbolRecord symbol, Language language, String context) throws SynthesisException {
        List<Map<String, String>> messages = List.of(
                Map.of("role", "system", "content", PromptFactory.systemPrompt(language)),
                Map.of("role", "user", "content", PromptFactory.docPrompt(symbol, language, context)));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", messages);
        String url;
        if ("openai".equals(api)) {
            payload.put("temperature", temperature);
            payload.put("max_tokens", maxTokens);
            url = baseUrl.endsWith("/v1") ? baseUrl + "/chat/completions" : baseUrl + "/v1/chat/completions";
        } else {
            payload.put("stream", false);
            payload.put("options", Map.of("temperature", temperature, "num_predict", maxTokens));
            url = baseUrl + "/api/chat";
        }

        Request.Builder rb = new Request.Builder().url(url);
        try {
            rb.post(RequestBody.create(om.writeValueAsString(payload), JSON));
        } catch (IOException e) {
            throw new SynthesisException("cannot encode request", e);
        }
        if (apiKey != null && !apiKey.isEmpty()) {
            rb.header("Authorization", "Bearer " + apiKey);
        }

        try (Response resp = http.newCall(rb.build()).execute()) {
            String body = resp.body() == null ? "" : resp.body().string();
            if (!resp.isSuccessful()) {
                throw new SynthesisException("Local LLM error " + resp.code() + ": " + body);
            }
            JsonNode root = om.readTree(body);
            String content = "openai".equals(api)
                    ? root.path("choices").path(0).path("message").path("content").asText("")
                    : root.path("message").path("content").asText("");
            String comment = CommentFormatter.format(content, language);
            if (comment.isBlank()) {
                throw new SynthesisException("empty comment for " + symbol.name());
            }
            return comment;
        } catch (IOException ioe) {
            throw new SynthesisException("Local LLM IO error: " + ioe.getMessage(), ioe);
        }
    }

    private static String normalizeBase(String base) {
        // drop the trailing slash so the paths below can be appended
        if (base.endsWith("/")) return base.substring(0, base.length() - 1);
        return base;
    }
}
