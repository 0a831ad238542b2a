package com.initialone.jdocgap.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.initialone.jdocgap.lang.Language;
import com.initialone.jdocgap.model.SymbolRecord;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/** OpenAI Chat Completions client for comment synthesis. */
public class OpenAiDocClient implements DocClient {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient http;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final int maxTokens;
    private final double temperature;
    private final int maxAttempts;
    private final ObjectMapper om = new ObjectMapper();

    /** apiKey from OPENAI_API_KEY, baseUrl from OPENAI_BASE_URL or https://api.openai.com */
    public OpenAiDocClient(String model, int timeoutSeconds, int maxTokens, double temperature) {
        this(System.getenv("OPENAI_API_KEY"),
                envOr("OPENAI_BASE_URL", "https://api.openai.com"),
                model, timeoutSeconds, maxTokens, temperature);
    }

    public OpenAiDocClient(String apiKey, String baseUrl, String model, int timeoutSeconds, int maxTokens, double temperature) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("[OpenAiDocClient] OPENAI_API_KEY missing");
        }
        this.apiKey = apiKey;
        this.baseUrl = (baseUrl == null || baseUrl.isBlank()) ? "https://api.openai.com" : stripTrailingSlash(baseUrl);
        this.model = (model == null || model.isBlank()) ? "gpt-4o-mini" : model;
        this.maxTokens = maxTokens <= 0 ? 256 : maxTokens;
        this.temperature = temperature;
        this.maxAttempts = 3;

        this.http = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(120, TimeUnit.SECONDS)
                .readTimeout(120, TimeUnit.SECONDS)
                .callTimeout(Math.max(1, timeoutSeconds), TimeUnit.SECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }

    @Override
    public String synthesize(SymbolRecord symbol, Language language, String context) throws SynthesisException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("temperature", temperature);
        payload.put("max_tokens", Math.max(1, maxTokens));
        payload.put("messages", List.of(
                Map.of("role", "system", "content", PromptFactory.systemPrompt(language)),
                Map.of("role", "user",   "content", PromptFactory.docPrompt(symbol, language, context))
        ));

        String json;
        try {
            json = om.writeValueAsString(payload);
        } catch (IOException e) {
            throw new SynthesisException("cannot encode request", e);
        }

        Request req = new Request.Builder()
                .url(baseUrl + "/v1/chat/completions")
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .post(RequestBody.create(json, JSON))
                .build();

        String content = execute(req);
        String comment = CommentFormatter.format(content, language);
        if (comment.isBlank()) {
            throw new SynthesisException("empty comment for " + symbol.name());
        }
        return comment;
    }

    private String execute(Request req) throws SynthesisException {
        int attempts = 0;
        while (true) {
            attempts++;
            try (Response resp = http.newCall(req).execute()) {
                String body = resp.body() == null ? "" : resp.body().string();
                if (!resp.isSuccessful()) {
                    int codeHttp = resp.code();
                    if (shouldRetry(codeHttp) && attempts < maxAttempts) {
                        sleepBackoff(resp.headers(), attempts);
                        continue;
                    }
                    throw new SynthesisException("OpenAI error " + codeHttp + ": " + safeTrim(body));
                }
                JsonNode root = om.readTree(body);
                String content = root.path("choices").path(0).path("message").path("content").asText("").trim();
                if (content.isEmpty()) throw new SynthesisException("Empty content in response");
                return content;
            } catch (IOException ioe) {
                if (attempts < maxAttempts) {
                    sleepBackoff(null, attempts);
                    continue;
                }
                throw new SynthesisException("OpenAI IO error: " + ioe.getMessage(), ioe);
            }
        }
    }

    /* ===== helpers ===== */

    static boolean shouldRetry(int code) {
        return code == 408 || code == 429 || code >= 500;
    }

    private static void sleepBackoff(Headers headers, int attempts) {
        long delayMs = -1;
        if (headers != null) {
            String ra = headers.get("Retry-After");
            if (ra != null) {
                try {
                    delayMs = (long) (Double.parseDouble(ra) * 1000L);
                } catch (NumberFormatException ignored) {
                    // HTTP-date form, fall through to exponential backoff
                }
            }
        }
        if (delayMs < 0) {
            delayMs = (long) (500L * Math.pow(2, attempts - 1) + new Random().nextInt(250));
            delayMs = Math.min(delayMs, 10_000L);
        }
        try { Thread.sleep(delayMs); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }

    private static String envOr(String key, String def) {
        String v = System.getenv(key);
        return (v == null || v.isBlank()) ? def : v;
    }

    private static String stripTrailingSlash(String u) {
        return u.endsWith("/") ? u.substring(0, u.length() - 1) : u;
    }

    private static String safeTrim(String s) {
        s = s == null ? "" : s.replaceAll("\\s+", " ");
        return s.length() > 300 ? s.substring(0, 300) + "..." : s;
    }
}
