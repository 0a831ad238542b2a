package com.initialone.jdocgap.llm;

import com.initialone.jdocgap.lang.Language;
import com.initialone.jdocgap.model.SymbolKind;
import com.initialone.jdocgap.model.SymbolRecord;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/** OpenAI and Ollama clients against a local stand-in server. */
class HttpDocClientTest {

    private HttpServer server;
    private final Deque<int[]> statuses = new ArrayDeque<>();
    private final Deque<String> bodies = new ArrayDeque<>();
    private final List<String> paths = new ArrayList<>();
    private final List<String> requests = new ArrayList<>();

    private static final SymbolRecord SUM =
            new SymbolRecord("calculate_sum", SymbolKind.FUNCTION, Path.of("calc.py"), 1, 0, Language.PYTHON);

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private synchronized void handle(HttpExchange ex) throws IOException {
        paths.add(ex.getRequestURI().getPath());
        requests.add(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        int status = statuses.isEmpty() ? 200 : statuses.poll()[0];
        byte[] out = (bodies.isEmpty() ? "{}" : bodies.poll()).getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json");
        if (status != 200) ex.getResponseHeaders().add("Retry-After", "0");
        ex.sendResponseHeaders(status, out.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(out);
        }
    }

    private String base() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private void reply(int status, String body) {
        statuses.add(new int[]{status});
        bodies.add(body);
    }

    @Test
    void openAiAnswerIsFormattedForTheLanguage() throws Exception {
        reply(200, "{\"choices\":[{\"message\":{\"content\":\"Adds a and b.\"}}]}");
        OpenAiDocClient client = new OpenAiDocClient("sk-test", base() + "/", "gpt-4o-mini", 10, 64, 0.2);

        assertEquals("\"\"\"Adds a and b.\"\"\"", client.synthesize(SUM, Language.PYTHON, "def calculate_sum(a, b): ..."));
        assertEquals(List.of("/v1/chat/completions"), paths);
        assertTrue(requests.get(0).contains("\"max_tokens\":64"), requests.get(0));
    }

    @Test
    void openAiRetriesServerErrors() throws Exception {
        reply(503, "{\"error\":\"busy\"}");
        reply(200, "{\"choices\":[{\"message\":{\"content\":\"Adds.\"}}]}");
        OpenAiDocClient client = new OpenAiDocClient("sk-test", base(), "m", 10, 64, 0.2);

        assertEquals("\"\"\"Adds.\"\"\"", client.synthesize(SUM, Language.PYTHON, ""));
        assertEquals(2, paths.size());
    }

    @Test
    void openAiClientErrorIsNotRetried() {
        reply(400, "{\"error\":\"bad\"}");
        OpenAiDocClient client = new OpenAiDocClient("sk-test", base(), "m", 10, 64, 0.2);

        SynthesisException e = assertThrows(SynthesisException.class, () -> client.synthesize(SUM, Language.PYTHON, ""));
        assertTrue(e.getMessage().contains("400"), e.getMessage());
        assertEquals(1, paths.size());
    }

    @Test
    void emptyAnswerIsAFailure() {
        reply(200, "{\"choices\":[{\"message\":{\"content\":\"   \"}}]}");
        OpenAiDocClient client = new OpenAiDocClient("sk-test", base(), "m", 10, 64, 0.2);
        assertThrows(SynthesisException.class, () -> client.synthesize(SUM, Language.PYTHON, ""));
    }

    @Test
    void missingApiKeyIsRejectedUpFront() {
        assertThrows(IllegalStateException.class, () -> new OpenAiDocClient(" ", base(), "m", 10, 64, 0.2));
    }

    @Test
    void retryPolicy() {
        assertTrue(OpenAiDocClient.shouldRetry(429));
        assertTrue(OpenAiDocClient.shouldRetry(408));
        assertTrue(OpenAiDocClient.shouldRetry(502));
        assertFalse(OpenAiDocClient.shouldRetry(401));
    }

    @Test
    void ollamaChatEndpoint() throws Exception {
        reply(200, "{\"message\":{\"role\":\"assistant\",\"content\":\"Adds two numbers.\"},\"done\":true}");
        LocalDocClient client = new LocalDocClient("ollama", base(), "llama3", 10, 64, 0.2);

        String c = client.synthesize(SUM, Language.JAVASCRIPT, "");
        assertEquals("/**\n * Adds two numbers.\n */", c);
        assertEquals(List.of("/api/chat"), paths);
        assertTrue(requests.get(0).contains("\"stream\":false"), requests.get(0));
    }

    @Test
    void openAiCompatibleLocalServer() throws Exception {
        reply(200, "{\"choices\":[{\"message\":{\"content\":\"Sums.\"}}]}");
        LocalDocClient client = new LocalDocClient("openai", base() + "/v1", "local", 10, 64, 0.2);

        assertEquals("// Sums.", client.synthesize(SUM, Language.GO, ""));
        assertEquals(List.of("/v1/chat/completions"), paths);
    }

    @Test
    void localServerErrorIsAFailure() {
        reply(500, "boom");
        LocalDocClient client = new LocalDocClient("ollama", base(), "llama3", 10, 64, 0.2);
        assertThrows(SynthesisException.class, () -> client.synthesize(SUM, Language.PYTHON, ""));
    }
}
