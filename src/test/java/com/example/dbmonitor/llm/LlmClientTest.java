package com.example.dbmonitor.llm;

import com.example.dbmonitor.config.AppConfig;
import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.exception.TextGenerationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LlmClientTest {

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();
    private MockWebServer server;
    private MonitorProperties properties;
    private LlmClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        properties = new MonitorProperties();
        properties.getLlm().setApiKey("test-key");
        properties.getLlm().setBaseUrl(server.url("/v1/").toString());
        client = new LlmClient(properties, objectMapper, new OkHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void geminiGenerateJoinsCandidateParts() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"candidates": [{"content": {"parts": [{"text": "Add an "}, {"text": "index."}]}}]}
                """));

        assertEquals("Add an index.", client.generate("system", "prompt"));

        RecordedRequest request = server.takeRequest();
        assertEquals("/v1/models/gemini-2.5-pro:generateContent", request.getPath());
        assertEquals("test-key", request.getHeader("x-goog-api-key"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("system", body.at("/systemInstruction/parts/0/text").asText());
        assertEquals("prompt", body.at("/contents/0/parts/0/text").asText());
        assertEquals(4096, body.at("/generationConfig/maxOutputTokens").asInt());
    }

    @Test
    void openAiGenerateReadsFirstChoice() throws Exception {
        properties.getLlm().setProvider("openai");
        properties.getLlm().setModel("gpt-4o-mini");
        server.enqueue(new MockResponse().setBody("""
                {"choices": [{"message": {"role": "assistant", "content": "Vacuum the table."}}]}
                """));

        assertEquals("Vacuum the table.", client.generate("system", "prompt"));

        RecordedRequest request = server.takeRequest();
        assertEquals("/v1/chat/completions", request.getPath());
        assertEquals("Bearer test-key", request.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("gpt-4o-mini", body.get("model").asText());
        assertEquals("system", body.at("/messages/0/role").asText());
        assertEquals("user", body.at("/messages/1/role").asText());
        assertFalse(body.has("stream"));
    }

    @Test
    void openAiStreamDeliversDeltasUntilDone() throws Exception {
        properties.getLlm().setProvider("openai");
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/event-stream")
                .setBody("""
                        data: {"choices": [{"delta": {"role": "assistant"}}]}

                        data: {"choices": [{"delta": {"content": "Create "}}]}

                        data: {"choices": [{"delta": {"content": "an index"}}]}

                        data: [DONE]

                        """));

        List<String> chunks = new ArrayList<>();
        client.stream("system", "prompt", chunks::add);

        assertEquals(List.of("Create ", "an index"), chunks);
        JsonNode body = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertTrue(body.get("stream").asBoolean());
    }

    @Test
    void geminiStreamUsesSseEndpoint() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                data: {"candidates": [{"content": {"parts": [{"text": "Hello"}]}}]}

                data: {"candidates": [{"content": {"parts": [{"text": " world"}]}}]}

                """));

        List<String> chunks = new ArrayList<>();
        client.stream("system", "prompt", chunks::add);

        assertEquals(List.of("Hello", " world"), chunks);
        assertEquals("/v1/models/gemini-2.5-pro:streamGenerateContent?alt=sse", server.takeRequest().getPath());
    }

    @Test
    void errorStatusBecomesTextGenerationException() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\": \"rate limited\"}"));

        TextGenerationException e = assertThrows(TextGenerationException.class,
                () -> client.generate("system", "prompt"));
        assertTrue(e.getMessage().contains("429"));
    }

    @Test
    void openAiWithoutChoicesFails() {
        properties.getLlm().setProvider("openai");
        server.enqueue(new MockResponse().setBody("{\"choices\": []}"));

        assertThrows(TextGenerationException.class, () -> client.generate("system", "prompt"));
    }
}
