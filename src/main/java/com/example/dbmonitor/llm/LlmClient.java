package com.example.dbmonitor.llm;

import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.exception.TextGenerationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import okio.BufferedSource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * LLM client for the Gemini API and OpenAI-compatible chat completion endpoints.
 * Both the blocking and the streaming (server-sent events) variants are supported.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmClient implements TextGenerationClient {

    private static final String GEMINI_API_URL = "https://generativelanguage.googleapis.com/v1beta";
    private static final String OPENAI_API_URL = "https://api.openai.com/v1";
    private static final MediaType JSON = MediaType.get("application/json");

    private final MonitorProperties properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;

    @Override
    public String generate(String systemInstruction, String userPrompt) {
        Request request = buildRequest(systemInstruction, userPrompt, false);
        log.debug("LLM request to {} ({} prompt chars)", request.url().encodedPath(), userPrompt.length());

        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                log.error("LLM API error: {} - {}", response.code(), body);
                throw new TextGenerationException("LLM API answered " + response.code());
            }
            return isGemini() ? geminiText(objectMapper.readTree(body)) : openAiText(objectMapper.readTree(body));
        } catch (IOException e) {
            throw new TextGenerationException("Failed to communicate with LLM: " + e.getMessage(), e);
        }
    }

    @Override
    public void stream(String systemInstruction, String userPrompt, Consumer<String> onChunk) {
        Request request = buildRequest(systemInstruction, userPrompt, true);

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                String body = response.body() != null ? response.body().string() : "";
                log.error("LLM streaming API error: {} - {}", response.code(), body);
                throw new TextGenerationException("LLM API answered " + response.code());
            }
            if (response.body() == null) {
                return;
            }

            BufferedSource source = response.body().source();
            while (!source.exhausted()) {
                String line = source.readUtf8Line();
                if (line == null || !line.startsWith("data:")) {
                    continue;
                }
                String data = line.substring("data:".length()).trim();
                if (data.isEmpty()) {
                    continue;
                }
                if ("[DONE]".equals(data)) {
                    break;
                }
                JsonNode event = objectMapper.readTree(data);
                String text = isGemini() ? geminiText(event) : openAiDelta(event);
                if (!text.isEmpty()) {
                    onChunk.accept(text);
                }
            }
        } catch (IOException e) {
            throw new TextGenerationException("LLM stream failed: " + e.getMessage(), e);
        }
    }

    private boolean isGemini() {
        return "gemini".equalsIgnoreCase(properties.getLlm().getProvider());
    }

    private Request buildRequest(String systemInstruction, String userPrompt, boolean stream) {
        MonitorProperties.LlmConfig llm = properties.getLlm();
        String body;
        try {
            body = objectMapper.writeValueAsString(isGemini()
                    ? geminiBody(systemInstruction, userPrompt)
                    : openAiBody(systemInstruction, userPrompt, stream));
        } catch (IOException e) {
            throw new TextGenerationException("Failed to build LLM request: " + e.getMessage(), e);
        }

        Request.Builder builder = new Request.Builder()
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(body, JSON));

        if (isGemini()) {
            String method = stream ? ":streamGenerateContent?alt=sse" : ":generateContent";
            builder.url(baseUrl(GEMINI_API_URL) + "/models/" + llm.getModel() + method)
                    .addHeader("x-goog-api-key", llm.getApiKey());
        } else {
            builder.url(baseUrl(OPENAI_API_URL) + "/chat/completions")
                    .addHeader("Authorization", "Bearer " + llm.getApiKey());
        }
        return builder.build();
    }

    private String baseUrl(String defaultUrl) {
        String configured = properties.getLlm().getBaseUrl();
        String url = configured == null || configured.isBlank() ? defaultUrl : configured.trim();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private ObjectNode geminiBody(String systemInstruction, String userPrompt) {
        ObjectNode root = objectMapper.createObjectNode();
        if (systemInstruction != null && !systemInstruction.isEmpty()) {
            root.putObject("systemInstruction").putArray("parts").addObject().put("text", systemInstruction);
        }
        ObjectNode content = root.putArray("contents").addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", userPrompt);

        ObjectNode generationConfig = root.putObject("generationConfig");
        generationConfig.put("temperature", properties.getLlm().getTemperature());
        generationConfig.put("maxOutputTokens", properties.getLlm().getMaxTokens());
        return root;
    }

    private ObjectNode openAiBody(String systemInstruction, String userPrompt, boolean stream) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", properties.getLlm().getModel());
        root.put("temperature", properties.getLlm().getTemperature());
        root.put("max_tokens", properties.getLlm().getMaxTokens());
        if (stream) {
            root.put("stream", true);
        }

        ArrayNode messages = root.putArray("messages");
        if (systemInstruction != null && !systemInstruction.isEmpty()) {
            messages.addObject().put("role", "system").put("content", systemInstruction);
        }
        messages.addObject().put("role", "user").put("content", userPrompt);
        return root;
    }

    /** Concatenated text parts of the first candidate. */
    private String geminiText(JsonNode root) {
        JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }

    private String openAiText(JsonNode root) {
        JsonNode choices = root.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new TextGenerationException("No response from LLM");
        }
        JsonNode content = choices.get(0).path("message").path("content");
        return content.isNull() || content.isMissingNode() ? "" : content.asText();
    }

    private String openAiDelta(JsonNode event) {
        JsonNode content = event.path("choices").path(0).path("delta").path("content");
        return content.isNull() || content.isMissingNode() ? "" : content.asText();
    }
}
