package com.example.dbmonitor.service;

import com.example.dbmonitor.cache.ContextCacheService;
import com.example.dbmonitor.cache.DatabaseContext;
import com.example.dbmonitor.llm.TextGenerationClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Answers operator questions about a target, grounded in its cached database context.
 * The answer is streamed to the client as server-sent events.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseAssistantService {

    static final String SYSTEM_PROMPT = """
            You are a PostgreSQL performance assistant. Answer the operator's question using the
            database context that precedes it: recent query statistics and table structures.
            Prefer concrete SQL (indexes, rewritten queries, configuration settings) over general advice.
            If the context does not contain what is needed to answer, say so.
            """;

    private final ContextCacheService cacheService;
    private final TextGenerationClient textGenerationClient;

    /**
     * Builds the prompt for a question: the target's context narrative followed by the question.
     */
    public String buildPrompt(String targetId, String question) {
        DatabaseContext context = cacheService.getOrBuild(targetId);
        return context.narrative() + question;
    }

    /**
     * Streams {@code message} events of the form {@code {"text": ...}}, then one
     * {@code done} event, or an {@code error} event when generation fails.
     */
    @Async("assistantExecutor")
    public void streamAnswer(String targetId, String question, SseEmitter emitter) {
        try {
            String prompt = buildPrompt(targetId, question);
            textGenerationClient.stream(SYSTEM_PROMPT, prompt, chunk -> send(emitter, "message", Map.of("text", chunk)));
            send(emitter, "done", Map.of());
            emitter.complete();
        } catch (UncheckedIOException e) {
            log.info("Assistant client for target {} disconnected: {}", targetId, e.getMessage());
            emitter.completeWithError(e.getCause());
        } catch (Exception e) {
            log.error("Assistant answer failed for target {}: {}", targetId, e.getMessage());
            try {
                emitter.send(SseEmitter.event().name("error").data(Map.of("message", String.valueOf(e.getMessage()))));
                emitter.complete();
            } catch (IOException sendFailure) {
                emitter.completeWithError(sendFailure);
            }
        }
    }

    private static void send(SseEmitter emitter, String event, Object data) {
        try {
            emitter.send(SseEmitter.event().name(event).data(data));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
