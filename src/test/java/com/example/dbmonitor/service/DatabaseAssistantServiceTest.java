package com.example.dbmonitor.service;

import com.example.dbmonitor.cache.ContextCacheService;
import com.example.dbmonitor.cache.DatabaseContext;
import com.example.dbmonitor.exception.TextGenerationException;
import com.example.dbmonitor.llm.TextGenerationClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DatabaseAssistantServiceTest {

    private static final String NARRATIVE = "\n\n=== DATABASE CONTEXT ===\nTable: orders (10 rows)\n=== END DATABASE CONTEXT ===\n\n";

    private TextGenerationClient textGenerationClient;
    private DatabaseAssistantService assistantService;

    @BeforeEach
    void setUp() {
        ContextCacheService cacheService = mock(ContextCacheService.class);
        when(cacheService.getOrBuild("t1"))
                .thenReturn(new DatabaseContext("t1", List.of(), List.of(), NARRATIVE, Instant.now()));
        textGenerationClient = mock(TextGenerationClient.class);
        assistantService = new DatabaseAssistantService(cacheService, textGenerationClient);
    }

    @Test
    void promptIsContextThenQuestion() {
        assertEquals(NARRATIVE + "Why is orders slow?", assistantService.buildPrompt("t1", "Why is orders slow?"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void streamsChunksThenDone() {
        doAnswer(inv -> {
            Consumer<String> onChunk = inv.getArgument(2);
            onChunk.accept("Add an ");
            onChunk.accept("index.");
            return null;
        }).when(textGenerationClient).stream(anyString(), eq(NARRATIVE + "Why?"), any(Consumer.class));
        RecordingEmitter emitter = new RecordingEmitter();

        assistantService.streamAnswer("t1", "Why?", emitter);

        assertEquals(List.of("message", "message", "done"), emitter.eventNames());
        assertTrue(emitter.rendered().contains("Add an "));
        assertTrue(emitter.completed);
    }

    @Test
    @SuppressWarnings("unchecked")
    void generationFailureSendsErrorEvent() {
        doThrow(new TextGenerationException("LLM API answered 500"))
                .when(textGenerationClient).stream(anyString(), anyString(), any(Consumer.class));
        RecordingEmitter emitter = new RecordingEmitter();

        assistantService.streamAnswer("t1", "Why?", emitter);

        assertEquals(List.of("error"), emitter.eventNames());
        assertTrue(emitter.rendered().contains("LLM API answered 500"));
        assertTrue(emitter.completed);
    }

    /** Captures events instead of writing them to a response. */
    private static class RecordingEmitter extends SseEmitter {

        private final List<Set<ResponseBodyEmitter.DataWithMediaType>> events = new ArrayList<>();
        private boolean completed;

        @Override
        public void send(SseEventBuilder builder) throws IOException {
            events.add(builder.build());
        }

        @Override
        public synchronized void complete() {
            completed = true;
        }

        List<String> eventNames() {
            return events.stream()
                    .map(parts -> parts.stream().map(p -> String.valueOf(p.getData())).collect(Collectors.joining()))
                    .map(text -> text.substring(text.indexOf("event:") + 6, text.indexOf('\n', text.indexOf("event:"))))
                    .toList();
        }

        String rendered() {
            return events.stream()
                    .flatMap(Set::stream)
                    .map(p -> String.valueOf(p.getData()))
                    .collect(Collectors.joining());
        }
    }
}
