package com.example.dbmonitor.controller;

import com.example.dbmonitor.PipelineTestSupport;
import com.example.dbmonitor.domain.MonitoredTarget;
import com.example.dbmonitor.domain.Suggestion;
import com.example.dbmonitor.domain.SuggestionSet;
import com.example.dbmonitor.exception.TargetConnectionException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.hasKey;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class TargetControllerTest extends PipelineTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void registerNeverEchoesPassword() throws Exception {
        when(connectionProvider.open(any())).thenThrow(new TargetConnectionException(null, "refused", null));

        mockMvc.perform(post("/api/targets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"postgres://app:pw@db.internal/shop\", \"ownerId\": \"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.databaseName").value("shop"))
                .andExpect(jsonPath("$.monitoringEnabled").value(false))
                .andExpect(jsonPath("$", not(hasKey("passwordEncrypted"))));
    }

    @Test
    void malformedUrlIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/targets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"mysql://app:pw@db.internal/shop\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void unknownTargetIsNotFound() throws Exception {
        mockMvc.perform(get("/api/targets/missing/queries"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void suggestionsAbsentUntilSynthesized() throws Exception {
        MonitoredTarget target = saveTarget("shop");

        mockMvc.perform(get("/api/targets/{id}/suggestions", target.getId()))
                .andExpect(status().isNotFound());

        suggestionSetRepository.save(SuggestionSet.builder()
                .targetId(target.getId())
                .suggestions(List.of(
                        new Suggestion("A", "a", Suggestion.Priority.HIGH, "indexing"),
                        new Suggestion("B", "b", Suggestion.Priority.MEDIUM, "monitoring"),
                        new Suggestion("C", "c", Suggestion.Priority.LOW, "configuration")))
                .source(SuggestionSet.Source.FALLBACK)
                .build());

        mockMvc.perform(get("/api/targets/{id}/suggestions", target.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.suggestions", hasSize(3)))
                .andExpect(jsonPath("$.suggestions[0].priority").value("high"))
                .andExpect(jsonPath("$.source").value("FALLBACK"));
    }

    @Test
    void watchQueryThroughApi() throws Exception {
        MonitoredTarget target = saveTarget("shop");

        mockMvc.perform(post("/api/targets/{id}/alert-queries", target.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"SELECT * FROM orders\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alertsEnabled").value(true));

        mockMvc.perform(get("/api/targets/{id}/alert-queries", target.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].category").value("Fast Query"));
    }

    @Test
    void jobsCanBeListedAndTriggered() throws Exception {
        mockMvc.perform(get("/api/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(4)));

        mockMvc.perform(post("/api/jobs/query-collection/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job").value("query-collection"))
                .andExpect(jsonPath("$.outcome").value("COMPLETED"));

        mockMvc.perform(post("/api/jobs/backup/run"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void cacheStatusReportsStore() throws Exception {
        mockMvc.perform(get("/api/cache/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("memory"))
                .andExpect(jsonPath("$.available").value(true))
                .andExpect(jsonPath("$.keyPrefix").value("query_context:"));
    }
}
