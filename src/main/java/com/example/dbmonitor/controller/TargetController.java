package com.example.dbmonitor.controller;

import com.example.dbmonitor.domain.CriticalQueryEvent;
import com.example.dbmonitor.domain.MonitoredTarget;
import com.example.dbmonitor.domain.QueryRecord;
import com.example.dbmonitor.domain.SuggestionSet;
import com.example.dbmonitor.domain.TableSnapshot;
import com.example.dbmonitor.repository.CriticalQueryEventRepository;
import com.example.dbmonitor.repository.QueryRecordRepository;
import com.example.dbmonitor.repository.SuggestionSetRepository;
import com.example.dbmonitor.repository.TableSnapshotRepository;
import com.example.dbmonitor.service.DatabaseAssistantService;
import com.example.dbmonitor.service.QueryAlertService;
import com.example.dbmonitor.service.TargetRegistrationService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * Target registration and read access to everything the pipeline derives per target.
 */
@RestController
@RequestMapping("/api/targets")
@RequiredArgsConstructor
public class TargetController {

    private static final int MAX_QUERIES = 100;
    private static final long ASSISTANT_TIMEOUT_MS = 300_000;

    private final TargetRegistrationService registrationService;
    private final QueryAlertService queryAlertService;
    private final DatabaseAssistantService assistantService;
    private final QueryRecordRepository queryRecordRepository;
    private final TableSnapshotRepository tableSnapshotRepository;
    private final SuggestionSetRepository suggestionSetRepository;
    private final CriticalQueryEventRepository eventRepository;

    /**
     * Register a target from a postgres:// URL or discrete fields, and probe it.
     */
    @PostMapping
    public ResponseEntity<MonitoredTarget> register(
            @RequestBody TargetRegistrationService.RegisterTargetRequest request) {
        return ResponseEntity.ok(registrationService.register(request));
    }

    @GetMapping
    public ResponseEntity<List<MonitoredTarget>> list(@RequestParam(required = false) String ownerId) {
        return ResponseEntity.ok(registrationService.list(ownerId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<MonitoredTarget> get(@PathVariable String id) {
        return ResponseEntity.ok(registrationService.get(id));
    }

    @PostMapping("/{id}/probe")
    public ResponseEntity<MonitoredTarget> probe(@PathVariable String id) {
        return ResponseEntity.ok(registrationService.probe(id));
    }

    /**
     * Query records, most recently collected first.
     */
    @GetMapping("/{id}/queries")
    public ResponseEntity<List<QueryRecord>> queries(@PathVariable String id) {
        registrationService.get(id);
        return ResponseEntity.ok(queryRecordRepository.findByTargetIdOrderByCollectedAtDesc(
                id, PageRequest.of(0, MAX_QUERIES)));
    }

    @GetMapping("/{id}/tables")
    public ResponseEntity<List<TableSnapshot>> tables(@PathVariable String id) {
        registrationService.get(id);
        return ResponseEntity.ok(tableSnapshotRepository.findByTargetIdOrderByTableNameAsc(id));
    }

    @GetMapping("/{id}/suggestions")
    public ResponseEntity<SuggestionSet> suggestions(@PathVariable String id) {
        registrationService.get(id);
        return suggestionSetRepository.findByTargetId(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/critical-events")
    public ResponseEntity<List<CriticalQueryEvent>> criticalEvents(@PathVariable String id,
                                                                   @RequestParam(defaultValue = "50") int limit) {
        registrationService.get(id);
        return ResponseEntity.ok(eventRepository.findByTargetIdOrderByDetectedAtDesc(
                id, PageRequest.of(0, Math.max(1, Math.min(limit, 500)))));
    }

    @PostMapping("/{id}/alert-queries")
    public ResponseEntity<QueryRecord> enableAlerts(@PathVariable String id, @RequestBody Map<String, String> body) {
        return ResponseEntity.ok(queryAlertService.enableAlerts(id, body.get("query")));
    }

    @GetMapping("/{id}/alert-queries")
    public ResponseEntity<List<QueryAlertService.AlertQueryView>> alertQueries(@PathVariable String id) {
        return ResponseEntity.ok(queryAlertService.listAlertQueries(id));
    }

    @DeleteMapping("/{id}/alert-queries/{recordId}")
    public ResponseEntity<QueryRecord> disableAlerts(@PathVariable String id, @PathVariable String recordId) {
        return ResponseEntity.ok(queryAlertService.disableAlerts(id, recordId));
    }

    /**
     * Ask the assistant a question about this target; the answer streams back as server-sent events.
     */
    @PostMapping(value = "/{id}/assistant", produces = "text/event-stream")
    public SseEmitter assistant(@PathVariable String id, @RequestBody Map<String, String> body) {
        String question = body.get("question");
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question is required");
        }
        registrationService.get(id);
        SseEmitter emitter = new SseEmitter(ASSISTANT_TIMEOUT_MS);
        assistantService.streamAnswer(id, question, emitter);
        return emitter;
    }
}
