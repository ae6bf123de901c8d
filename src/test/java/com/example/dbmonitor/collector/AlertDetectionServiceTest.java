package com.example.dbmonitor.collector;

import com.example.dbmonitor.PipelineTestSupport;
import com.example.dbmonitor.domain.CriticalQueryEvent;
import com.example.dbmonitor.domain.MonitoredTarget;
import com.example.dbmonitor.domain.QueryRecord;
import com.example.dbmonitor.domain.TargetInfo;
import com.example.dbmonitor.exception.NotificationException;
import com.example.dbmonitor.query.QueryIdentity;
import com.example.dbmonitor.service.QueryAlertService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class AlertDetectionServiceTest extends PipelineTestSupport {

    private static final String WATCHED = "SELECT * FROM orders WHERE status = $1";

    @Autowired
    private AlertDetectionService detectionService;

    @Autowired
    private QueryAlertService alertService;

    @Test
    void slowWatchedQueryRaisesOneEventAndOneNotification() {
        MonitoredTarget target = saveTarget("shop");
        QueryRecord watched = watch(target, WATCHED);
        when(statsPoller.poll(any(), anyInt())).thenReturn(List.of(
                row("SELECT *\n  FROM orders\n WHERE status = $1", 30, 600.0),
                row("SELECT * FROM unwatched_table", 30, 9000.0)));

        List<AlertDetectionService.AlertPollResult> results = detectionService.detectAll();

        assertEquals(1, results.size());
        assertEquals(1, results.get(0).matched());
        assertEquals(1, results.get(0).criticalEvents());
        assertTrue(results.get(0).notified());

        List<CriticalQueryEvent> events = eventRepository.findAll();
        assertEquals(1, events.size());
        assertEquals(watched.getId(), events.get(0).getQueryRecordId());
        assertEquals(1, events.get(0).getRank());
        assertEquals(600.0, events.get(0).getMeanTimeMs());
        assertEquals(500.0, events.get(0).getThresholdMs());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<CriticalQueryEvent>> batch = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<TargetInfo> info = ArgumentCaptor.forClass(TargetInfo.class);
        verify(notificationDispatcher, times(1)).send(batch.capture(), info.capture());
        assertEquals(1, batch.getValue().size());
        assertEquals("shop", info.getValue().databaseName());

        assertEquals(600.0, queryRecordRepository.findById(watched.getId()).orElseThrow().getMeanTimeMs());
    }

    @Test
    void queryBelowThresholdOnlyRefreshesMetrics() {
        MonitoredTarget target = saveTarget("shop");
        QueryRecord watched = watch(target, WATCHED);
        when(statsPoller.poll(any(), anyInt())).thenReturn(List.of(row(WATCHED, 7, 499.0)));

        AlertDetectionService.AlertPollResult result = detectionService.detectAll().get(0);

        assertEquals(1, result.matched());
        assertEquals(0, result.criticalEvents());
        assertFalse(result.notified());
        assertEquals(0, eventRepository.count());
        verify(notificationDispatcher, never()).send(anyList(), any());
        QueryRecord refreshed = queryRecordRepository.findById(watched.getId()).orElseThrow();
        assertEquals(7, refreshed.getCalls());
        assertNotNull(refreshed.getCollectedAt());
    }

    @Test
    void noRowsMeansNoNotification() {
        watch(saveTarget("shop"), WATCHED);
        when(statsPoller.poll(any(), anyInt())).thenReturn(List.of());

        AlertDetectionService.AlertPollResult result = detectionService.detectAll().get(0);

        assertEquals(0, result.matched());
        verify(notificationDispatcher, never()).send(anyList(), any());
    }

    @Test
    void unwatchedQueriesAreNeverPolled() {
        MonitoredTarget target = saveTarget("shop");
        queryRecordRepository.save(QueryRecord.builder()
                .targetId(target.getId())
                .queryText(WATCHED)
                .queryHash(QueryIdentity.of(WATCHED).hash())
                .alertsEnabled(false)
                .meanTimeMs(9000)
                .build());

        assertTrue(detectionService.detectAll().isEmpty());
        verify(statsPoller, never()).poll(any(), anyInt());
        assertEquals(0, eventRepository.count());
    }

    @Test
    void failedDispatchKeepsEvents() {
        MonitoredTarget target = saveTarget("shop");
        watch(target, WATCHED);
        when(statsPoller.poll(any(), anyInt())).thenReturn(List.of(row(WATCHED, 3, 1500.0)));
        doThrow(new NotificationException("webhook down", null)).when(notificationDispatcher).send(anyList(), any());

        AlertDetectionService.AlertPollResult result = detectionService.detectAll().get(0);

        assertEquals(1, result.criticalEvents());
        assertFalse(result.notified());
        assertEquals(1, eventRepository.count());
    }

    @Test
    void eachBreachingPollIsAnotherEvent() {
        MonitoredTarget target = saveTarget("shop");
        watch(target, WATCHED);
        when(statsPoller.poll(any(), anyInt())).thenReturn(List.of(row(WATCHED, 3, 800.0)));

        detectionService.detectAll();
        detectionService.detectAll();

        assertEquals(2, eventRepository.count());
        verify(notificationDispatcher, times(2)).send(anyList(), any());
    }

    @Test
    void optOutDuringPollSticksAndRecordsNoEvent() {
        MonitoredTarget target = saveTarget("shop");
        QueryRecord watched = alertService.enableAlerts(target.getId(), "SELECT * FROM orders");
        when(statsPoller.poll(any(), anyInt())).thenAnswer(invocation -> {
            alertService.disableAlerts(target.getId(), watched.getId());
            return List.of(row("SELECT * FROM orders", 12, 600.0));
        });

        AlertDetectionService.AlertPollResult result = detectionService.detectAll().get(0);

        QueryRecord stored = queryRecordRepository.findById(watched.getId()).orElseThrow();
        assertFalse(stored.isAlertsEnabled());
        assertEquals(600.0, stored.getMeanTimeMs());
        assertEquals(0, result.criticalEvents());
        assertEquals(0, eventRepository.count());
        verify(notificationDispatcher, never()).send(anyList(), any());
    }

    private QueryRecord watch(MonitoredTarget target, String query) {
        return queryRecordRepository.save(QueryRecord.builder()
                .targetId(target.getId())
                .queryText(query)
                .queryHash(QueryIdentity.of(query).hash())
                .alertsEnabled(true)
                .createdAt(Instant.now())
                .build());
    }
}
