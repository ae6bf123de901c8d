package com.example.dbmonitor;

import com.example.dbmonitor.cache.ContextCacheStore;
import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.scheduling.JobRunner;
import com.example.dbmonitor.scheduling.OverlapPolicy;
import com.example.dbmonitor.scheduling.PipelineJob;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.junit.jupiter.api.Assertions.*;

class DbMonitorApplicationTests extends PipelineTestSupport {

    @Autowired
    private MonitorProperties properties;

    @Autowired
    private ContextCacheStore cacheStore;

    @Autowired
    private JobRunner jobRunner;

    @Test
    void contextLoads() {
        assertNotNull(properties);
        assertNotNull(cacheStore);
        assertNotNull(jobRunner);
    }

    @Test
    void inMemoryCacheWithoutRedis() {
        assertEquals("memory", cacheStore.type());
    }

    @Test
    void configurationIsLoaded() {
        assertEquals(500, properties.getAlerts().getCriticalThresholdMs());
        assertEquals(120000, properties.getJob(PipelineJob.ALERT_DETECTION).getIntervalMs());
        assertEquals(OverlapPolicy.SKIP, properties.getJob(PipelineJob.QUERY_COLLECTION).getOverlapPolicy());
        assertEquals(3600000, properties.getJob(PipelineJob.SCHEMA_SNAPSHOT).getInitialDelayMs());
    }

    @Test
    void everyJobReportsStatus() {
        assertEquals(PipelineJob.values().length, jobRunner.statuses().size());
    }
}
