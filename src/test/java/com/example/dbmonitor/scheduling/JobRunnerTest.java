package com.example.dbmonitor.scheduling;

import com.example.dbmonitor.config.MonitorProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobRunnerTest {

    private MonitorProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private JobRunner jobRunner;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        properties = new MonitorProperties();
        meterRegistry = new SimpleMeterRegistry();
        jobRunner = new JobRunner(properties, meterRegistry);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void completedRunIsRecorded() {
        assertEquals(JobRunner.RunOutcome.COMPLETED, jobRunner.run(PipelineJob.QUERY_COLLECTION, () -> { }));

        JobRunner.JobStatus status = jobRunner.statuses().get(0);
        assertEquals(PipelineJob.QUERY_COLLECTION, status.job());
        assertEquals(JobRunner.RunOutcome.COMPLETED, status.lastOutcome());
        assertNotNull(status.lastFinishedAt());
        assertFalse(status.running());
    }

    @Test
    void failingBodyIsContained() {
        JobRunner.RunOutcome outcome = jobRunner.run(PipelineJob.ALERT_DETECTION, () -> {
            throw new IllegalStateException("boom");
        });

        assertEquals(JobRunner.RunOutcome.FAILED, outcome);
        assertNotNull(meterRegistry.find("dbmonitor.job.duration")
                .tag("job", "alert-detection")
                .tag("outcome", "failed")
                .timer());
        assertFalse(jobRunner.isRunning(PipelineJob.ALERT_DETECTION));
        // the next firing is unaffected
        assertEquals(JobRunner.RunOutcome.COMPLETED, jobRunner.run(PipelineJob.ALERT_DETECTION, () -> { }));
    }

    @Test
    void skipPolicyDropsOverlappingFiring() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<JobRunner.RunOutcome> first = executor.submit(() -> jobRunner.run(PipelineJob.SCHEMA_SNAPSHOT, () -> {
            started.countDown();
            await(release);
        }));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(jobRunner.isRunning(PipelineJob.SCHEMA_SNAPSHOT));

        assertEquals(JobRunner.RunOutcome.SKIPPED, jobRunner.run(PipelineJob.SCHEMA_SNAPSHOT, () -> fail("overlapped")));
        assertEquals(1.0, meterRegistry.counter("dbmonitor.job.skipped", "job", "schema-snapshot").count());

        release.countDown();
        assertEquals(JobRunner.RunOutcome.COMPLETED, first.get(5, TimeUnit.SECONDS));
    }

    @Test
    void queuePolicyWaitsForPreviousRun() throws Exception {
        properties.getJob(PipelineJob.SUGGESTION_SYNTHESIS).setOverlapPolicy(OverlapPolicy.QUEUE);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<JobRunner.RunOutcome> first = executor.submit(() -> jobRunner.run(PipelineJob.SUGGESTION_SYNTHESIS, () -> {
            started.countDown();
            await(release);
        }));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        ExecutorService second = Executors.newSingleThreadExecutor();
        try {
            CountDownLatch secondRan = new CountDownLatch(1);
            Future<JobRunner.RunOutcome> queued = second.submit(
                    () -> jobRunner.run(PipelineJob.SUGGESTION_SYNTHESIS, secondRan::countDown));

            assertFalse(secondRan.await(200, TimeUnit.MILLISECONDS));
            release.countDown();
            assertEquals(JobRunner.RunOutcome.COMPLETED, first.get(5, TimeUnit.SECONDS));
            assertEquals(JobRunner.RunOutcome.COMPLETED, queued.get(5, TimeUnit.SECONDS));
        } finally {
            second.shutdownNow();
        }
    }

    @Test
    void concurrentPolicyRunsAlongside() throws Exception {
        properties.getJob(PipelineJob.QUERY_COLLECTION).setOverlapPolicy(OverlapPolicy.CONCURRENT);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<JobRunner.RunOutcome> first = executor.submit(() -> jobRunner.run(PipelineJob.QUERY_COLLECTION, () -> {
            started.countDown();
            await(release);
        }));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertEquals(JobRunner.RunOutcome.COMPLETED, jobRunner.run(PipelineJob.QUERY_COLLECTION, () -> { }));

        release.countDown();
        assertEquals(JobRunner.RunOutcome.COMPLETED, first.get(5, TimeUnit.SECONDS));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
