package com.example.dbmonitor.scheduling;

import com.example.dbmonitor.config.MonitorProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs pipeline job bodies under the job's overlap policy.
 *
 * Every run, scheduled or manual, goes through here. Whatever the body throws
 * is logged and recorded as a failed run, so a broken job never stops its
 * next firing.
 */
@Slf4j
@Component
public class JobRunner {

    private final MonitorProperties properties;
    private final MeterRegistry meterRegistry;

    private final Map<PipelineJob, ReentrantLock> locks = new EnumMap<>(PipelineJob.class);
    private final Map<PipelineJob, AtomicInteger> running = new EnumMap<>(PipelineJob.class);
    private final Map<PipelineJob, JobStatus> lastRuns = new EnumMap<>(PipelineJob.class);

    public JobRunner(MonitorProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        for (PipelineJob job : PipelineJob.values()) {
            // fair, so QUEUE runs in firing order
            locks.put(job, new ReentrantLock(true));
            running.put(job, new AtomicInteger());
        }
    }

    public RunOutcome run(PipelineJob job, Runnable body) {
        OverlapPolicy policy = properties.getJob(job).getOverlapPolicy();
        ReentrantLock lock = locks.get(job);

        switch (policy) {
            case SKIP -> {
                if (!lock.tryLock()) {
                    log.info("Skipping {} firing, previous run still in progress", job.key());
                    Counter.builder("dbmonitor.job.skipped")
                            .tag("job", job.key())
                            .register(meterRegistry)
                            .increment();
                    return RunOutcome.SKIPPED;
                }
            }
            case QUEUE -> lock.lock();
            case CONCURRENT -> { }
        }

        try {
            return execute(job, body);
        } finally {
            if (policy != OverlapPolicy.CONCURRENT) {
                lock.unlock();
            }
        }
    }

    public boolean isRunning(PipelineJob job) {
        return running.get(job).get() > 0;
    }

    public List<JobStatus> statuses() {
        List<JobStatus> result = new ArrayList<>();
        for (PipelineJob job : PipelineJob.values()) {
            JobStatus last;
            synchronized (lastRuns) {
                last = lastRuns.get(job);
            }
            MonitorProperties.JobConfig config = properties.getJob(job);
            result.add(new JobStatus(job, config.getOverlapPolicy(), config.getIntervalMs(), isRunning(job),
                    last != null ? last.lastStartedAt() : null,
                    last != null ? last.lastFinishedAt() : null,
                    last != null ? last.lastOutcome() : null));
        }
        return result;
    }

    private RunOutcome execute(PipelineJob job, Runnable body) {
        Instant startedAt = Instant.now();
        Timer.Sample sample = Timer.start(meterRegistry);
        running.get(job).incrementAndGet();
        RunOutcome outcome;

        log.info("Starting job {}", job.key());
        try {
            body.run();
            outcome = RunOutcome.COMPLETED;
            log.info("Job {} completed", job.key());
        } catch (Exception e) {
            outcome = RunOutcome.FAILED;
            log.error("Job {} failed", job.key(), e);
        } finally {
            running.get(job).decrementAndGet();
        }

        sample.stop(Timer.builder("dbmonitor.job.duration")
                .tag("job", job.key())
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry));

        MonitorProperties.JobConfig config = properties.getJob(job);
        synchronized (lastRuns) {
            lastRuns.put(job, new JobStatus(job, config.getOverlapPolicy(), config.getIntervalMs(), false,
                    startedAt, Instant.now(), outcome));
        }
        return outcome;
    }

    public enum RunOutcome {
        COMPLETED, FAILED, SKIPPED
    }

    public record JobStatus(PipelineJob job, OverlapPolicy overlapPolicy, long intervalMs, boolean running,
                            Instant lastStartedAt, Instant lastFinishedAt, RunOutcome lastOutcome) {}
}
