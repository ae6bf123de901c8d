package com.example.dbmonitor.controller;

import com.example.dbmonitor.scheduling.JobRunner;
import com.example.dbmonitor.scheduling.PipelineJob;
import com.example.dbmonitor.scheduling.PipelineScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Manual "run now" triggers for the pipeline jobs, for operational testing.
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private final PipelineScheduler scheduler;
    private final JobRunner jobRunner;

    @GetMapping
    public ResponseEntity<List<JobRunner.JobStatus>> statuses() {
        return ResponseEntity.ok(jobRunner.statuses());
    }

    /**
     * Run one job synchronously; {@code job} is e.g. {@code query-collection}.
     */
    @PostMapping("/{job}/run")
    public ResponseEntity<Map<String, Object>> run(@PathVariable String job) {
        PipelineJob pipelineJob = PipelineJob.fromKey(job);
        JobRunner.RunOutcome outcome = scheduler.run(pipelineJob);
        return ResponseEntity.ok(Map.of("job", pipelineJob.key(), "outcome", outcome));
    }

    @PostMapping("/run-all")
    public ResponseEntity<Map<PipelineJob, JobRunner.RunOutcome>> runAll() {
        return ResponseEntity.ok(scheduler.runAll());
    }
}
