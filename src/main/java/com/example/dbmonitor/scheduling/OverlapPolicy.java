package com.example.dbmonitor.scheduling;

/**
 * What happens when a job fires while a previous run of the same job is still in progress.
 */
public enum OverlapPolicy {
    /** Drop the new firing. */
    SKIP,
    /** Wait for the running instance to finish, then run. */
    QUEUE,
    /** Run alongside the running instance. */
    CONCURRENT
}
