package dev.dataprep.jobs;

import dev.dataprep.model.JobInfo;
import dev.dataprep.model.JobStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Mutable state of one export job. Written by its worker, read by anyone through
 * {@link #snapshot()}.
 */
final class Job {
    private final String jobId;
    private final String output;
    private final Instant startedAt;
    private final Clock clock;
    private volatile JobStatus status;
    private volatile Duration duration;
    private volatile String sizeSummary;
    private volatile String errorMessage;

    Job(String jobId, String output, Clock clock) {
        this.jobId = jobId;
        this.output = output;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.status = JobStatus.RUNNING;
    }

    String jobId() { return jobId; }
    JobStatus status() { return status; }

    synchronized void markCompleted(String sizeSummary) {
        requireRunning();
        this.sizeSummary = sizeSummary;
        this.duration = elapsed();
        this.status = JobStatus.COMPLETED;
    }

    synchronized void markFailed(String errorMessage) {
        requireRunning();
        this.errorMessage = errorMessage;
        this.duration = elapsed();
        this.status = JobStatus.FAILED;
    }

    synchronized JobInfo snapshot() {
        return new JobInfo(jobId, status, startedAt, duration, output, sizeSummary, errorMessage);
    }

    private Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    private void requireRunning() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job %s is already %s".formatted(jobId, status));
        }
    }
}
