package dev.dataprep.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of an export job.
 */
public record JobInfo(
    String jobId,
    JobStatus status,
    Instant startedAt,
    Duration duration,   // null while running
    String output,
    String sizeSummary,  // null until completed
    String errorMessage  // null unless failed
) {}
