package dev.dataprep.error;

/**
 * The export worker pool and its queue are both full.
 */
public class JobQueueFullException extends DataPrepException {

    public JobQueueFullException(int maxConcurrentJobs, int queueCapacity) {
        super("Export queue is full (%d running, %d queued); retry later"
            .formatted(maxConcurrentJobs, queueCapacity));
    }
}
