package dev.dataprep.error;

/**
 * Wraps whatever went wrong inside an export worker.
 */
public class JobExecutionException extends DataPrepException {

    private final String jobId;

    public JobExecutionException(String jobId, Throwable cause) {
        super(describe(cause), cause);
        this.jobId = jobId;
    }

    public JobExecutionException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null
            ? cause.getClass().getSimpleName()
            : cause.getClass().getSimpleName() + ": " + message;
    }
}
