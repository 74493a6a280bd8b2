package dev.dataprep.error;

/**
 * Base type for engine errors. Configuration errors are raised synchronously to the caller;
 * errors inside an export worker end up in the job's error message instead.
 */
public class DataPrepException extends RuntimeException {

    public DataPrepException(String message) {
        super(message);
    }

    public DataPrepException(String message, Throwable cause) {
        super(message, cause);
    }
}
