package dev.dataprep.error;

/**
 * Thrown when a load request produces no usable source.
 */
public class DatasetLoadException extends DataPrepException {

    public DatasetLoadException(String message) {
        super(message);
    }

    public DatasetLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
