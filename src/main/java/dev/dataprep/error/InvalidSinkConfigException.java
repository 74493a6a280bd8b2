package dev.dataprep.error;

/**
 * Sink parameters that fail validation. Raised before any export work is scheduled.
 */
public class InvalidSinkConfigException extends DataPrepException {

    public InvalidSinkConfigException(String sinkType, String reason, Throwable cause) {
        super("Invalid export configuration for %s: %s".formatted(sinkType, reason), cause);
    }
}
