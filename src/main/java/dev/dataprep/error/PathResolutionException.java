package dev.dataprep.error;

/**
 * A malformed glob pattern or a directory that could not be read.
 */
public class PathResolutionException extends DataPrepException {

    public PathResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
