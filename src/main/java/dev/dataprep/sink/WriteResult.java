package dev.dataprep.sink;

/**
 * Outcome of a sink write.
 */
public record WriteResult(
    boolean success,
    long bytesWritten,
    String error
) {
    public static WriteResult ok(long bytesWritten) {
        return new WriteResult(true, bytesWritten, null);
    }

    public static WriteResult failed(String error) {
        return new WriteResult(false, 0, error);
    }
}
