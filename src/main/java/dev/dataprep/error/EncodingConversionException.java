package dev.dataprep.error;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Re-encoding a source file failed. No partial staged output is left behind when this is thrown.
 */
public class EncodingConversionException extends IOException {

    private final Path source;

    public EncodingConversionException(Path source, String encoding, Throwable cause) {
        super("Failed to convert %s from %s: %s".formatted(source, encoding, cause.getMessage()), cause);
        this.source = source;
    }

    public Path source() {
        return source;
    }
}
