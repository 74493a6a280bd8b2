package dev.dataprep.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.dataprep.plan.LazyPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes one JSON object per line.
 */
public final class NdjsonSink implements SinkWriter<NdjsonSink.Params> {

    private static final Logger log = LoggerFactory.getLogger(NdjsonSink.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public record Params(String path) {
        public Params {
            if (path == null || path.isBlank()) {
                throw new IllegalArgumentException("path must not be blank");
            }
        }
    }

    @Override
    public WriteResult write(LazyPlan plan, Params params) {
        Path target = Path.of(params.path());
        try {
            Sinks.createParents(target);
            try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                 var stream = plan.stream()) {
                stream.forEach(row -> {
                    try {
                        out.write(MAPPER.writeValueAsString(row));
                        out.write('\n');
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
            }
            long size = Files.size(target);
            log.debug("Wrote {} bytes of NDJSON to {}", size, target);
            return WriteResult.ok(size);
        } catch (IOException | UncheckedIOException e) {
            return WriteResult.failed("Failed to write %s: %s".formatted(target, Sinks.message(e)));
        }
    }
}
