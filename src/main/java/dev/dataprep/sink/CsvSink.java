package dev.dataprep.sink;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
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
 * Writes rows as UTF-8 CSV in column order. Nulls become empty fields.
 */
public final class CsvSink implements SinkWriter<CsvSink.Params> {

    private static final Logger log = LoggerFactory.getLogger(CsvSink.class);
    private static final CsvMapper MAPPER = new CsvMapper();

    /**
     * @param path      destination file
     * @param delimiter single character, or "\t"/"tab" for tab; defaults to ","
     * @param header    write a header row; defaults to true
     */
    public record Params(String path, String delimiter, Boolean header) {
        public Params {
            if (path == null || path.isBlank()) {
                throw new IllegalArgumentException("path must not be blank");
            }
            if (delimiter == null) {
                delimiter = ",";
            } else if (delimiter.equals("\\t") || delimiter.equalsIgnoreCase("tab")) {
                delimiter = "\t";
            }
            if (delimiter.length() != 1) {
                throw new IllegalArgumentException("delimiter must be a single character, got '" + delimiter + "'");
            }
            header = header == null || header;
        }
    }

    @Override
    public WriteResult write(LazyPlan plan, Params params) {
        Path target = Path.of(params.path());
        var schema = CsvSchema.builder()
            .addColumns(plan.columnNames(), CsvSchema.ColumnType.STRING)
            .setColumnSeparator(params.delimiter().charAt(0))
            .setUseHeader(params.header())
            .build();
        try {
            Sinks.createParents(target);
            try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                 SequenceWriter rows = MAPPER.writer(schema).writeValues(out);
                 var stream = plan.stream()) {
                stream.forEach(row -> {
                    try {
                        rows.write(row);
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
            }
            long size = Files.size(target);
            log.debug("Wrote {} bytes of CSV to {}", size, target);
            return WriteResult.ok(size);
        } catch (IOException | UncheckedIOException e) {
            return WriteResult.failed("Failed to write %s: %s".formatted(target, Sinks.message(e)));
        }
    }
}
