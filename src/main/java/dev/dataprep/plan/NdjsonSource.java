package dev.dataprep.plan;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy newline-delimited JSON scan. Columns are the union of keys over the first
 * {@value #SCHEMA_SAMPLE_ROWS} records; keys that first appear later are dropped.
 */
final class NdjsonSource {

    static final int SCHEMA_SAMPLE_ROWS = 100;

    private static final ObjectReader READER = new ObjectMapper().readerFor(Map.class);

    private NdjsonSource() {}

    static LazyPlan scan(Path path) throws IOException {
        var keys = new LinkedHashSet<String>();
        try (MappingIterator<Map<String, Object>> it = open(path)) {
            for (int i = 0; i < SCHEMA_SAMPLE_ROWS && it.hasNextValue(); i++) {
                keys.addAll(it.nextValue().keySet());
            }
        }
        List<String> columns = List.copyOf(keys);
        return LazyPlan.deferred(columns, () -> rows(path, columns));
    }

    private static Stream<Map<String, Object>> rows(Path path, List<String> columns) {
        MappingIterator<Map<String, Object>> it;
        try {
            it = open(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
        var spliterator = Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false)
            .map(r -> LazyPlan.conform(columns, r))
            .onClose(() -> {
                try {
                    it.close();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
    }

    private static MappingIterator<Map<String, Object>> open(Path path) throws IOException {
        return READER.readValues(Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }
}
