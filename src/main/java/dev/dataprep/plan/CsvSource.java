package dev.dataprep.plan;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy CSV scan. The header is read up front for the column list; data rows are streamed when
 * the plan is collected. Every value is kept as a string; empty fields are null.
 */
final class CsvSource {

    private static final CsvMapper MAPPER = new CsvMapper();

    private CsvSource() {}

    static LazyPlan scan(Path path, char delimiter) throws IOException {
        List<String> header;
        try (MappingIterator<String[]> it = open(path, delimiter)) {
            header = it.hasNextValue() ? normalizeHeader(it.nextValue()) : List.of();
        }
        return LazyPlan.deferred(header, () -> rows(path, delimiter, header));
    }

    private static Stream<Map<String, Object>> rows(Path path, char delimiter, List<String> header) {
        MappingIterator<String[]> it;
        try {
            it = open(path, delimiter);
            if (it.hasNextValue()) {
                it.nextValue();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
        var spliterator = Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false)
            .map(values -> toRow(header, values))
            .onClose(() -> {
                try {
                    it.close();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
    }

    private static MappingIterator<String[]> open(Path path, char delimiter) throws IOException {
        ObjectReader reader = MAPPER.readerFor(String[].class)
            .with(CsvSchema.emptySchema().withColumnSeparator(delimiter))
            .with(CsvParser.Feature.WRAP_AS_ARRAY);
        return reader.readValues(Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    private static Map<String, Object> toRow(List<String> header, String[] values) {
        var row = new LinkedHashMap<String, Object>();
        for (int i = 0; i < header.size(); i++) {
            String v = i < values.length ? values[i] : null;
            row.put(header.get(i), v == null || v.isEmpty() ? null : v);
        }
        return row;
    }

    // Blank names become column_N, repeated names get their position appended.
    private static List<String> normalizeHeader(String[] raw) {
        var names = new ArrayList<String>(raw.length);
        var seen = new HashSet<String>();
        for (int i = 0; i < raw.length; i++) {
            String name = raw[i] == null ? "" : raw[i].strip();
            if (i == 0 && name.startsWith("\uFEFF")) {
                name = name.substring(1);
            }
            if (name.isEmpty()) {
                name = "column_" + (i + 1);
            }
            if (!seen.add(name)) {
                name = name + "_" + (i + 1);
                seen.add(name);
            }
            names.add(name);
        }
        return names;
    }
}
