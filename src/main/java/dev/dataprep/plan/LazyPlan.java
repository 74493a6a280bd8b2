package dev.dataprep.plan;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * A deferred row pipeline with a known column list. Every operation returns a new plan; rows are
 * produced only when {@link #stream()} or {@link #collect()} is called, and each call re-runs the
 * pipeline from its sources.
 */
public final class LazyPlan {

    private final List<String> columns;
    private final Supplier<Stream<Map<String, Object>>> rows;

    private LazyPlan(List<String> columns, Supplier<Stream<Map<String, Object>>> rows) {
        this.columns = List.copyOf(columns);
        this.rows = rows;
    }

    /** In-memory plan over the given rows. Missing values become null. */
    public static LazyPlan of(List<String> columns, List<? extends Map<String, ?>> rows) {
        List<Map<String, Object>> conformed = rows.stream().map(r -> conform(columns, r)).toList();
        return new LazyPlan(columns, conformed::stream);
    }

    /**
     * Plan over a row source opened on demand. The stream's close handlers must release whatever
     * the supplier opened.
     */
    public static LazyPlan deferred(List<String> columns, Supplier<Stream<Map<String, Object>>> rows) {
        return new LazyPlan(columns, rows);
    }

    public static LazyPlan scanCsv(Path path, char delimiter) throws IOException {
        return CsvSource.scan(path, delimiter);
    }

    public static LazyPlan scanNdjson(Path path) throws IOException {
        return NdjsonSource.scan(path);
    }

    /**
     * Vertical concatenation that tolerates schema drift: the result has the union of all columns
     * in first-seen order, and rows from plans lacking a column get null there.
     */
    public static LazyPlan concatDiagonal(List<LazyPlan> plans) {
        if (plans.isEmpty()) {
            throw new IllegalArgumentException("Nothing to concatenate");
        }
        if (plans.size() == 1) {
            return plans.get(0);
        }
        var union = new LinkedHashSet<String>();
        plans.forEach(p -> union.addAll(p.columns));
        List<String> cols = List.copyOf(union);
        List<LazyPlan> parts = List.copyOf(plans);
        return new LazyPlan(cols, () -> parts.stream().flatMap(p -> p.stream().map(r -> conform(cols, r))));
    }

    /** Column names, without reading any rows. */
    public List<String> columnNames() {
        return columns;
    }

    public boolean hasColumn(String name) {
        return columns.contains(name);
    }

    public void requireColumns(Collection<String> names) {
        var missing = names.stream().filter(n -> !columns.contains(n)).toList();
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException(
                "Unknown column(s) %s; available: %s".formatted(missing, columns));
        }
    }

    public LazyPlan limit(long n) {
        return new LazyPlan(columns, () -> rows.get().limit(Math.max(0, n)));
    }

    public LazyPlan skip(long n) {
        return new LazyPlan(columns, () -> rows.get().skip(Math.max(0, n)));
    }

    /** Last {@code n} rows. Reads the source twice: once to count, once to stream. */
    public LazyPlan tail(long n) {
        return new LazyPlan(columns, () -> rows.get().skip(Math.max(0, count() - Math.max(0, n))));
    }

    /** All but the last {@code n} rows. Reads the source twice. */
    public LazyPlan dropLast(long n) {
        return new LazyPlan(columns, () -> rows.get().limit(Math.max(0, count() - Math.max(0, n))));
    }

    public LazyPlan filter(Predicate<Map<String, Object>> predicate) {
        return new LazyPlan(columns, () -> rows.get().filter(predicate));
    }

    public LazyPlan sort(Comparator<Map<String, Object>> comparator) {
        return new LazyPlan(columns, () -> rows.get().sorted(comparator));
    }

    public LazyPlan select(List<String> names) {
        requireColumns(names);
        List<String> cols = List.copyOf(names);
        return new LazyPlan(cols, () -> rows.get().map(r -> conform(cols, r)));
    }

    public LazyPlan drop(Collection<String> names) {
        requireColumns(names);
        return select(columns.stream().filter(c -> !names.contains(c)).toList());
    }

    public LazyPlan rename(Map<String, String> mapping) {
        requireColumns(mapping.keySet());
        List<String> cols = columns.stream().map(c -> mapping.getOrDefault(c, c)).toList();
        if (new HashSet<>(cols).size() != cols.size()) {
            throw new IllegalArgumentException("Rename would produce duplicate columns: " + cols);
        }
        List<String> source = columns;
        return new LazyPlan(cols, () -> rows.get().map(r -> {
            var out = new LinkedHashMap<String, Object>();
            for (int i = 0; i < source.size(); i++) {
                out.put(cols.get(i), r.get(source.get(i)));
            }
            return out;
        }));
    }

    /** Add or replace a column computed from each row. */
    public LazyPlan withColumn(String name, Function<Map<String, Object>, Object> value) {
        var cols = new ArrayList<>(columns);
        if (!cols.contains(name)) {
            cols.add(name);
        }
        return new LazyPlan(cols, () -> rows.get().map(r -> {
            var out = new LinkedHashMap<String, Object>(r);
            out.put(name, value.apply(r));
            return out;
        }));
    }

    /** Keep the first row for each distinct combination of {@code subset} (all columns when empty). */
    public LazyPlan distinct(List<String> subset) {
        List<String> keys = subset == null || subset.isEmpty() ? columns : List.copyOf(subset);
        requireColumns(keys);
        return new LazyPlan(columns, () -> {
            var seen = new HashSet<List<Object>>();
            return rows.get().filter(r -> seen.add(keyOf(r, keys)));
        });
    }

    /**
     * Equi-join against {@code right}. Right-side key columns are dropped from the output; other
     * right columns that clash with left names get a {@code _right} suffix. Null keys never match.
     */
    public LazyPlan join(LazyPlan right, List<String> leftOn, List<String> rightOn, JoinType how) {
        if (leftOn.isEmpty() || leftOn.size() != rightOn.size()) {
            throw new IllegalArgumentException(
                "Join needs the same, non-zero number of keys on both sides: %s vs %s".formatted(leftOn, rightOn));
        }
        requireColumns(leftOn);
        right.requireColumns(rightOn);

        var rightOut = new LinkedHashMap<String, String>();
        for (String c : right.columns) {
            if (!rightOn.contains(c)) {
                rightOut.put(c, columns.contains(c) ? c + "_right" : c);
            }
        }
        var cols = new ArrayList<>(columns);
        cols.addAll(rightOut.values());

        return new LazyPlan(cols, () -> {
            Map<List<Object>, List<Map<String, Object>>> index = new HashMap<>();
            try (var rs = right.stream()) {
                rs.forEach(r -> {
                    var key = keyOf(r, rightOn);
                    if (!key.contains(null)) {
                        index.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
                    }
                });
            }
            return rows.get().flatMap(l -> {
                var matches = index.getOrDefault(keyOf(l, leftOn), List.of());
                if (matches.isEmpty()) {
                    return how == JoinType.LEFT ? Stream.of(merge(l, null, rightOut)) : Stream.empty();
                }
                return matches.stream().map(r -> merge(l, r, rightOut));
            });
        });
    }

    /** Open the row stream. Callers must close it. */
    public Stream<Map<String, Object>> stream() {
        return rows.get();
    }

    public Frame collect() {
        try (var s = stream()) {
            return new Frame(columns, s.toList());
        }
    }

    public long count() {
        try (var s = stream()) {
            return s.count();
        }
    }

    private static Map<String, Object> merge(Map<String, Object> left, Map<String, Object> right,
                                             Map<String, String> rightOut) {
        var out = new LinkedHashMap<>(left);
        rightOut.forEach((src, dst) -> out.put(dst, right == null ? null : right.get(src)));
        return out;
    }

    // String form so "1" from a CSV matches 1 from an in-memory source.
    private static List<Object> keyOf(Map<String, Object> row, List<String> keys) {
        var key = new ArrayList<>(keys.size());
        for (String k : keys) {
            Object v = row.get(k);
            key.add(v == null ? null : v.toString());
        }
        return key;
    }

    static Map<String, Object> conform(List<String> columns, Map<String, ?> row) {
        var out = new LinkedHashMap<String, Object>();
        for (String c : columns) {
            out.put(c, row.get(c));
        }
        return out;
    }

    @Override
    public String toString() {
        return "LazyPlan" + columns;
    }
}
