package dev.dataprep.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A single predicate over a file path or a sheet/table name.
 */
public record FilterDescriptor(
    FilterKind kind,
    String value,
    FilterTarget target
) {
    public FilterDescriptor {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
        target = target == null ? FilterTarget.FILENAME : target;
    }

    public static FilterDescriptor filename(FilterKind kind, String value) {
        return new FilterDescriptor(kind, value, FilterTarget.FILENAME);
    }

    public static FilterDescriptor fullPath(FilterKind kind, String value) {
        return new FilterDescriptor(kind, value, FilterTarget.FULL_PATH);
    }

    /**
     * Parse the textual form {@code kind:target:value}, e.g. {@code glob:filename:*.csv}.
     * The value may itself contain colons.
     */
    public static FilterDescriptor parse(String text) {
        String[] parts = text.split(":", 3);
        if (parts.length != 3) {
            throw new IllegalArgumentException(
                "Filter must look like kind:target:value, got '%s'".formatted(text));
        }
        FilterKind kind = FilterKind.valueOf(parts[0].trim().toUpperCase(Locale.ROOT));
        FilterTarget target = switch (parts[1].trim().toLowerCase(Locale.ROOT)) {
            case "filename", "name" -> FilterTarget.FILENAME;
            case "path", "full_path" -> FilterTarget.FULL_PATH;
            default -> throw new IllegalArgumentException("Unknown filter target: " + parts[1]);
        };
        return new FilterDescriptor(kind, parts[2], target);
    }
}
