package dev.dataprep.io;

import dev.dataprep.model.FilterDescriptor;
import dev.dataprep.model.FilterTarget;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates {@link FilterDescriptor}s against file paths and sheet/table names.
 * All kinds except EXACT and IS_NOT ignore case. An invalid REGEX never matches.
 */
public final class FilterEvaluator {

    private static final Map<String, Pattern> GLOBS = new ConcurrentHashMap<>();
    private static final Map<String, Optional<Pattern>> REGEXES = new ConcurrentHashMap<>();

    private FilterEvaluator() {}

    public static boolean matches(String candidate, FilterDescriptor filter) {
        String value = filter.value();
        return switch (filter.kind()) {
            case EXACT -> value.equals(candidate);
            case IS_NOT -> !value.equals(candidate);
            case CONTAINS -> lower(candidate).contains(lower(value));
            case NOT_CONTAINS -> !lower(candidate).contains(lower(value));
            case GLOB -> GLOBS.computeIfAbsent(lower(value), v -> Globs.compile(v, false, false))
                .matcher(lower(candidate))
                .matches();
            case REGEX -> REGEXES.computeIfAbsent(value, FilterEvaluator::compileRegex)
                .map(p -> p.matcher(candidate).find())
                .orElse(false);
        };
    }

    /** Match a path, using its last segment or the whole path depending on the filter's target. */
    public static boolean matchesPath(String path, FilterDescriptor filter) {
        String candidate = filter.target() == FilterTarget.FULL_PATH ? path : fileName(path);
        return matches(candidate, filter);
    }

    public static boolean matchesPath(Path path, FilterDescriptor filter) {
        return matchesPath(path.toString(), filter);
    }

    /** True when every filter matches. An empty list matches everything. */
    public static boolean matchesAll(String path, List<FilterDescriptor> filters) {
        for (FilterDescriptor f : filters) {
            if (!matchesPath(path, f)) {
                return false;
            }
        }
        return true;
    }

    /** Names (sheets, tables) that satisfy every filter, in their original order. */
    public static List<String> filterNames(List<String> names, List<FilterDescriptor> filters) {
        return names.stream()
            .filter(n -> filters.stream().allMatch(f -> matches(n, f)))
            .toList();
    }

    static String fileName(String path) {
        int cut = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return cut < 0 ? path : path.substring(cut + 1);
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    private static Optional<Pattern> compileRegex(String regex) {
        try {
            return Optional.of(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        } catch (PatternSyntaxException e) {
            return Optional.empty();
        }
    }
}
