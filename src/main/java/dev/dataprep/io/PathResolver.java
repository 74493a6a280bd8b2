package dev.dataprep.io;

import dev.dataprep.error.PathResolutionException;
import dev.dataprep.model.FilterDescriptor;
import dev.dataprep.model.FilterKind;
import dev.dataprep.model.FilterTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Turns a file, directory or glob pattern plus optional filters into a list of file paths.
 *
 * <p>Without filters the base path is returned as-is (a file or directory) or glob-expanded.
 * With filters the most selective filename filter is turned into a narrower search
 * (EXACT, then GLOB, then CONTAINS) before the remaining candidates are checked one by one.
 * Candidates come from a lazy walk, so a limit stops enumeration as soon as it is reached.
 * Results follow filesystem enumeration order and are not sorted.
 */
public class PathResolver {

    private static final Logger log = LoggerFactory.getLogger(PathResolver.class);

    public List<String> resolve(String basePath) {
        return resolve(basePath, List.of(), null);
    }

    /**
     * @param basePath file, directory or glob pattern
     * @param filters  filters that must all match; may be empty
     * @param limit    maximum number of results, or null for no limit
     */
    public List<String> resolve(String basePath, List<FilterDescriptor> filters, Integer limit) {
        if (basePath == null || basePath.isBlank()) {
            return List.of();
        }
        if (limit != null && limit <= 0) {
            return List.of();
        }
        List<FilterDescriptor> active = filters == null ? List.of() : filters;
        Path base = toPath(basePath);

        if (active.isEmpty()) {
            if (Files.isRegularFile(base)) {
                return List.of(basePath);
            }
            if (Globs.hasWildcard(basePath)) {
                return collect(expand(basePath), limit);
            }
            if (Files.isDirectory(base)) {
                // left to the bulk reader
                return List.of(basePath);
            }
            return List.of();
        }

        Stream<String> candidates;
        String exact = Files.isDirectory(base) ? exactFileName(active) : null;
        Search narrowed = exact == null && Files.isDirectory(base) ? narrow(basePath, active) : null;
        if (exact != null) {
            candidates = lookup(base, exact);
        } else if (narrowed != null) {
            log.debug("Narrowed search under {} to {}", basePath, narrowed.pattern());
            candidates = search(narrowed);
        } else if (Globs.hasWildcard(basePath)) {
            candidates = expand(basePath);
        } else if (Files.isDirectory(base)) {
            candidates = search(new Search(basePath, Integer.MAX_VALUE, p -> true, "**"));
        } else if (Files.isRegularFile(base)) {
            candidates = Stream.of(basePath);
        } else {
            return List.of();
        }
        return collect(candidates.filter(p -> FilterEvaluator.matchesAll(p, active)), limit);
    }

    /**
     * Lazily enumerate regular files under {@code root} up to {@code maxDepth}. Every candidate the
     * resolver looks at comes through here.
     */
    protected Stream<Path> walk(Path root, int maxDepth) throws IOException {
        return Files.walk(root, maxDepth).filter(Files::isRegularFile);
    }

    /** The first EXACT filename value when it has no wildcard, so it can be looked up directly. */
    private static String exactFileName(List<FilterDescriptor> filters) {
        for (FilterDescriptor f : filters) {
            if (f.target() == FilterTarget.FILENAME && f.kind() == FilterKind.EXACT) {
                return Globs.hasWildcard(f.value()) ? null : f.value();
            }
        }
        return null;
    }

    private static Stream<String> lookup(Path dir, String fileName) {
        Path candidate;
        try {
            candidate = dir.resolve(fileName);
        } catch (InvalidPathException e) {
            return Stream.empty();
        }
        log.debug("Direct lookup of {}", candidate);
        if (!Files.isRegularFile(candidate)) {
            return Stream.empty();
        }
        if (Files.isSymbolicLink(candidate)) {
            return Stream.of(candidate.toString());
        }
        // case-insensitive filesystems resolve other spellings too
        try {
            Path real = candidate.toRealPath();
            return fileName.equals(real.getFileName().toString()) ? Stream.of(candidate.toString()) : Stream.empty();
        } catch (IOException e) {
            throw new PathResolutionException("Cannot read " + candidate, e);
        }
    }

    // Priority: EXACT > GLOB > CONTAINS, filename filters only.
    private static Search narrow(String basePath, List<FilterDescriptor> filters) {
        for (FilterDescriptor f : filters) {
            if (f.target() == FilterTarget.FILENAME && f.kind() == FilterKind.EXACT) {
                return pathSearch(basePath, Globs.escape(f.value()), false);
            }
        }
        for (FilterDescriptor f : filters) {
            if (f.target() == FilterTarget.FILENAME && f.kind() == FilterKind.GLOB) {
                return pathSearch(basePath, f.value(), true);
            }
        }
        for (FilterDescriptor f : filters) {
            if (f.target() == FilterTarget.FILENAME && f.kind() == FilterKind.CONTAINS) {
                return pathSearch(basePath, "**/*" + Globs.escape(f.value()) + "*", true);
            }
        }
        return null;
    }

    /** Glob-expand a pattern whose leading wildcard-free segments name the directory to search. */
    private Stream<String> expand(String pattern) {
        List<String> segments = Globs.segments(pattern);
        int firstWild = 0;
        while (firstWild < segments.size() && !Globs.hasWildcard(segments.get(firstWild))) {
            firstWild++;
        }
        String root = String.join("/", segments.subList(0, firstWild));
        if (firstWild == 1 && root.isEmpty()) {
            root = "/";
        }
        String rest = String.join("/", segments.subList(firstWild, segments.size()));
        return search(pathSearch(root, rest, false));
    }

    private static Search pathSearch(String root, String relativeGlob, boolean ignoreCase) {
        int depth = relativeGlob.contains("**")
            ? Integer.MAX_VALUE
            : Globs.segments(relativeGlob).size();
        Pattern pattern;
        try {
            pattern = Globs.compile(relativeGlob, true, ignoreCase);
        } catch (PatternSyntaxException e) {
            throw new PathResolutionException("Malformed pattern: " + relativeGlob, e);
        }
        return new Search(root, depth, rel -> pattern.matcher(rel).matches(), relativeGlob);
    }

    private Stream<String> search(Search s) {
        boolean relative = s.root().isEmpty();
        Path root = toPath(relative ? "." : s.root());
        if (!Files.isDirectory(root)) {
            return Stream.empty();
        }
        Stream<Path> files;
        try {
            files = walk(root, s.maxDepth());
        } catch (IOException e) {
            throw new PathResolutionException("Cannot read directory " + root, e);
        }
        return files
            .filter(p -> s.accepts().test(slashes(root.relativize(p))))
            .map(p -> relative ? slashes(root.relativize(p)) : p.toString());
    }

    private static List<String> collect(Stream<String> candidates, Integer limit) {
        try (candidates) {
            Stream<String> bounded = limit == null ? candidates : candidates.limit(limit);
            return bounded.toList();
        } catch (UncheckedIOException e) {
            throw new PathResolutionException("Directory walk failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private static Path toPath(String path) {
        try {
            return Path.of(path);
        } catch (InvalidPathException e) {
            throw new PathResolutionException("Invalid path: " + path, e);
        }
    }

    private static String slashes(Path p) {
        return p.toString().replace('\\', '/');
    }

    private record Search(String root, int maxDepth, Predicate<String> accepts, String pattern) {}
}
