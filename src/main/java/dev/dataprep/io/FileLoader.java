package dev.dataprep.io;

import dev.dataprep.error.DatasetLoadException;
import dev.dataprep.model.LoadMetadata;
import dev.dataprep.plan.DatasetPlan;
import dev.dataprep.plan.LazyPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Builds dataset plans from files on disk. Text files that are not UTF-8 are first converted into
 * staged UTF-8 copies; the returned {@link LoadedSource} owns those copies.
 */
public final class FileLoader {

    private static final Logger log = LoggerFactory.getLogger(FileLoader.class);

    public static final String SOURCE_PATH_COLUMN = "__source_path__";
    public static final String SOURCE_NAME_COLUMN = "__source_name__";
    public static final String SOURCE_EXT_COLUMN = "__source_ext__";

    public static final Set<String> SUPPORTED_EXTENSIONS =
        Set.of(".csv", ".tsv", ".txt", ".json", ".ndjson", ".jsonl");

    private final PathResolver resolver;
    private final EncodingService encoding;

    public FileLoader(PathResolver resolver, EncodingService encoding) {
        this.resolver = resolver;
        this.encoding = encoding;
    }

    public LoadedSource load(LoadRequest request) {
        List<Path> files = resolveFiles(request);
        if (files.isEmpty()) {
            throw new DatasetLoadException("No files found for " + request.basePath());
        }

        var plans = new ArrayList<LazyPlan>();
        var staged = new ArrayList<StagedFile>();
        var loadedPaths = new ArrayList<String>();
        var formats = new LinkedHashSet<String>();
        try {
            for (Path file : files) {
                String ext = extension(file);
                if (!SUPPORTED_EXTENSIONS.contains(ext)) {
                    if (WorkbookInspector.SPREADSHEET_EXTENSIONS.contains(ext)) {
                        log.warn("Skipping workbook {}: only sheet metadata is read from workbooks", file);
                    } else {
                        log.warn("Skipping unsupported file {}", file);
                    }
                    continue;
                }
                Path readable = file;
                String detected = encoding.detect(file);
                if (!EncodingService.UTF_8.equals(detected)) {
                    StagedFile copy = encoding.convert(file, detected);
                    staged.add(copy);
                    readable = copy.path();
                }
                LazyPlan plan = scan(readable, ext, request.delimiter());
                if (request.includeSourceColumns()) {
                    plan = withSourceColumns(plan, file, ext);
                }
                plans.add(plan);
                loadedPaths.add(file.toString());
                formats.add(ext);
            }
        } catch (IOException | RuntimeException e) {
            closeAll(staged);
            if (e instanceof DatasetLoadException dle) {
                throw dle;
            }
            throw new DatasetLoadException("Failed to load " + request.basePath() + ": " + e.getMessage(), e);
        }

        if (plans.isEmpty()) {
            closeAll(staged);
            throw new DatasetLoadException("No loadable files found for " + request.basePath());
        }

        boolean perFile = request.perFile() && plans.size() > 1;
        DatasetPlan plan = perFile
            ? new DatasetPlan.PerFile(plans)
            : new DatasetPlan.Single(LazyPlan.concatDiagonal(plans));
        var metadata = new LoadMetadata(
            loadedPaths.size() == 1 ? "file" : "folder",
            loadedPaths,
            perFile,
            request.includeSourceColumns(),
            formats.size() == 1 ? formats.iterator().next() : ".mixed"
        );
        log.info("Loaded {} file(s) from {} ({} staged, per-file={})",
            loadedPaths.size(), request.basePath(), staged.size(), perFile);
        return new LoadedSource(plan, metadata, staged);
    }

    /**
     * The files a load would read: resolved paths, with directories expanded to the supported
     * files under them, cut to the request's file limit.
     */
    public List<Path> resolveFiles(LoadRequest request) {
        List<String> resolved = resolver.resolve(request.basePath(), request.filters(), request.fileLimit());
        var out = new ArrayList<Path>();
        for (String entry : resolved) {
            Path p = Path.of(entry);
            if (Files.isDirectory(p)) {
                out.addAll(supportedFilesUnder(p));
            } else {
                out.add(p);
            }
        }
        if (request.fileLimit() != null && out.size() > request.fileLimit()) {
            return out.subList(0, request.fileLimit());
        }
        return out;
    }

    private static List<Path> supportedFilesUnder(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(p -> SUPPORTED_EXTENSIONS.contains(extension(p)))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new DatasetLoadException("Cannot read directory " + dir, e);
        }
    }

    private static LazyPlan scan(Path file, String ext, Character delimiter) throws IOException {
        return switch (ext) {
            case ".json", ".ndjson", ".jsonl" -> LazyPlan.scanNdjson(file);
            case ".tsv" -> LazyPlan.scanCsv(file, delimiter == null ? '\t' : delimiter);
            default -> LazyPlan.scanCsv(file, delimiter == null ? ',' : delimiter);
        };
    }

    private static LazyPlan withSourceColumns(LazyPlan plan, Path file, String ext) {
        String path = file.toString();
        String name = file.getFileName().toString();
        return plan
            .withColumn(SOURCE_PATH_COLUMN, row -> path)
            .withColumn(SOURCE_NAME_COLUMN, row -> name)
            .withColumn(SOURCE_EXT_COLUMN, row -> ext);
    }

    static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static void closeAll(List<StagedFile> staged) {
        for (StagedFile f : staged) {
            try {
                f.close();
            } catch (IOException e) {
                log.warn("Failed to release staged file {}: {}", f.path(), e.toString());
            }
        }
    }
}
