package dev.dataprep.io;

import dev.dataprep.model.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Scratch directory for derived files such as re-encoded copies of source files.
 *
 * <p>Each artifact lives in its own unique folder and is owned by the {@link StagedFile} handle
 * returned from {@link #stage}; closing the handle deletes it. The age-based {@link #cleanup}
 * sweep only removes folders that no open handle points into.
 */
public final class StagingArea {

    public static final String ENV_VAR = "DATAPREP_STAGING_DIR";
    public static final String DEFAULT_FOLDER = "dataprep_staging";

    private static final Logger log = LoggerFactory.getLogger(StagingArea.class);

    private final Path root;
    private final Set<Path> live = ConcurrentHashMap.newKeySet();

    public StagingArea(Path root) throws IOException {
        this.root = Files.createDirectories(root.toAbsolutePath().normalize());
    }

    /**
     * Root from the config, else the {@value #ENV_VAR} environment variable, else
     * {@code ${java.io.tmpdir}/dataprep_staging}.
     */
    public static StagingArea fromConfig(EngineConfig config, Map<String, String> env) throws IOException {
        if (config.stagingDir() != null) {
            return new StagingArea(config.stagingDir());
        }
        String fromEnv = env.get(ENV_VAR);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return new StagingArea(Path.of(fromEnv));
        }
        return new StagingArea(Path.of(System.getProperty("java.io.tmpdir"), DEFAULT_FOLDER));
    }

    public Path root() {
        return root;
    }

    /** Create {@code {epochSeconds}_{8 hex}_{sanitised base name}} under the root. */
    public Path createUniqueFolder(String baseName) throws IOException {
        String unique = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        String name = "%d_%s_%s".formatted(Instant.now().getEpochSecond(), unique, sanitize(baseName));
        return Files.createDirectories(root.resolve(name));
    }

    /** Reserve a path for a new artifact. The file itself is not created. */
    public StagedFile stage(String baseName, String fileName) throws IOException {
        Path folder = createUniqueFolder(baseName);
        live.add(folder);
        return new StagedFile(this, folder.resolve(sanitize(fileName)));
    }

    /** Folders currently owned by open handles. */
    public Set<Path> liveFolders() {
        return Set.copyOf(live);
    }

    /**
     * Delete top-level entries older than {@code maxAge} that no open handle owns.
     *
     * @return number of entries removed
     */
    public int cleanup(Duration maxAge) {
        Instant cutoff = Instant.now().minus(maxAge);
        int removed = 0;
        List<Path> entries;
        try (Stream<Path> s = Files.list(root)) {
            entries = s.toList();
        } catch (IOException e) {
            log.warn("Staging cleanup could not list {}: {}", root, e.toString());
            return 0;
        }
        for (Path entry : entries) {
            if (live.contains(entry)) {
                continue;
            }
            try {
                if (Files.getLastModifiedTime(entry).toInstant().isBefore(cutoff)) {
                    deleteRecursively(entry);
                    removed++;
                }
            } catch (IOException e) {
                log.warn("Failed to delete stale staging entry {}: {}", entry, e.toString());
            }
        }
        if (removed > 0) {
            log.info("Removed {} stale staging entries from {}", removed, root);
        }
        return removed;
    }

    void release(StagedFile file) throws IOException {
        Path folder = file.path().getParent();
        try {
            deleteRecursively(folder);
        } finally {
            live.remove(folder);
        }
    }

    static String sanitize(String name) {
        String safe = name == null ? "" : name.replaceAll("[^a-zA-Z0-9_.-]", "_");
        return safe.isEmpty() ? "unnamed" : safe;
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> s = Files.walk(path)) {
            for (Path p : s.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
