package dev.dataprep.engine;

import dev.dataprep.error.DatasetNotFoundException;
import dev.dataprep.io.StagedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The registry as it was at one moment, with every staged file pinned on disk until
 * {@link #close()}. Replacing or removing a dataset in the live registry does not affect it.
 */
public final class DatasetSnapshot implements DatasetView, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DatasetSnapshot.class);

    private final Map<String, Dataset> datasets;
    private final List<StagedFile> pinned;
    private final AtomicBoolean closed = new AtomicBoolean();

    DatasetSnapshot(Map<String, Dataset> datasets, List<StagedFile> pinned) {
        this.datasets = datasets;
        this.pinned = pinned;
    }

    @Override
    public Optional<Dataset> get(String name) {
        return Optional.ofNullable(datasets.get(name));
    }

    @Override
    public Dataset require(String name) {
        return get(name).orElseThrow(() -> new DatasetNotFoundException(name));
    }

    @Override
    public boolean contains(String name) {
        return datasets.containsKey(name);
    }

    @Override
    public List<String> listNames() {
        return List.copyOf(datasets.keySet());
    }

    int pinnedFiles() {
        return pinned.size();
    }

    /** Unpin. Files whose dataset was replaced or removed meanwhile are deleted now. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (StagedFile f : pinned) {
            try {
                f.release();
            } catch (IOException e) {
                log.warn("Failed to release pinned staged file {}: {}", f.path(), e.toString());
            }
        }
    }
}
