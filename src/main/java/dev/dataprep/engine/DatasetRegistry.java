package dev.dataprep.engine;

import dev.dataprep.error.DatasetNotFoundException;
import dev.dataprep.io.StagedFile;
import dev.dataprep.model.LoadMetadata;
import dev.dataprep.plan.DatasetPlan;
import dev.dataprep.plan.LazyPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named datasets, in insertion order. Adding under an existing name replaces the old dataset
 * entirely and releases its staged files, unless a {@link #pin() snapshot} still holds them.
 */
public final class DatasetRegistry implements DatasetView {

    private static final Logger log = LoggerFactory.getLogger(DatasetRegistry.class);

    private final Map<String, Dataset> datasets = new LinkedHashMap<>();

    public Dataset add(String name, LazyPlan plan) {
        return add(name, new DatasetPlan.Single(plan), LoadMetadata.inMemory(), List.of());
    }

    public Dataset add(String name, DatasetPlan plan, LoadMetadata metadata) {
        return add(name, plan, metadata, List.of());
    }

    public Dataset add(String name, DatasetPlan plan, LoadMetadata metadata, List<StagedFile> stagedFiles) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Dataset name must not be blank");
        }
        var dataset = new Dataset(name, plan, metadata, stagedFiles);
        Dataset previous;
        synchronized (this) {
            previous = datasets.put(name, dataset);
        }
        if (previous != null) {
            log.debug("Replaced dataset {}", name);
            previous.release();
        }
        return dataset;
    }

    @Override
    public synchronized Optional<Dataset> get(String name) {
        return Optional.ofNullable(datasets.get(name));
    }

    @Override
    public Dataset require(String name) {
        return get(name).orElseThrow(() -> new DatasetNotFoundException(name));
    }

    @Override
    public synchronized boolean contains(String name) {
        return datasets.containsKey(name);
    }

    @Override
    public synchronized List<String> listNames() {
        return List.copyOf(datasets.keySet());
    }

    public boolean remove(String name) {
        Dataset removed;
        synchronized (this) {
            removed = datasets.remove(name);
        }
        if (removed == null) {
            return false;
        }
        removed.release();
        return true;
    }

    /** Rename keeping insertion position. Fails when {@code oldName} is absent or {@code newName} is taken. */
    public synchronized boolean rename(String oldName, String newName) {
        if (!datasets.containsKey(oldName) || datasets.containsKey(newName)) {
            return false;
        }
        var entries = new ArrayList<>(datasets.entrySet());
        datasets.clear();
        for (var e : entries) {
            if (e.getKey().equals(oldName)) {
                Dataset d = e.getValue();
                datasets.put(newName, new Dataset(newName, d.plan(), d.metadata(), d.stagedFiles()));
            } else {
                datasets.put(e.getKey(), e.getValue());
            }
        }
        return true;
    }

    /** Copy the registry and pin the staged files of every dataset in it. Close the result when done. */
    public synchronized DatasetSnapshot pin() {
        var copy = new LinkedHashMap<>(datasets);
        var pinned = new ArrayList<StagedFile>();
        for (Dataset d : copy.values()) {
            for (StagedFile f : d.stagedFiles()) {
                if (f.retain()) {
                    pinned.add(f);
                }
            }
        }
        log.debug("Pinned {} staged files across {} datasets", pinned.size(), copy.size());
        return new DatasetSnapshot(copy, pinned);
    }

    public void clear() {
        List<Dataset> all;
        synchronized (this) {
            all = List.copyOf(datasets.values());
            datasets.clear();
        }
        all.forEach(Dataset::release);
    }
}
