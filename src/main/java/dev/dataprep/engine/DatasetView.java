package dev.dataprep.engine;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the dataset registry, as handed to step transforms.
 */
public interface DatasetView {

    Optional<Dataset> get(String name);

    /** @throws dev.dataprep.error.DatasetNotFoundException when absent */
    Dataset require(String name);

    boolean contains(String name);

    List<String> listNames();
}
