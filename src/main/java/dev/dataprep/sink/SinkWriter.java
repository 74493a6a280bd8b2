package dev.dataprep.sink;

import dev.dataprep.plan.LazyPlan;

/**
 * Writes a fully transformed plan somewhere. Called exactly once per export.
 */
public interface SinkWriter<P> {

    /**
     * Stream every row of {@code plan} to the destination described by {@code params}.
     *
     * @return success with the number of bytes written, or a failure carrying the error text
     */
    WriteResult write(LazyPlan plan, P params);
}
