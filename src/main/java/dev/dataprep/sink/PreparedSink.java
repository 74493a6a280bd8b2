package dev.dataprep.sink;

import dev.dataprep.plan.LazyPlan;

/**
 * A sink with validated params, ready to run.
 */
public record PreparedSink<P>(String type, P params, SinkWriter<P> writer) {

    public WriteResult write(LazyPlan plan) {
        return writer.write(plan, params);
    }
}
