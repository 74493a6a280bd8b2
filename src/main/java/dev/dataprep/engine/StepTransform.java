package dev.dataprep.engine;

import dev.dataprep.plan.LazyPlan;

/**
 * A step's transformation: takes a plan and validated params, returns a new plan.
 * Implementations must not collect the plan unless the step cannot be expressed lazily.
 */
@FunctionalInterface
public interface StepTransform<P> {

    LazyPlan apply(LazyPlan plan, P params, ExecutionContext context);
}
