package dev.dataprep.plan;

import java.util.List;

/**
 * The plan(s) behind a dataset: one combined plan, or one plan per source file.
 */
public sealed interface DatasetPlan {

    /** All sources already combined into a single plan. */
    record Single(LazyPlan plan) implements DatasetPlan {

        @Override
        public LazyPlan combined() {
            return plan;
        }

        @Override
        public LazyPlan previewBase() {
            return plan;
        }

        @Override
        public List<LazyPlan> sources() {
            return List.of(plan);
        }
    }

    /** Each source file kept as its own plan, transformed separately and concatenated afterwards. */
    record PerFile(List<LazyPlan> plans) implements DatasetPlan {

        public PerFile {
            if (plans == null || plans.isEmpty()) {
                throw new IllegalArgumentException("Per-file dataset needs at least one plan");
            }
            plans = List.copyOf(plans);
        }

        @Override
        public LazyPlan combined() {
            return LazyPlan.concatDiagonal(plans);
        }

        @Override
        public LazyPlan previewBase() {
            return plans.get(0);
        }

        @Override
        public List<LazyPlan> sources() {
            return plans;
        }
    }

    /** Every source as one plan; per-file sources are concatenated tolerating schema differences. */
    LazyPlan combined();

    /** The plan a preview starts from: the first source in per-file mode. */
    LazyPlan previewBase();

    List<LazyPlan> sources();
}
