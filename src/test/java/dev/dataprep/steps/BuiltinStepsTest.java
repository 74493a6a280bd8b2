package dev.dataprep.steps;

import dev.dataprep.engine.DatasetRegistry;
import dev.dataprep.engine.ExecutionEngine;
import dev.dataprep.engine.StepRegistry;
import dev.dataprep.error.InvalidStepParamsException;
import dev.dataprep.error.StepExecutionException;
import dev.dataprep.model.EngineConfig;
import dev.dataprep.model.Recipe;
import dev.dataprep.model.Step;
import dev.dataprep.plan.Frame;
import dev.dataprep.plan.LazyPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BuiltinStepsTest {

    // "amount" is missing (null) for row 4
    private static final LazyPlan SALES = LazyPlan.of(List.of("id", "region", "amount"), List.of(
        Map.of("id", "1", "region", "EU", "amount", "9"),
        Map.of("id", "2", "region", "US", "amount", "100"),
        Map.of("id", "3", "region", "EU", "amount", "25.5"),
        Map.of("id", "4", "region", "APAC"),
        Map.of("id", "5", "region", "US", "amount", "100")));

    private DatasetRegistry datasets;
    private ExecutionEngine engine;

    @BeforeEach
    void setUp() {
        var steps = new StepRegistry();
        BuiltinSteps.registerAll(steps);
        datasets = new DatasetRegistry();
        engine = new ExecutionEngine(steps, datasets, EngineConfig.defaults());
    }

    private Frame run(LazyPlan plan, Step... steps) {
        return engine.applyRecipe(plan, Recipe.of(steps), Map.of()).collect();
    }

    private static Step filter(String logic, Map<?, ?>... conditions) {
        return Step.of("f", "filter_rows", Map.of("logic", logic, "conditions", List.of(conditions)));
    }

    private static Map<String, Object> cond(String col, String op, Object val) {
        return Map.of("col", col, "op", op, "val", val);
    }

    @Test
    void filterComparesNumbersNumerically() {
        // "9" < "25.5" numerically but not as strings
        assertThat(run(SALES, filter("AND", cond("amount", ">", 20))).column("id"))
            .containsExactly("2", "3", "5");
        assertThat(run(SALES, filter("AND", cond("amount", "<=", "25.5"))).column("id"))
            .containsExactly("1", "3");
        assertThat(run(SALES, filter("AND", cond("amount", "==", "100.0"))).column("id"))
            .containsExactly("2", "5");
    }

    @Test
    void filterStringOperators() {
        assertThat(run(SALES, filter("AND", cond("region", "contains", "U"))).column("id"))
            .containsExactly("1", "2", "3", "5");
        assertThat(run(SALES, filter("AND", cond("region", "not_contains", "U"))).column("id"))
            .containsExactly("4");
        assertThat(run(SALES, filter("AND", cond("region", "!=", "EU"))).column("id"))
            .containsExactly("2", "4", "5");
    }

    @Test
    void nullCellsOnlyMatchNullChecks() {
        assertThat(run(SALES, filter("AND", Map.of("col", "amount", "op", "is_null"))).column("id"))
            .containsExactly("4");
        assertThat(run(SALES, filter("AND", Map.of("col", "amount", "op", "is_not_null"))).rowCount())
            .isEqualTo(4);
        assertThat(run(SALES, filter("AND", cond("amount", "!=", "9"))).column("id"))
            .containsExactly("2", "3", "5");
    }

    @Test
    void filterCombinesWithAndOr() {
        var eu = cond("region", "==", "EU");
        var big = cond("amount", ">", 50);

        assertThat(run(SALES, filter("AND", eu, big)).rowCount()).isZero();
        assertThat(run(SALES, filter("or", eu, big)).column("id")).containsExactly("1", "2", "3", "5");
    }

    @Test
    void blankValuesDisableConditions() {
        var blank = cond("region", "==", " ");

        assertThat(run(SALES, filter("AND", blank)).rowCount()).isEqualTo(5);
        assertThat(run(SALES, filter("AND", blank, cond("region", "==", "US"))).column("id"))
            .containsExactly("2", "5");
    }

    @Test
    void filterRejectsUnknownOperatorsAndColumns() {
        assertThatThrownBy(() -> run(SALES, filter("AND", cond("region", "~=", "EU"))))
            .isInstanceOf(InvalidStepParamsException.class)
            .hasMessageContaining("~=");
        assertThatThrownBy(() -> run(SALES, filter("AND", cond("country", "==", "EU"))))
            .isInstanceOf(StepExecutionException.class);
    }

    @Test
    void sortByMultipleColumnsKeepsNullsLast() {
        Frame asc = run(SALES, Step.of("s", "sort_rows", Map.of("cols", List.of("amount", "id"))));
        Frame desc = run(SALES, Step.of("s", "sort_rows", Map.of("cols", List.of("amount", "id"), "desc", true)));

        assertThat(asc.column("id")).containsExactly("1", "3", "2", "5", "4");
        assertThat(desc.column("id")).containsExactly("5", "2", "3", "1", "4");
    }

    @Test
    void deduplicateKeepsFirstOccurrence() {
        assertThat(run(SALES, Step.of("d", "deduplicate", Map.of("subset", List.of("region")))).column("id"))
            .containsExactly("1", "2", "4");
        assertThat(run(SALES, Step.of("d", "deduplicate", Map.of())).rowCount()).isEqualTo(5);

        var dupes = LazyPlan.of(List.of("a"), List.of(Map.of("a", "x"), Map.of("a", "x")));
        assertThat(run(dupes, Step.of("d", "deduplicate", Map.of())).rowCount()).isEqualTo(1);
    }

    @Test
    void sliceModes() {
        assertThat(run(SALES, Step.of("s", "slice_rows", Map.of("n", 2))).column("id"))
            .containsExactly("1", "2");
        assertThat(run(SALES, Step.of("s", "slice_rows", Map.of("mode", "Keep Bottom", "n", 2))).column("id"))
            .containsExactly("4", "5");
        assertThat(run(SALES, Step.of("s", "slice_rows", Map.of("mode", "Remove Top", "n", 2))).column("id"))
            .containsExactly("3", "4", "5");
        assertThat(run(SALES, Step.of("s", "slice_rows", Map.of("mode", "Remove Bottom", "n", 4))).column("id"))
            .containsExactly("1");
        assertThat(run(SALES, Step.of("s", "slice_rows", Map.of("mode", "Keep Bottom", "n", 50))).rowCount())
            .isEqualTo(5);
        assertThat(run(SALES, Step.of("s", "slice_rows", Map.of("n", -3))).rowCount()).isZero();
    }

    @Test
    void sliceDefaultsToTopTen() {
        var many = LazyPlan.of(List.of("n"),
            IntStream.range(0, 25).mapToObj(i -> Map.of("n", String.valueOf(i))).toList());

        assertThat(run(many, Step.of("s", "slice_rows", Map.of())).rowCount()).isEqualTo(10);
        assertThatThrownBy(() -> run(many, Step.of("s", "slice_rows", Map.of("mode", "Middle"))))
            .isInstanceOf(InvalidStepParamsException.class);
    }

    @Test
    void columnSteps() {
        Frame frame = run(SALES,
            Step.of("r", "rename_col", Map.of("old", "amount", "new", "total")),
            Step.of("d", "drop_cols", Map.of("cols", List.of("region"))),
            Step.of("s", "select_cols", Map.of("cols", List.of("total", "id"))));

        assertThat(frame.columns()).containsExactly("total", "id");
        assertThat(frame.row(0)).containsEntry("total", "9").containsEntry("id", "1");
    }

    @Test
    void renameToSameNameStillChecksColumn() {
        assertThat(run(SALES, Step.of("r", "rename_col", Map.of("old", "id", "new", "id"))).columns())
            .containsExactly("id", "region", "amount");
        assertThatThrownBy(() -> run(SALES, Step.of("r", "rename_col", Map.of("old", "x", "new", "x"))))
            .isInstanceOf(StepExecutionException.class);
        assertThatThrownBy(() -> run(SALES, Step.of("r", "rename_col", Map.of("old", "id", "new", "region"))))
            .isInstanceOf(StepExecutionException.class)
            .hasRootCauseMessage("Rename would produce duplicate columns: [region, region, amount]");
    }

    @Test
    void joinDatasetLeftKeepsUnmatchedRows() {
        datasets.add("regions", LazyPlan.of(List.of("code", "name", "id"), List.of(
            Map.of("code", "EU", "name", "Europe", "id", "r1"),
            Map.of("code", "US", "name", "United States", "id", "r2"))));

        Frame frame = run(SALES, Step.of("j", "join_dataset", Map.of(
            "alias", "regions", "how", "LEFT", "left_on", List.of("region"), "right_on", List.of("code"))));

        assertThat(frame.columns()).containsExactly("id", "region", "amount", "name", "id_right");
        assertThat(frame.column("name")).containsExactly("Europe", "United States", "Europe", null, "United States");
    }

    @Test
    void joinRejectsOuterJoins() {
        assertThatThrownBy(() -> run(SALES, Step.of("j", "join_dataset", Map.of(
            "alias", "x", "how", "outer", "left_on", List.of("a"), "right_on", List.of("b")))))
            .isInstanceOf(InvalidStepParamsException.class)
            .hasMessageContaining("inner or left");
    }

    @Test
    void concatAlignsSchemas() {
        datasets.add("more", LazyPlan.of(List.of("id", "channel"), List.of(Map.of("id", "6", "channel", "web"))));

        Frame frame = run(SALES, Step.of("c", "concat_datasets", Map.of("other_dataset", "more")));

        assertThat(frame.columns()).containsExactly("id", "region", "amount", "channel");
        assertThat(frame.rowCount()).isEqualTo(6);
        assertThat(frame.row(5)).containsEntry("region", null).containsEntry("channel", "web");
    }

    @Test
    void sortOnMixedColumnPutsNumbersBeforeText() {
        LazyPlan mixed = LazyPlan.of(List.of("v"), List.of(
            Map.of("v", "10"), Map.of("v", "b"), Map.of("v", "9"), Map.of("v", "1a"), Map.of("v", "2"), Map.of()));

        Frame asc = run(mixed, Step.of("s", "sort_rows", Map.of("cols", List.of("v"))));
        Frame desc = run(mixed, Step.of("s", "sort_rows", Map.of("cols", List.of("v"), "desc", true)));

        assertThat(asc.column("v")).containsExactly("2", "9", "10", "1a", "b", null);
        assertThat(desc.column("v")).containsExactly("b", "1a", "10", "9", "2", null);
    }

    @Test
    void sortOnLargeMixedColumnsNeverBreaksTheComparatorContract() {
        var random = new Random(7);
        String[] pool = {"9", "10", "1a", "b", "-3", "2.5", "abc", "0010", "", " ", "Z", "1e3", "x9"};
        for (int round = 0; round < 50; round++) {
            var rows = new ArrayList<Map<String, Object>>();
            for (int i = 0; i < 200; i++) {
                var row = new HashMap<String, Object>();
                int pick = random.nextInt(pool.length + 2);
                if (pick < pool.length) {
                    row.put("v", pool[pick]);
                } else if (pick == pool.length) {
                    row.put("v", random.nextInt(1000));
                }
                rows.add(row);
            }

            Frame sorted = run(LazyPlan.of(List.of("v"), rows), Step.of("s", "sort_rows", Map.of("cols", List.of("v"))));

            assertThat(sorted.column("v")).hasSize(200).isSortedAccordingTo(Values.NATURAL);
        }
    }

    @Test
    void valuesCompareNumbersBeforeStrings() {
        assertThat(Values.compare("10", 9)).isPositive();
        assertThat(Values.compare("b", "a")).isPositive();
        assertThat(Values.equal("1.50", 1.5)).isTrue();
        assertThat(Values.number(" ")).isEmpty();
        assertThat(Values.NATURAL.compare(null, "a")).isPositive();
        assertThat(Values.compare(9, "1a")).isNegative();
        assertThat(Values.compare("1a", "10")).isPositive();
    }
}
