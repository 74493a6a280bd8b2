package dev.dataprep.jobs;

import dev.dataprep.engine.DatasetRegistry;
import dev.dataprep.engine.ExecutionEngine;
import dev.dataprep.engine.StepRegistry;
import dev.dataprep.error.InvalidSinkConfigException;
import dev.dataprep.error.JobQueueFullException;
import dev.dataprep.error.UnknownSinkTypeException;
import dev.dataprep.io.StagedFile;
import dev.dataprep.io.StagingArea;
import dev.dataprep.model.EngineConfig;
import dev.dataprep.model.JobInfo;
import dev.dataprep.model.JobStatus;
import dev.dataprep.model.LoadMetadata;
import dev.dataprep.model.Recipe;
import dev.dataprep.model.Step;
import dev.dataprep.plan.DatasetPlan;
import dev.dataprep.plan.LazyPlan;
import dev.dataprep.sink.SinkRegistry;
import dev.dataprep.sink.WriteResult;
import dev.dataprep.steps.BuiltinSteps;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobManagerTest {

    @TempDir
    Path dir;

    record GateParams(String path) {}

    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);

    private DatasetRegistry datasets;
    private SinkRegistry sinks;
    private ExecutionEngine engine;
    private JobManager jobs;

    @BeforeEach
    void setUp() {
        var steps = new StepRegistry();
        BuiltinSteps.registerAll(steps);
        datasets = new DatasetRegistry();
        datasets.add("orders", LazyPlan.of(List.of("id", "amount"), List.of(
            Map.of("id", "1", "amount", "10"),
            Map.of("id", "2", "amount", "20"),
            Map.of("id", "3", "amount", "30"))));
        sinks = SinkRegistry.withBuiltins();
        sinks.register("gate", GateParams.class, (plan, params) -> {
            started.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return WriteResult.failed("interrupted");
            }
            return WriteResult.ok(plan.count());
        });
        engine = new ExecutionEngine(steps, datasets, EngineConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        if (jobs != null) {
            jobs.close();
        }
    }

    private JobManager manager(int maxJobs, int queue) {
        jobs = new JobManager(engine, datasets, sinks, EngineConfig.defaults().withJobLimits(maxJobs, queue));
        return jobs;
    }

    private JobInfo await(String jobId) throws InterruptedException {
        return jobs.awaitTermination(jobId, Duration.ofSeconds(10)).orElseThrow();
    }

    private static StagedFile stagedCsv(StagingArea staging, String name, String content) throws IOException {
        StagedFile file = staging.stage(name, "utf8_" + name);
        Files.writeString(file.path(), content);
        return file;
    }

    @Test
    void completedExportWritesFileAndReportsSize() throws Exception {
        Path out = dir.resolve("exports/orders.csv");
        var recipe = Recipe.of(Step.of("f", "filter_rows", Map.of(
            "conditions", List.of(Map.of("col", "amount", "op", ">=", "val", 20)))));

        String jobId = manager(2, 4).startExport("orders", recipe, "csv", Map.of("path", out.toString()), Map.of());
        JobInfo info = await(jobId);

        assertThat(info.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(info.sizeSummary()).endsWith(" B");
        assertThat(info.duration()).isNotNull();
        assertThat(info.output()).isEqualTo("csv:" + out);
        assertThat(Files.readAllLines(out)).containsExactly("id,amount", "2,20", "3,30");
    }

    @Test
    void missingDatasetFailsTheJobNotTheCaller() throws Exception {
        String jobId = manager(1, 1).startExport(
            "ghost", Recipe.empty(), "ndjson", Map.of("path", dir.resolve("g.ndjson").toString()), Map.of());
        JobInfo info = await(jobId);

        assertThat(info.status()).isEqualTo(JobStatus.FAILED);
        assertThat(info.errorMessage()).contains("DatasetNotFound").contains("ghost");
        assertThat(info.sizeSummary()).isNull();
    }

    @Test
    void failingStepFailsTheJob() throws Exception {
        var recipe = Recipe.of(Step.of("s", "select_cols", Map.of("cols", List.of("nope"))));

        String jobId = manager(1, 1).startExport(
            "orders", recipe, "csv", Map.of("path", dir.resolve("x.csv").toString()), Map.of());

        assertThat(await(jobId).errorMessage()).contains("nope");
    }

    @Test
    void sinkFailureIsRecorded() throws Exception {
        Path blocker = Files.writeString(dir.resolve("blocker"), "");

        String jobId = manager(1, 1).startExport(
            "orders", Recipe.empty(), "csv", Map.of("path", blocker.resolve("x.csv").toString()), Map.of());

        JobInfo info = await(jobId);
        assertThat(info.status()).isEqualTo(JobStatus.FAILED);
        assertThat(info.errorMessage()).startsWith("Failed to write");
    }

    @Test
    void sinkConfigurationErrorsAreThrownSynchronously() {
        manager(1, 1);

        assertThatThrownBy(() -> jobs.startExport("orders", Recipe.empty(), "xlsx", Map.of("path", "a"), Map.of()))
            .isInstanceOf(UnknownSinkTypeException.class);
        assertThatThrownBy(() -> jobs.startExport("orders", Recipe.empty(), "csv", Map.of(), Map.of()))
            .isInstanceOf(InvalidSinkConfigException.class);
        assertThat(jobs.allJobs()).isEmpty();
    }

    @Test
    void statusIsReadableWhileRunning() throws Exception {
        String jobId = manager(1, 0).startExport("orders", Recipe.empty(), "gate", Map.of("path", "p"), Map.of());
        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();

        JobInfo running = jobs.status(jobId).orElseThrow();
        assertThat(running.status()).isEqualTo(JobStatus.RUNNING);
        assertThat(running.duration()).isNull();

        release.countDown();
        JobInfo done = await(jobId);
        assertThat(done.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.sizeSummary()).isEqualTo("3.00 B");
    }

    @Test
    void fullQueueRejectsNewJobs() throws Exception {
        manager(1, 0).startExport("orders", Recipe.empty(), "gate", Map.of("path", "p"), Map.of());
        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> jobs.startExport(
            "orders", Recipe.empty(), "csv", Map.of("path", dir.resolve("late.csv").toString()), Map.of()))
            .isInstanceOf(JobQueueFullException.class);
        assertThat(jobs.allJobs()).hasSize(1);
    }

    @Test
    void errorsInTheWorkerFailTheJob() throws Exception {
        sinks.register("overflow", GateParams.class, (plan, params) -> {
            throw new StackOverflowError("too deep");
        });

        String jobId = manager(1, 1).startExport("orders", Recipe.empty(), "overflow", Map.of("path", "p"), Map.of());
        JobInfo info = await(jobId);

        assertThat(info.status()).isEqualTo(JobStatus.FAILED);
        assertThat(info.errorMessage()).isEqualTo("StackOverflowError: too deep");
        assertThat(info.duration()).isNotNull();
    }

    @Test
    void assertionErrorsInTheSinkFailTheJobAndKeepTheWorker() throws Exception {
        sinks.register("broken", GateParams.class, (plan, params) -> {
            throw new AssertionError("bad state");
        });
        manager(1, 1);

        JobInfo failed = await(jobs.startExport("orders", Recipe.empty(), "broken", Map.of("path", "p"), Map.of()));
        JobInfo next = await(jobs.startExport(
            "orders", Recipe.empty(), "csv", Map.of("path", dir.resolve("after.csv").toString()), Map.of()));

        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.errorMessage()).contains("AssertionError");
        assertThat(next.status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void reloadingADatasetDuringExportKeepsItsStagedFiles() throws Exception {
        var staging = new StagingArea(dir.resolve("staging"));
        StagedFile one = stagedCsv(staging, "one.csv", "id,amount\n1,10\n2,20\n");
        StagedFile two = stagedCsv(staging, "two.csv", "id,amount\n3,30\n4,40\n");
        var perFile = new DatasetPlan.PerFile(List.of(
            LazyPlan.scanCsv(one.path(), ','), LazyPlan.scanCsv(two.path(), ',')));
        datasets.add("sales", perFile, LoadMetadata.inMemory(), List.of(one, two));

        String jobId = manager(1, 1).startExport("sales", Recipe.empty(), "gate", Map.of("path", "p"), Map.of());
        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();
        datasets.add("sales", LazyPlan.of(List.of("id"), List.of(Map.of("id", "9"))));
        datasets.remove("orders");

        assertThat(one.path()).exists();
        assertThat(two.path()).exists();

        release.countDown();
        JobInfo info = await(jobId);

        assertThat(info.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(info.sizeSummary()).isEqualTo("4.00 B");
        assertThat(one.isOpen()).isFalse();
        assertThat(two.path()).doesNotExist();
        assertThat(staging.liveFolders()).isEmpty();
    }

    @Test
    void rejectedJobUnpinsStagedFiles() throws Exception {
        var staging = new StagingArea(dir.resolve("staging"));
        StagedFile file = stagedCsv(staging, "one.csv", "id\n1\n");
        datasets.add("sales", new DatasetPlan.Single(LazyPlan.scanCsv(file.path(), ',')),
            LoadMetadata.inMemory(), List.of(file));
        manager(1, 0).startExport("orders", Recipe.empty(), "gate", Map.of("path", "p"), Map.of());
        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> jobs.startExport("sales", Recipe.empty(), "gate", Map.of("path", "q"), Map.of()))
            .isInstanceOf(JobQueueFullException.class);
        datasets.remove("sales");

        assertThat(file.path()).exists();
        release.countDown();
        jobs.close();
        assertThat(file.path()).doesNotExist();
    }

    @Test
    void unknownJobHasNoStatus() throws Exception {
        manager(1, 1);

        assertThat(jobs.status("nope")).isEmpty();
        assertThat(jobs.awaitTermination("nope", Duration.ofMillis(10))).isEmpty();
    }

    @Test
    void allJobsAreListedOldestFirst() throws Exception {
        manager(2, 2);
        String first = jobs.startExport("orders", Recipe.empty(), "csv",
            Map.of("path", dir.resolve("a.csv").toString()), Map.of());
        await(first);
        Thread.sleep(5);
        String second = jobs.startExport("orders", Recipe.empty(), "ndjson",
            Map.of("path", dir.resolve("b.ndjson").toString()), Map.of());
        await(second);

        List<JobInfo> all = jobs.allJobs();

        assertThat(all).extracting(JobInfo::jobId).containsExactly(first, second);
        assertThat(all).extracting(JobInfo::startedAt).isSortedAccordingTo(Instant::compareTo);
    }
}
