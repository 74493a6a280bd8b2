package dev.dataprep.jobs;

import dev.dataprep.engine.DatasetRegistry;
import dev.dataprep.engine.DatasetSnapshot;
import dev.dataprep.engine.ExecutionEngine;
import dev.dataprep.error.JobExecutionException;
import dev.dataprep.error.JobQueueFullException;
import dev.dataprep.model.EngineConfig;
import dev.dataprep.model.JobInfo;
import dev.dataprep.model.Recipe;
import dev.dataprep.plan.LazyPlan;
import dev.dataprep.sink.ByteSizes;
import dev.dataprep.sink.PreparedSink;
import dev.dataprep.sink.SinkRegistry;
import dev.dataprep.sink.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs exports in the background on a bounded worker pool and tracks their status.
 *
 * <p>Sink type and params are checked before anything is scheduled, so configuration errors are
 * thrown to the caller. Everything that goes wrong afterwards is recorded on the job and read
 * back through {@link #status(String)}.
 */
public final class JobManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobManager.class);

    private final ExecutionEngine engine;
    private final DatasetRegistry datasets;
    private final SinkRegistry sinks;
    private final EngineConfig config;
    private final Clock clock;
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final ThreadPoolExecutor pool;

    public JobManager(ExecutionEngine engine, DatasetRegistry datasets, SinkRegistry sinks, EngineConfig config) {
        this(engine, datasets, sinks, config, Clock.systemUTC());
    }

    JobManager(ExecutionEngine engine, DatasetRegistry datasets, SinkRegistry sinks, EngineConfig config, Clock clock) {
        this.engine = engine;
        this.datasets = datasets;
        this.sinks = sinks;
        this.config = config;
        this.clock = clock;
        BlockingQueue<Runnable> queue = config.jobQueueCapacity() == 0
            ? new SynchronousQueue<>()
            : new ArrayBlockingQueue<>(config.jobQueueCapacity());
        this.pool = new ThreadPoolExecutor(
            config.maxConcurrentJobs(), config.maxConcurrentJobs(),
            0L, TimeUnit.MILLISECONDS,
            queue,
            workerThreads(),
            new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Start exporting {@code datasetName} with {@code recipe} applied.
     *
     * <p>The staged files of every registered dataset are pinned until the job ends, so reloading
     * or removing a dataset meanwhile does not pull its input away.
     *
     * @return the new job's id; the job is RUNNING when this returns
     * @throws dev.dataprep.error.UnknownSinkTypeException   for an unregistered sink type
     * @throws dev.dataprep.error.InvalidSinkConfigException when the sink params do not bind
     * @throws JobQueueFullException when every worker is busy and the queue is full
     */
    public String startExport(
        String datasetName,
        Recipe recipe,
        String sinkType,
        Map<String, Object> sinkParams,
        Map<String, Recipe> projectRecipes
    ) {
        PreparedSink<?> sink = sinks.prepare(sinkType, sinkParams);
        String jobId = UUID.randomUUID().toString();
        var job = new Job(jobId, describe(sinkType, sinkParams), clock);
        jobs.put(jobId, job);
        DatasetSnapshot pinned = datasets.pin();
        try {
            pool.execute(() -> run(job, pinned, datasetName, recipe, sink, projectRecipes));
        } catch (RejectedExecutionException e) {
            pinned.close();
            jobs.remove(jobId);
            throw new JobQueueFullException(config.maxConcurrentJobs(), config.jobQueueCapacity());
        }
        log.info("Started job {}: export {} to {}", jobId, datasetName, sinkType);
        return jobId;
    }

    // Staged files stay pinned until the sink is done; they are unpinned before the job turns terminal.
    private void run(Job job, DatasetSnapshot pinned, String datasetName, Recipe recipe, PreparedSink<?> sink,
                     Map<String, Recipe> projectRecipes) {
        WriteResult result;
        try (pinned) {
            LazyPlan plan = engine.prepareFull(pinned, datasetName, recipe, projectRecipes, null);
            result = sink.write(plan);
            if (!result.success()) {
                throw new JobExecutionException(job.jobId(), result.error());
            }
        } catch (Throwable e) {
            var failure = e instanceof JobExecutionException j ? j : new JobExecutionException(job.jobId(), rootCause(e));
            job.markFailed(failure.getMessage());
            log.error("Job {} failed: {}", job.jobId(), failure.getMessage(), e);
            if (e instanceof VirtualMachineError fatal) {
                throw fatal;
            }
            return;
        }
        job.markCompleted(ByteSizes.humanReadable(result.bytesWritten()));
        log.info("Job {} completed in {} ms ({})", job.jobId(),
            job.snapshot().duration().toMillis(), job.snapshot().sizeSummary());
    }

    /** Snapshot of the job, or empty when the id is unknown. Never blocks on the worker. */
    public Optional<JobInfo> status(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(Job::snapshot);
    }

    /** All known jobs, oldest first. */
    public List<JobInfo> allJobs() {
        return jobs.values().stream()
            .map(Job::snapshot)
            .sorted(Comparator.comparing(JobInfo::startedAt))
            .toList();
    }

    /**
     * Wait until the job reaches a terminal state or the timeout elapses.
     *
     * @return the last snapshot seen, or empty for an unknown id
     */
    public Optional<JobInfo> awaitTermination(String jobId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        Optional<JobInfo> info = status(jobId);
        while (info.isPresent() && !info.get().status().isTerminal() && System.nanoTime() < deadline) {
            Thread.sleep(20);
            info = status(jobId);
        }
        return info;
    }

    /** Stop accepting jobs and wait briefly for running ones. */
    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Export workers still running after shutdown timeout");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Throwable rootCause(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t;
    }

    private static String describe(String sinkType, Map<String, Object> params) {
        Object path = params == null ? null : params.get("path");
        return path == null ? sinkType : "%s:%s".formatted(sinkType, path);
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return r -> {
            var t = new Thread(r, "dataprep-export-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
