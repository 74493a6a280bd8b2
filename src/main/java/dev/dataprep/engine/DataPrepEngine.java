package dev.dataprep.engine;

import dev.dataprep.io.EncodingService;
import dev.dataprep.io.FileLoader;
import dev.dataprep.io.LoadRequest;
import dev.dataprep.io.LoadedSource;
import dev.dataprep.io.PathResolver;
import dev.dataprep.io.StagingArea;
import dev.dataprep.io.WorkbookInspector;
import dev.dataprep.jobs.JobManager;
import dev.dataprep.model.EngineConfig;
import dev.dataprep.model.Recipe;
import dev.dataprep.plan.Frame;
import dev.dataprep.sink.SinkRegistry;
import dev.dataprep.steps.BuiltinSteps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * One data-prep engine: every registry, service and worker pool it needs, owned by this object.
 * Two engines in the same process share nothing.
 */
public final class DataPrepEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DataPrepEngine.class);

    private final EngineConfig config;
    private final StagingArea staging;
    private final PathResolver resolver;
    private final EncodingService encoding;
    private final WorkbookInspector workbooks;
    private final FileLoader loader;
    private final StepRegistry steps;
    private final DatasetRegistry datasets;
    private final RecipeBook recipes;
    private final ExecutionEngine execution;
    private final SinkRegistry sinks;
    private final JobManager jobs;

    private DataPrepEngine(EngineConfig config, StagingArea staging, PathResolver resolver) {
        this.config = config;
        this.staging = staging;
        this.resolver = resolver;
        this.encoding = new EncodingService(staging, config);
        this.workbooks = new WorkbookInspector(resolver);
        this.loader = new FileLoader(resolver, encoding);
        this.steps = new StepRegistry();
        BuiltinSteps.registerAll(steps);
        this.datasets = new DatasetRegistry();
        this.recipes = new RecipeBook();
        this.execution = new ExecutionEngine(steps, datasets, config);
        this.sinks = SinkRegistry.withBuiltins();
        this.jobs = new JobManager(execution, datasets, sinks, config);
    }

    public static DataPrepEngine create(EngineConfig config) throws IOException {
        return create(config, System.getenv());
    }

    /**
     * @param env environment used to locate the staging directory when the config names none
     */
    public static DataPrepEngine create(EngineConfig config, Map<String, String> env) throws IOException {
        StagingArea staging = StagingArea.fromConfig(config, env);
        int swept = staging.cleanup(config.stagingMaxAge());
        if (swept > 0) {
            log.info("Removed {} stale staging folder(s) from {}", swept, staging.root());
        }
        return new DataPrepEngine(config, staging, new PathResolver());
    }

    /** Load files and register them as {@code name}, replacing any dataset of that name. */
    public Dataset load(String name, LoadRequest request) {
        LoadedSource source = loader.load(request);
        return datasets.add(name, source.plan(), source.metadata(), source.stagedFiles());
    }

    /** Preview {@code name} with its recipe from the recipe book. */
    public Frame preview(String name) {
        return execution.preview(name, recipes.get(name), recipes.snapshot());
    }

    public List<String> transformedSchema(String name) {
        return execution.transformedSchema(name, recipes.get(name), recipes.snapshot());
    }

    /** Export {@code name} with its recipe from the recipe book. */
    public String startExport(String name, String sinkType, Map<String, Object> sinkParams) {
        return jobs.startExport(name, recipes.get(name), sinkType, sinkParams, recipes.snapshot());
    }

    public List<String> validate(Recipe recipe) {
        return RecipeValidator.validate(recipe, steps);
    }

    public EngineConfig config() { return config; }
    public StagingArea staging() { return staging; }
    public PathResolver resolver() { return resolver; }
    public EncodingService encoding() { return encoding; }
    public WorkbookInspector workbooks() { return workbooks; }
    public FileLoader loader() { return loader; }
    public StepRegistry steps() { return steps; }
    public DatasetRegistry datasets() { return datasets; }
    public RecipeBook recipes() { return recipes; }
    public ExecutionEngine execution() { return execution; }
    public SinkRegistry sinks() { return sinks; }
    public JobManager jobs() { return jobs; }

    /** Shut the export pool down and release every staged file. */
    @Override
    public void close() {
        jobs.close();
        datasets.clear();
        workbooks.clear();
    }
}
