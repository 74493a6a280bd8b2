package dev.dataprep.cli;

import ch.qos.logback.classic.Level;
import dev.dataprep.engine.DataPrepEngine;
import dev.dataprep.engine.RecipeCodec;
import dev.dataprep.engine.StepDefinition;
import dev.dataprep.error.DataPrepException;
import dev.dataprep.io.LoadRequest;
import dev.dataprep.model.EngineConfig;
import dev.dataprep.model.FilterDescriptor;
import dev.dataprep.model.JobInfo;
import dev.dataprep.model.JobStatus;
import dev.dataprep.model.Recipe;
import dev.dataprep.model.WorkbookMetadata;
import dev.dataprep.plan.Frame;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Headless entry point: load files, apply a recipe, then preview or export.
 */
@Command(
    name = "dataprep",
    mixinStandardHelpOptions = true,
    description = "Load tabular files, apply a JSON recipe of steps, and preview or export the result."
)
public class DataPrepCli implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Recipe JSON file (array of steps)")
    private Path recipeFile;

    @Option(names = "--input", description = "Input file, directory or glob pattern")
    private String input;

    @Option(names = "--filter", converter = FilterConverter.class,
        description = "File filter kind:target:value, e.g. glob:filename:*.csv (repeatable)")
    private List<FilterDescriptor> filters = new ArrayList<>();

    @Option(names = "--file-limit", description = "Load at most this many files")
    private Integer fileLimit;

    @Option(names = "--per-file", description = "Apply the recipe to each file separately, then concatenate")
    private boolean perFile;

    @Option(names = "--source-columns", description = "Add __source_path__, __source_name__ and __source_ext__ columns")
    private boolean sourceColumns;

    @Option(names = "--name", defaultValue = "data", description = "Dataset name (default: ${DEFAULT-VALUE})")
    private String name;

    @Option(names = "--preview", description = "Print the first N transformed rows (default when no --output)")
    private Integer preview;

    @Option(names = "--output", description = "Export the transformed dataset to this file")
    private Path output;

    @Option(names = "--format", description = "Export format: csv or ndjson (default: from the output extension)")
    private String format;

    @Option(names = "--list-steps", description = "List available step types")
    private boolean listSteps;

    @Option(names = "--list-files", description = "List the files --input and --filter resolve to")
    private boolean listFiles;

    @Option(names = "--detect-encoding", description = "Print the detected encoding of each input file")
    private boolean detectEncoding;

    @Option(names = "--sheets", description = "Print sheet and table names of an input workbook")
    private boolean sheets;

    @Option(names = "--staging-dir", description = "Directory for staged files")
    private Path stagingDir;

    @Option(names = "--max-jobs", description = "Maximum concurrent export jobs")
    private Integer maxJobs;

    @Option(names = "--verbose", description = "Log resolution and step details")
    private boolean verbose;

    static final int DEFAULT_PREVIEW_ROWS = 10;
    static final Duration EXPORT_TIMEOUT = Duration.ofHours(6);

    /** A command line whose usage errors also exit with 1. */
    public static CommandLine commandLine() {
        var cli = new CommandLine(new DataPrepCli());
        cli.setParameterExceptionHandler((ex, args) -> {
            ex.getCommandLine().getErr().println("Error: " + ex.getMessage());
            ex.getCommandLine().usage(ex.getCommandLine().getErr());
            return 1;
        });
        return cli;
    }

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.dataprep")).setLevel(Level.DEBUG);
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try (DataPrepEngine engine = DataPrepEngine.create(config())) {
            if (listSteps) {
                for (StepDefinition<?> d : engine.steps().definitions()) {
                    out.printf("%-18s %-18s %s%n", d.type(), d.metadata().label(), d.metadata().group());
                }
                return 0;
            }

            if (input == null) {
                err.println("Error: --input is required. Use --help for usage.");
                return 1;
            }

            var request = new LoadRequest(input, filters, fileLimit, perFile, sourceColumns, null);
            if (listFiles) {
                engine.loader().resolveFiles(request).forEach(out::println);
                return 0;
            }
            if (detectEncoding) {
                List<Path> files = engine.loader().resolveFiles(request);
                Map<Path, String> nonUtf8 = engine.encoding().batchDetect(files);
                if (nonUtf8.isEmpty()) {
                    out.printf("All files are UTF-8 (%d checked)%n", files.size());
                }
                nonUtf8.forEach((file, enc) -> out.println(file + ": " + enc));
                return 0;
            }
            if (sheets) {
                WorkbookMetadata meta = engine.workbooks().metadata(input);
                out.println("Sheets: " + String.join(", ", meta.sheetNames()));
                out.println("Tables: " + String.join(", ", meta.tableNames()));
                if (!meta.valid()) {
                    err.println("Warning: workbook could not be read; showing defaults");
                }
                return 0;
            }

            Recipe recipe = recipeFile == null ? Recipe.empty() : RecipeCodec.loadFromFile(recipeFile);
            List<String> problems = engine.validate(recipe);
            if (!problems.isEmpty()) {
                err.println("Recipe is invalid:");
                problems.forEach(p -> err.println("  - " + p));
                return 1;
            }

            engine.load(name, request);
            engine.recipes().put(name, recipe);

            if (output != null) {
                return export(engine, out, err);
            }
            int rows = preview == null ? DEFAULT_PREVIEW_ROWS : preview;
            Frame frame = engine.execution().preview(name, recipe, engine.recipes().snapshot(), rows);
            print(frame, out);
            return 0;
        } catch (DataPrepException | IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Error: interrupted while waiting for export");
            return 1;
        }
    }

    private int export(DataPrepEngine engine, PrintWriter out, PrintWriter err) throws InterruptedException {
        String sinkType = format != null ? format.toLowerCase(Locale.ROOT) : formatFor(output);
        String jobId = engine.startExport(name, sinkType, Map.of("path", output.toString()));
        JobInfo info = engine.jobs().awaitTermination(jobId, EXPORT_TIMEOUT).orElseThrow();
        if (info.status() == JobStatus.COMPLETED) {
            out.printf("Exported %s to %s (%s) in %d ms%n",
                name, output, info.sizeSummary(), info.duration().toMillis());
            return 0;
        }
        err.println("Export " + info.status().name().toLowerCase(Locale.ROOT)
            + (info.errorMessage() == null ? "" : ": " + info.errorMessage()));
        return 1;
    }

    private EngineConfig config() {
        EngineConfig config = EngineConfig.defaults();
        if (stagingDir != null) {
            config = config.withStagingDir(stagingDir);
        }
        if (maxJobs != null) {
            config = config.withJobLimits(maxJobs, config.jobQueueCapacity());
        }
        return config;
    }

    static String formatFor(Path output) {
        String file = output.getFileName().toString().toLowerCase(Locale.ROOT);
        return file.endsWith(".ndjson") || file.endsWith(".jsonl") || file.endsWith(".json") ? "ndjson" : "csv";
    }

    static void print(Frame frame, PrintWriter out) {
        out.println(String.join("\t", frame.columns()));
        for (Map<String, Object> row : frame.rows()) {
            out.println(frame.columns().stream()
                .map(c -> Objects.toString(row.get(c), ""))
                .collect(Collectors.joining("\t")));
        }
        out.printf("(%d row%s)%n", frame.rowCount(), frame.rowCount() == 1 ? "" : "s");
    }

    public static class FilterConverter implements CommandLine.ITypeConverter<FilterDescriptor> {
        @Override
        public FilterDescriptor convert(String value) {
            return FilterDescriptor.parse(value);
        }
    }
}
