package dev.dataprep.io;

import dev.dataprep.error.DatasetLoadException;
import dev.dataprep.model.EngineConfig;
import dev.dataprep.model.FilterDescriptor;
import dev.dataprep.model.FilterKind;
import dev.dataprep.plan.DatasetPlan;
import dev.dataprep.plan.Frame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileLoaderTest {

    @TempDir
    Path dir;

    private StagingArea staging;
    private FileLoader loader;

    @BeforeEach
    void setUp() throws IOException {
        staging = new StagingArea(dir.resolve("staging"));
        loader = new FileLoader(new PathResolver(), new EncodingService(staging, EngineConfig.defaults()));
        Files.createDirectories(dir.resolve("in"));
    }

    @Test
    void singleCsvFileLoadsAsSinglePlan() throws IOException {
        Path file = write("in/a.csv", "id,name\n1,x\n2,y\n");

        LoadedSource source = loader.load(LoadRequest.of(file.toString()));

        assertThat(source.plan()).isInstanceOf(DatasetPlan.Single.class);
        assertThat(source.metadata().sourceKind()).isEqualTo("file");
        assertThat(source.metadata().inputFormat()).isEqualTo(".csv");
        Frame frame = source.plan().combined().collect();
        assertThat(frame.columns()).containsExactly("id", "name");
        assertThat(frame.column("name")).containsExactly("x", "y");
    }

    @Test
    void directoryIsExpandedAndConcatenatedAcrossSchemas() throws IOException {
        write("in/a.csv", "id,amount\n1,10\n");
        write("in/b.csv", "id,region\n2,EU\n");

        LoadedSource source = loader.load(LoadRequest.of(dir.resolve("in").toString()));

        Frame frame = source.plan().combined().collect();
        assertThat(source.metadata().fileCount()).isEqualTo(2);
        assertThat(frame.columns()).containsExactly("id", "amount", "region");
        assertThat(frame.rowCount()).isEqualTo(2);
        assertThat(frame.row(1).get("amount")).isNull();
    }

    @Test
    void perFileModeKeepsOnePlanPerFile() throws IOException {
        write("in/a.csv", "id\n1\n");
        write("in/b.csv", "id\n2\n");

        LoadedSource source = loader.load(LoadRequest.of(dir.resolve("in").toString()).perFile(true));

        assertThat(source.plan()).isInstanceOf(DatasetPlan.PerFile.class);
        assertThat(source.plan().sources()).hasSize(2);
        assertThat(source.metadata().perFileMode()).isTrue();
    }

    @Test
    void perFileModeWithOneFileIsSingle() throws IOException {
        Path file = write("in/a.csv", "id\n1\n");

        LoadedSource source = loader.load(LoadRequest.of(file.toString()).perFile(true));

        assertThat(source.plan()).isInstanceOf(DatasetPlan.Single.class);
        assertThat(source.metadata().perFileMode()).isFalse();
    }

    @Test
    void sourceColumnsNameTheOriginatingFile() throws IOException {
        Path file = write("in/orders.tsv", "id\tqty\n7\t3\n");

        LoadedSource source = loader.load(LoadRequest.of(file.toString()).withSourceColumns(true));

        Frame frame = source.plan().combined().collect();
        assertThat(frame.columns()).containsExactly(
            "id", "qty", FileLoader.SOURCE_PATH_COLUMN, FileLoader.SOURCE_NAME_COLUMN, FileLoader.SOURCE_EXT_COLUMN);
        assertThat(frame.row(0).get(FileLoader.SOURCE_NAME_COLUMN)).isEqualTo("orders.tsv");
        assertThat(frame.row(0).get(FileLoader.SOURCE_EXT_COLUMN)).isEqualTo(".tsv");
        assertThat(frame.row(0).get("qty")).isEqualTo("3");
    }

    @Test
    void ndjsonFilesAreScanned() throws IOException {
        Path file = write("in/events.ndjson", "{\"id\":1,\"kind\":\"a\"}\n{\"id\":2,\"extra\":true}\n");

        Frame frame = loader.load(LoadRequest.of(file.toString())).plan().combined().collect();

        assertThat(frame.columns()).containsExactly("id", "kind", "extra");
        assertThat(frame.rowCount()).isEqualTo(2);
    }

    @Test
    void nonUtf8FilesAreReadThroughStagedCopy() throws IOException {
        Path file = dir.resolve("in/legacy.csv");
        String text = "city,note\n" + "Zürich,Les élèves de la classe étudient les sciences et la géographie de la région\n".repeat(60);
        Files.write(file, text.getBytes(Charset.forName("windows-1252")));

        LoadedSource source = loader.load(LoadRequest.of(file.toString()));

        Frame frame = source.plan().combined().collect();
        assertThat(frame.row(0).get("city")).isEqualTo("Zürich");
        if (!source.stagedFiles().isEmpty()) {
            assertThat(source.stagedFiles()).allMatch(StagedFile::isOpen);
            assertThat(staging.liveFolders()).hasSize(source.stagedFiles().size());
        }
    }

    @Test
    void filtersAndLimitSelectFiles() throws IOException {
        write("in/keep_1.csv", "v\n1\n");
        write("in/keep_2.csv", "v\n2\n");
        write("in/skip.csv", "v\n3\n");

        var request = LoadRequest.of(dir.resolve("in").toString())
            .withFilters(List.of(FilterDescriptor.filename(FilterKind.CONTAINS, "keep")))
            .withFileLimit(1);
        LoadedSource source = loader.load(request);

        assertThat(source.metadata().fileCount()).isEqualTo(1);
        assertThat(source.metadata().sourcePaths().get(0)).contains("keep_");
    }

    @Test
    void unsupportedFilesAreSkipped() throws IOException {
        write("in/data.csv", "v\n1\n");
        write("in/picture.png", "not data");

        var request = LoadRequest.of(dir.resolve("in").toString())
            .withFilters(List.of(FilterDescriptor.filename(FilterKind.GLOB, "*.*")));
        LoadedSource source = loader.load(request);

        assertThat(source.metadata().sourcePaths()).singleElement().asString().endsWith("data.csv");
    }

    @Test
    void nothingLoadableFails() throws IOException {
        write("in/picture.png", "not data");

        assertThatThrownBy(() -> loader.load(LoadRequest.of(dir.resolve("in/picture.png").toString())))
            .isInstanceOf(DatasetLoadException.class);
        assertThatThrownBy(() -> loader.load(LoadRequest.of(dir.resolve("in/nope.csv").toString())))
            .isInstanceOf(DatasetLoadException.class)
            .hasMessageContaining("No files found");
    }

    @Test
    void resolveFilesExpandsDirectoriesWithoutReading() throws IOException {
        Files.createDirectories(dir.resolve("in/sub"));
        write("in/b.csv", "v\n1\n");
        write("in/a.tsv", "v\n2\n");
        write("in/sub/c.jsonl", "{\"v\": 3}\n");
        write("in/readme.md", "# docs\n");

        List<Path> files = loader.resolveFiles(LoadRequest.of(dir.resolve("in").toString()));
        List<Path> limited = loader.resolveFiles(LoadRequest.of(dir.resolve("in").toString()).withFileLimit(2));

        assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("a.tsv", "b.csv", "c.jsonl");
        assertThat(limited).hasSize(2);
        assertThat(staging.liveFolders()).isEmpty();
    }

    private Path write(String relative, String content) throws IOException {
        Path file = dir.resolve(relative);
        Files.writeString(file, content);
        return file;
    }
}
