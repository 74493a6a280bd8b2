package dev.dataprep.io;

import dev.dataprep.model.WorkbookMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

class WorkbookInspectorTest {

    private static final String WORKBOOK = """
        <?xml version="1.0" encoding="UTF-8" standalone="yes"?>
        <workbook xmlns="http://schemas.openxmlformats.org/spreadsheetml/2006/main"
                  xmlns:r="http://schemas.openxmlformats.org/officeDocument/2006/relationships">
          <sheets>
            <sheet name="Summary" sheetId="1" r:id="rId1"/>
            <sheet name="Data 2024" sheetId="2" r:id="rId2"/>
          </sheets>
        </workbook>
        """;

    @TempDir
    Path dir;

    private final WorkbookInspector inspector = new WorkbookInspector(new PathResolver());

    @Test
    void readsSheetAndTableNames() throws IOException {
        Path book = workbook("report.xlsx", Map.of(
            "xl/workbook.xml", WORKBOOK,
            "xl/tables/table2.xml", table("Returns"),
            "xl/tables/table1.xml", table("Orders")));

        WorkbookMetadata meta = inspector.metadata(book.toString());

        assertThat(meta.valid()).isTrue();
        assertThat(meta.sheetNames()).containsExactly("Summary", "Data 2024");
        assertThat(meta.tableNames()).containsExactly("Orders", "Returns");
    }

    @Test
    void workbookWithoutSheetsGetsDefaultSheet() throws IOException {
        Path book = workbook("blank.xlsx", Map.of("xl/workbook.xml", "<workbook><sheets/></workbook>"));

        WorkbookMetadata meta = inspector.metadata(book.toString());

        assertThat(meta.valid()).isTrue();
        assertThat(meta.sheetNames()).containsExactly(WorkbookMetadata.DEFAULT_SHEET);
    }

    @Test
    void corruptOrUnsupportedFilesFallBack() throws IOException {
        Path corrupt = dir.resolve("broken.xlsx");
        Files.writeString(corrupt, "not a zip");
        Path legacy = dir.resolve("old.xls");
        Files.writeString(legacy, "binary");

        assertThat(inspector.metadata(corrupt.toString())).isEqualTo(WorkbookMetadata.fallback());
        assertThat(inspector.metadata(legacy.toString())).isEqualTo(WorkbookMetadata.fallback());
        assertThat(inspector.metadata(dir.resolve("missing.xlsx").toString())).isEqualTo(WorkbookMetadata.fallback());
    }

    @Test
    void invalidateDropsCachedEntry() throws IOException {
        Path book = workbook("cached.xlsx", Map.of("xl/workbook.xml", WORKBOOK));

        inspector.metadata(book.toString());
        Files.delete(book);

        assertThat(inspector.sheetNames(book.toString())).isEqualTo(WorkbookMetadata.fallback().sheetNames());
        assertThat(inspector.cachedEntries()).isEqualTo(1);

        inspector.invalidate(book.toString());
        assertThat(inspector.cachedEntries()).isZero();
    }

    @Test
    void cachedAnswerIsReusedWhileFileExists() throws IOException {
        Path book = workbook("stable.xlsx", Map.of("xl/workbook.xml", WORKBOOK));

        var first = inspector.metadata(book.toString());
        var second = inspector.metadata(book.toString());

        assertThat(second).isSameAs(first);
    }

    @Test
    void globResolvesToFirstWorkbook() throws IOException {
        workbook("only.xlsx", Map.of("xl/workbook.xml", WORKBOOK));

        assertThat(inspector.sheetNames(dir + "/*.xlsx")).containsExactly("Summary", "Data 2024");
    }

    private Path workbook(String name, Map<String, String> parts) throws IOException {
        Path file = dir.resolve(name);
        try (OutputStream out = Files.newOutputStream(file); var zip = new ZipOutputStream(out)) {
            for (var part : parts.entrySet()) {
                zip.putNextEntry(new ZipEntry(part.getKey()));
                zip.write(part.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return file;
    }

    private static String table(String displayName) {
        return "<table xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\" id=\"1\" name=\"T\" displayName=\""
            + displayName + "\" ref=\"A1:B2\"/>";
    }
}
