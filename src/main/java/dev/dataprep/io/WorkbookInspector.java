package dev.dataprep.io;

import dev.dataprep.model.WorkbookMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Reads sheet and table names from OOXML workbooks without touching cell data, and remembers the
 * answer per absolute path for the life of this instance. Unreadable or unsupported files get
 * {@link WorkbookMetadata#fallback()}; sheet discovery is advisory, so this never throws.
 */
public final class WorkbookInspector {

    static final Set<String> SPREADSHEET_EXTENSIONS = Set.of(".xlsx", ".xlsm", ".xls", ".xlsb");

    private static final Logger log = LoggerFactory.getLogger(WorkbookInspector.class);
    private static final Set<String> OOXML_EXTENSIONS = Set.of(".xlsx", ".xlsm");
    private static final String WORKBOOK_PART = "xl/workbook.xml";
    private static final String TABLES_PREFIX = "xl/tables/";

    private final PathResolver resolver;
    private final XMLInputFactory xml;
    private final Map<Path, WorkbookMetadata> cache = new ConcurrentHashMap<>();

    public WorkbookInspector(PathResolver resolver) {
        this.resolver = resolver;
        this.xml = XMLInputFactory.newFactory();
        xml.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        xml.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    }

    /**
     * @param path a workbook file, or a glob/directory whose first match is inspected
     */
    public WorkbookMetadata metadata(String path) {
        List<String> files;
        try {
            files = resolver.resolve(path, List.of(), 1);
        } catch (RuntimeException e) {
            log.debug("Could not resolve workbook path {}: {}", path, e.toString());
            return WorkbookMetadata.fallback();
        }
        if (files.isEmpty()) {
            return WorkbookMetadata.fallback();
        }
        Path target = Path.of(files.get(0)).toAbsolutePath().normalize();
        if (!Files.isRegularFile(target) || !OOXML_EXTENSIONS.contains(FileLoader.extension(target))) {
            return WorkbookMetadata.fallback();
        }
        return cache.computeIfAbsent(target, this::read);
    }

    public List<String> sheetNames(String path) {
        return metadata(path).sheetNames();
    }

    public List<String> tableNames(String path) {
        return metadata(path).tableNames();
    }

    public void invalidate(String path) {
        cache.remove(Path.of(path).toAbsolutePath().normalize());
    }

    public void clear() {
        cache.clear();
    }

    int cachedEntries() {
        return cache.size();
    }

    // One pass over the zip entries: sheet names from the workbook part, table names from table parts.
    private WorkbookMetadata read(Path file) {
        var sheets = new ArrayList<String>();
        var tables = new ArrayList<String>();
        try (var zip = new ZipFile(file.toFile())) {
            var entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                String name = entry.getName();
                if (name.equals(WORKBOOK_PART)) {
                    readAttribute(zip, entry, "sheet", "name", sheets::add);
                } else if (name.startsWith(TABLES_PREFIX) && name.endsWith(".xml")
                        && name.indexOf('/', TABLES_PREFIX.length()) < 0) {
                    readAttribute(zip, entry, "table", "displayName", tables::add);
                }
            }
        } catch (IOException | XMLStreamException | RuntimeException e) {
            log.debug("Could not read workbook structure of {}: {}", file, e.toString());
            return WorkbookMetadata.fallback();
        }
        Collections.sort(tables);
        return new WorkbookMetadata(
            sheets.isEmpty() ? List.of(WorkbookMetadata.DEFAULT_SHEET) : sheets,
            tables,
            true);
    }

    private void readAttribute(ZipFile zip, ZipEntry entry, String element, String attribute,
                               Consumer<String> sink) throws IOException, XMLStreamException {
        try (InputStream in = zip.getInputStream(entry)) {
            XMLStreamReader reader = xml.createXMLStreamReader(in);
            try {
                while (reader.hasNext()) {
                    if (reader.next() == XMLStreamConstants.START_ELEMENT
                            && element.equals(reader.getLocalName())) {
                        String value = reader.getAttributeValue(null, attribute);
                        if (value == null && "table".equals(element)) {
                            value = reader.getAttributeValue(null, "name");
                        }
                        if (value != null) {
                            sink.accept(value);
                        }
                    }
                }
            } finally {
                reader.close();
            }
        }
    }
}
