package dev.dataprep.io;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import dev.dataprep.error.EncodingConversionException;
import dev.dataprep.model.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Detects the byte encoding of text files and re-encodes them to UTF-8 with Unix newlines.
 */
public final class EncodingService {

    public static final String UTF_8 = StandardCharsets.UTF_8.name();

    static final Set<String> TEXT_EXTENSIONS = Set.of(".csv", ".tsv", ".txt", ".json", ".ndjson", ".jsonl");

    private static final Logger log = LoggerFactory.getLogger(EncodingService.class);
    private static final Set<String> UTF8_ALIASES = Set.of("utf-8", "utf8", "us-ascii", "ascii", "utf-8-sig");

    private final StagingArea staging;
    private final long defaultByteBudget;
    private final int minConfidence;
    private final int chunkBytes;
    private final int chunkChars;

    public EncodingService(StagingArea staging, EngineConfig config) {
        this.staging = staging;
        this.defaultByteBudget = config.encodingByteBudget();
        this.minConfidence = config.encodingMinConfidence();
        this.chunkBytes = config.detectionChunkBytes();
        this.chunkChars = config.conversionChunkChars();
    }

    public String detect(Path path) {
        return detect(path, defaultByteBudget);
    }

    /**
     * Sample up to {@code byteBudget} bytes and ask the detector for its best guess. A sample
     * without high-bit bytes is ASCII and needs no guess. Never fails: no answer, a guess below
     * the configured confidence, an unsupported charset or an I/O error all give UTF-8, logged
     * at WARN.
     *
     * @return a Java charset name; ASCII and BOM-marked UTF-8 are reported as UTF-8
     */
    public String detect(Path path, long byteBudget) {
        try {
            byte[] sample = sample(path, byteBudget);
            if (isAscii(sample)) {
                return UTF_8;
            }
            CharsetMatch match = new CharsetDetector().setText(sample).detect();
            if (match == null) {
                log.warn("No encoding guess for {} after {} bytes; assuming UTF-8", path, sample.length);
                return UTF_8;
            }
            if (match.getConfidence() < minConfidence) {
                log.warn("Encoding guess {} for {} has confidence {} (< {}); assuming UTF-8",
                    match.getName(), path, match.getConfidence(), minConfidence);
                return UTF_8;
            }
            return canonicalName(match.getName(), path);
        } catch (IOException | RuntimeException e) {
            log.warn("Encoding detection failed for {}; assuming UTF-8: {}", path, e.toString());
            return UTF_8;
        }
    }

    private byte[] sample(Path path, long byteBudget) throws IOException {
        var sample = new ByteArrayOutputStream();
        try (InputStream in = Files.newInputStream(path)) {
            byte[] buf = new byte[chunkBytes];
            long remaining = byteBudget;
            while (remaining > 0) {
                int n = in.read(buf, 0, (int) Math.min(buf.length, remaining));
                if (n < 0) {
                    break;
                }
                sample.write(buf, 0, n);
                remaining -= n;
            }
        }
        return sample.toByteArray();
    }

    private static boolean isAscii(byte[] bytes) {
        for (byte b : bytes) {
            if (b < 0) {
                return false;
            }
        }
        return true;
    }

    /** Encodings of the text files in {@code files} that are not UTF-8. Other files are skipped. */
    public Map<Path, String> batchDetect(List<Path> files) {
        var result = new LinkedHashMap<Path, String>();
        for (Path f : files) {
            if (!isText(f)) {
                continue;
            }
            String encoding = detect(f);
            if (!UTF_8.equals(encoding)) {
                result.put(f, encoding);
            }
        }
        return result;
    }

    public StagedFile convert(Path source, String sourceEncoding) throws EncodingConversionException {
        return convert(source, sourceEncoding, null);
    }

    /**
     * Write a UTF-8 copy of {@code source} into a fresh staging folder. Undecodable bytes become
     * U+FFFD, CRLF and lone CR become LF, NUL characters and a leading BOM are dropped. On failure
     * the partial copy is deleted before the exception propagates.
     *
     * @param alias optional name for the staging folder, defaults to the file name
     */
    public StagedFile convert(Path source, String sourceEncoding, String alias) throws EncodingConversionException {
        Charset charset = charsetOrUtf8(sourceEncoding);
        StagedFile staged = null;
        try {
            String fileName = source.getFileName().toString();
            staged = staging.stage(alias != null ? alias : fileName, "utf8_" + fileName);
            CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
            try (Reader in = new InputStreamReader(Files.newInputStream(source), decoder);
                 Writer out = Files.newBufferedWriter(staged.path(), StandardCharsets.UTF_8)) {
                normalize(in, out, chunkChars);
            }
            log.debug("Converted {} from {} to {}", source, charset.name(), staged.path());
            return staged;
        } catch (IOException | RuntimeException e) {
            if (staged != null) {
                try {
                    staged.close();
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new EncodingConversionException(source, charset.name(), e);
        }
    }

    /** Copy {@code in} to {@code out} in chunks, translating newlines and dropping NULs and a leading BOM. */
    static void normalize(Reader in, Writer out, int chunkChars) throws IOException {
        char[] buf = new char[chunkChars];
        boolean first = true;
        boolean afterCr = false;
        int n;
        while ((n = in.read(buf)) != -1) {
            int w = 0;
            for (int i = 0; i < n; i++) {
                char c = buf[i];
                if (first) {
                    first = false;
                    if (c == '\uFEFF') {
                        continue;
                    }
                }
                if (afterCr) {
                    afterCr = false;
                    if (c == '\n') {
                        continue;
                    }
                }
                if (c == '\r') {
                    buf[w++] = '\n';
                    afterCr = true;
                } else if (c != '\0') {
                    buf[w++] = c;
                }
            }
            out.write(buf, 0, w);
        }
    }

    static boolean isText(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && TEXT_EXTENSIONS.contains(name.substring(dot));
    }

    private static String canonicalName(String detected, Path path) {
        if (UTF8_ALIASES.contains(detected.toLowerCase(Locale.ROOT))) {
            return UTF_8;
        }
        try {
            return Charset.forName(detected).name();
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.warn("Detected encoding {} for {} is not supported here; assuming UTF-8", detected, path);
            return UTF_8;
        }
    }

    private static Charset charsetOrUtf8(String name) {
        if (name == null || name.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.warn("Encoding '{}' not found, falling back to UTF-8", name);
            return StandardCharsets.UTF_8;
        }
    }
}
