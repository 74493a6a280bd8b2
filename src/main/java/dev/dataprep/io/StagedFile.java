package dev.dataprep.io;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handle to one artifact in the {@link StagingArea}. Whoever holds it owns the file;
 * {@link #close()} gives up the owner's reference. Closing twice is harmless.
 *
 * <p>Readers that must outlive the owner take extra references with {@link #retain()} and hand
 * them back with {@link #release()}. The file and its folder are deleted when the last
 * reference goes.
 */
public final class StagedFile implements Closeable {

    private final StagingArea area;
    private final Path path;
    private final AtomicInteger refs = new AtomicInteger(1);
    private final AtomicBoolean ownerClosed = new AtomicBoolean();

    StagedFile(StagingArea area, Path path) {
        this.area = area;
        this.path = path;
    }

    public Path path() {
        return path;
    }

    /** True until the file has been deleted. */
    public boolean isOpen() {
        return refs.get() > 0;
    }

    /** @return false when the file is already gone and nothing was retained */
    public boolean retain() {
        int n;
        do {
            n = refs.get();
            if (n == 0) {
                return false;
            }
        } while (!refs.compareAndSet(n, n + 1));
        return true;
    }

    /** Give back a reference taken with {@link #retain()}. */
    public void release() throws IOException {
        int left = refs.decrementAndGet();
        if (left == 0) {
            area.release(this);
        } else if (left < 0) {
            throw new IllegalStateException("Released more often than retained: " + path);
        }
    }

    @Override
    public void close() throws IOException {
        if (ownerClosed.compareAndSet(false, true)) {
            release();
        }
    }

    @Override
    public String toString() {
        return "StagedFile[" + path + (isOpen() ? "" : ", closed") + "]";
    }
}
