package io.codescalpel.license;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Strategy for writing the verification cache file.
 *
 * @see AtomicRenameCacheWriter
 * @see DirectCacheWriter
 */
@FunctionalInterface
public interface CacheWriter {

    /**
     * Replace the content of {@code target}.
     *
     * @throws IOException if the content could not be written
     */
    void write(Path target, String content) throws IOException;

    /**
     * Atomic temp-file-and-rename, falling back to a direct write when the rename
     * keeps failing.
     */
    static CacheWriter atomicWithFallback() {
        return withFallback(new AtomicRenameCacheWriter(), new DirectCacheWriter());
    }

    /**
     * Try {@code primary}; if it fails, write with {@code fallback}.
     */
    static CacheWriter withFallback(CacheWriter primary, CacheWriter fallback) {
        return (target, content) -> {
            try {
                primary.write(target, content);
            } catch (IOException e) {
                Logger.getLogger(CacheWriter.class.getName()).warning(
                    "Atomic cache write failed (" + e.getClass().getSimpleName()
                        + "), falling back to direct write: " + target);
                fallback.write(target, content);
            }
        };
    }
}
