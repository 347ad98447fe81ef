package io.codescalpel.license;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Writes the cache file to a temporary sibling and renames it over the target.
 *
 * <p>Some network-backed and container bind mounts intermittently report a
 * freshly written temp file as missing at rename time. The rename is retried
 * with a short linear backoff; if every attempt fails the last error is thrown
 * so the caller can fall back to another strategy.
 */
public class AtomicRenameCacheWriter implements CacheWriter {

    private static final Logger LOG = Logger.getLogger(AtomicRenameCacheWriter.class.getName());

    public static final int DEFAULT_ATTEMPTS = 5;
    public static final Duration DEFAULT_BACKOFF = Duration.ofMillis(20);

    private final int attempts;
    private final Duration backoff;

    public AtomicRenameCacheWriter() {
        this(DEFAULT_ATTEMPTS, DEFAULT_BACKOFF);
    }

    public AtomicRenameCacheWriter(int attempts, Duration backoff) {
        this.attempts = Math.max(1, attempts);
        this.backoff = backoff;
    }

    @Override
    public void write(Path target, String content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            IOException last = null;
            for (int attempt = 0; attempt < attempts; attempt++) {
                try {
                    move(tmp, target);
                    return;
                } catch (IOException e) {
                    last = e;
                    LOG.fine("Cache rename attempt " + (attempt + 1) + " failed: " + e.getClass().getSimpleName());
                    if (attempt < attempts - 1 && !pause(attempt)) {
                        break;
                    }
                }
            }
            throw last;
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Move the temp file over the target.
     */
    protected void move(Path source, Path target) throws IOException {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    private boolean pause(int attempt) {
        try {
            Thread.sleep(backoff.toMillis() * (attempt + 1));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
