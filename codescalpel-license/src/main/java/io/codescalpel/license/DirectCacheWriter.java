package io.codescalpel.license;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes the cache file in place. Not atomic: a concurrent reader may see a
 * truncated file, which loads as an empty cache.
 */
public class DirectCacheWriter implements CacheWriter {

    @Override
    public void write(Path target, String content) throws IOException {
        Files.writeString(target, content, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }
}
