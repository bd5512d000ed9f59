package com.handyhub.bookingservice.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;

/**
 * Creates the parent directory of a file-backed SQLite URL before the first connection opens.
 */
@Component
public class DatabaseDirectoryInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseDirectoryInitializer.class);
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    public void ensureDirectoryFor(String jdbcUrl) {
        File dataDir = resolveDirectory(jdbcUrl);
        if (dataDir == null) {
            return;
        }
        if (dataDir.exists()) {
            logger.debug("[DatabaseDirectoryInitializer] Data directory already exists: {}", dataDir.getAbsolutePath());
            return;
        }
        if (dataDir.mkdirs()) {
            logger.info("[DatabaseDirectoryInitializer] Created data directory: {}", dataDir.getAbsolutePath());
        } else {
            throw new IllegalStateException("Failed to create data directory: " + dataDir.getAbsolutePath());
        }
    }

    static File resolveDirectory(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith(SQLITE_PREFIX)) {
            return null;
        }
        String path = jdbcUrl.substring(SQLITE_PREFIX.length());
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (path.isEmpty() || path.startsWith(":memory:") || path.startsWith("file:")) {
            return null;
        }
        return new File(path).getAbsoluteFile().getParentFile();
    }
}
