package com.handyhub.bookingservice.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class DatabaseDirectoryInitializerTest {

    @TempDir
    Path tempDir;

    @Test
    void createsParentOfFileUrl() {
        File target = tempDir.resolve("nested/deeper/booking.db").toFile();

        new DatabaseDirectoryInitializer().ensureDirectoryFor("jdbc:sqlite:" + target.getAbsolutePath() + "?journal_mode=WAL");

        assertThat(target.getParentFile()).isDirectory();
    }

    @Test
    void ignoresMemoryAndForeignUrls() {
        assertThat(DatabaseDirectoryInitializer.resolveDirectory("jdbc:sqlite::memory:")).isNull();
        assertThat(DatabaseDirectoryInitializer.resolveDirectory("jdbc:postgresql://localhost/booking")).isNull();
        assertThat(DatabaseDirectoryInitializer.resolveDirectory(null)).isNull();
    }
}
