package com.elime.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Folder checks and photo listing shared by the commands.
 */
public final class PhotoFolders {

    private PhotoFolders() {
    }

    public static Path requireDirectory(String configured, String key) {
        if (configured == null || configured.isBlank()) {
            throw new InvalidConfigurationException(key, "not set");
        }
        Path folder = Path.of(configured);
        if (!Files.isDirectory(folder)) {
            throw new InvalidConfigurationException(key, "'" + configured + "' is not a directory");
        }
        return folder;
    }

    /**
     * File names of the JPEG photos directly inside {@code folder}, sorted by name.
     */
    public static List<String> listPhotos(Path folder) {
        try (Stream<Path> files = Files.list(folder)) {
            return files
                .filter(Files::isRegularFile)
                .map(file -> file.getFileName().toString())
                .filter(PhotoFolders::isPhoto)
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list " + folder, e);
        }
    }

    static boolean isPhoto(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".jpg") || lower.endsWith(".jpeg");
    }
}
