package com.elime.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhotoFoldersTest {

    @TempDir
    Path folder;

    @Test
    void listsJpegsOfAnyCaseSortedByName() throws IOException {
        Files.writeString(folder.resolve("b.JPG"), "");
        Files.writeString(folder.resolve("a.jpeg"), "");
        Files.writeString(folder.resolve("c.png"), "");
        Files.createDirectory(folder.resolve("d.jpg"));

        assertThat(PhotoFolders.listPhotos(folder)).containsExactly("a.jpeg", "b.JPG");
    }

    @Test
    void requireDirectoryRejectsUnsetAndMissingFolders() {
        assertThatThrownBy(() -> PhotoFolders.requireDirectory(null, "elime.photo-folder"))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageStartingWith("elime.photo-folder");
        assertThatThrownBy(() -> PhotoFolders.requireDirectory(folder.resolve("x").toString(), "elime.photo-folder"))
            .isInstanceOfSatisfying(InvalidConfigurationException.class,
                e -> assertThat(e.getKey()).isEqualTo("elime.photo-folder"));
    }

    @Test
    void requireDirectoryAcceptsExistingFolder() {
        assertThat(PhotoFolders.requireDirectory(folder.toString(), "elime.photo-folder")).isEqualTo(folder);
    }
}
