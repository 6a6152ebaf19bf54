package com.elime.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class CaptureDateServiceTest {

    private static final LocalDateTime MODIFIED = LocalDateTime.of(2023, 7, 14, 18, 5, 9);

    @TempDir
    Path folder;

    private CaptureDateService service;

    @BeforeEach
    void setUp() {
        service = new CaptureDateService();
    }

    private Path touch(Path file) throws IOException {
        Files.setLastModifiedTime(file, FileTime.from(MODIFIED.atZone(ZoneId.systemDefault()).toInstant()));
        return file;
    }

    @Nested
    @DisplayName("captureTime")
    class CaptureTime {

        @Test
        void fallsBackToModificationTimeForJpegWithoutExif() throws IOException {
            Path file = folder.resolve("plain.jpg");
            ImageIO.write(new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB), "jpg", file.toFile());
            touch(file);

            assertThat(service.captureTime(file, "")).isEqualTo(MODIFIED);
        }

        @Test
        void fallsBackToModificationTimeForUnreadableFile() throws IOException {
            Path file = touch(Files.writeString(folder.resolve("broken.jpg"), "not an image"));

            assertThat(service.captureTime(file, null)).isEqualTo(MODIFIED);
        }

        @Test
        void prefersTimestampInFileName() throws IOException {
            Path file = touch(Files.writeString(folder.resolve("20240301_081500.jpg"), "x"));

            assertThat(service.captureTime(file, "yyyyMMdd_HHmmss"))
                .isEqualTo(LocalDateTime.of(2024, 3, 1, 8, 15));
        }
    }

    @Nested
    @DisplayName("fromFileName")
    class FromFileName {

        @Test
        void ignoresBlankPattern() {
            assertThat(CaptureDateService.fromFileName("20240301_081500.jpg", " ")).isNull();
        }

        @Test
        void returnsNullWhenNameDoesNotMatch() {
            assertThat(CaptureDateService.fromFileName("holiday.jpg", "yyyyMMdd_HHmmss")).isNull();
        }
    }
}
