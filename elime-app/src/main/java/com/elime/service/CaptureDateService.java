package com.elime.service;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Works out when a photo was taken: EXIF DateTimeOriginal first, then a
 * timestamp encoded in the file name, then the file's modification time.
 */
@Service
public class CaptureDateService {

    private static final Logger log = LoggerFactory.getLogger(CaptureDateService.class);

    static final DateTimeFormatter EXIF_FORMAT = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    /**
     * @param fileNamePattern pattern for the file name without extension; blank to skip
     */
    public LocalDateTime captureTime(Path file, String fileNamePattern) {
        LocalDateTime exif = fromExif(file);
        if (exif != null) {
            return exif;
        }
        LocalDateTime named = fromFileName(file.getFileName().toString(), fileNamePattern);
        if (named != null) {
            return named;
        }
        try {
            log.debug("Using modification time for {}", file);
            return LocalDateTime.ofInstant(Files.getLastModifiedTime(file).toInstant(), ZoneId.systemDefault());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read modification time of " + file, e);
        }
    }

    LocalDateTime fromExif(Path file) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(file.toFile());
        } catch (ImageProcessingException e) {
            log.debug("No readable metadata in {}: {}", file, e.getMessage());
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        }
        ExifSubIFDDirectory exif = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        if (exif == null) {
            return null;
        }
        String original = exif.getString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL);
        if (original == null) {
            return null;
        }
        try {
            return LocalDateTime.parse(original.trim(), EXIF_FORMAT);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable DateTimeOriginal '{}' in {}", original, file);
            return null;
        }
    }

    static LocalDateTime fromFileName(String fileName, String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return null;
        }
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        try {
            return LocalDateTime.parse(baseName, DateTimeFormatter.ofPattern(pattern));
        } catch (DateTimeParseException e) {
            log.debug("{} does not match '{}'", fileName, pattern);
            return null;
        }
    }
}
