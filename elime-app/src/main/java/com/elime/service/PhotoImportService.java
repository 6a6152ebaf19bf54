package com.elime.service;

import com.elime.config.ElimeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * The {@code pre} command: copies new photos from the source folder into the
 * photo folder under names made from their capture time.
 */
@Service
public class PhotoImportService {

    private static final Logger log = LoggerFactory.getLogger(PhotoImportService.class);

    static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    private final CaptureDateService captureDates;
    private final ElimeProperties properties;

    public PhotoImportService(CaptureDateService captureDates, ElimeProperties properties) {
        this.captureDates = captureDates;
        this.properties = properties;
    }

    public CommandOutcome importPhotos() {
        Path source = PhotoFolders.requireDirectory(properties.getSourceFolder(), "elime.source-folder");
        Path target = PhotoFolders.requireDirectory(properties.getPhotoFolder(), "elime.photo-folder");
        boolean move = properties.getPre().isDelete();

        int imported = 0;
        for (String name : PhotoFolders.listPhotos(source)) {
            Path file = source.resolve(name);
            LocalDateTime taken = captureDates.captureTime(file, properties.getCustomDateFormat());
            Path destination = target.resolve(targetName(properties.getPre().getPrefix(), taken, name));
            if (Files.exists(destination)) {
                log.warn("{} already exists, skipping {}", destination.getFileName(), name);
                continue;
            }
            try {
                if (move) {
                    Files.move(file, destination);
                } else {
                    Files.copy(file, destination, StandardCopyOption.COPY_ATTRIBUTES);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Could not import " + file, e);
            }
            log.info("{} -> {}", name, destination.getFileName());
            imported++;
        }
        log.info("Imported {} photos", imported);
        return CommandOutcome.done(imported);
    }

    static String targetName(String prefix, LocalDateTime taken, String originalName) {
        String extension = originalName.substring(originalName.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
        String stem = taken.format(NAME_FORMAT);
        return (prefix == null || prefix.isBlank() ? stem : prefix + "_" + stem) + "." + extension;
    }
}
