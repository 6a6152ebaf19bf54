package com.elime.service;

import com.elime.config.ElimeProperties;
import com.elime.model.PhotoRecord;
import com.elime.model.RenderJob;
import com.elime.repository.EyePositionRepository;
import com.elime.service.correction.EyeDisplay;
import com.elime.service.correction.InputEvent;
import com.elime.service.correction.Key;
import com.elime.service.render.FrameRenderer;
import com.elime.service.render.FrameSettings;
import com.elime.service.render.TimelapseScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Font;
import java.awt.FontFormatException;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.List;
import java.util.Locale;

/**
 * The {@code render} command: writes one aligned, dated frame per scheduled
 * job into the target folder.
 */
@Service
public class RenderService {

    private static final Logger log = LoggerFactory.getLogger(RenderService.class);

    static final String PREVIEW_WINDOW = "Render";

    private final EyePositionRepository repository;
    private final TimelapseScheduler scheduler;
    private final FrameRenderer renderer;
    private final ImageService images;
    private final ElimeProperties properties;

    public RenderService(EyePositionRepository repository, TimelapseScheduler scheduler, FrameRenderer renderer,
                         ImageService images, ElimeProperties properties) {
        this.repository = repository;
        this.scheduler = scheduler;
        this.renderer = renderer;
        this.images = images;
        this.properties = properties;
    }

    /**
     * @param display preview display; only used when previewing is switched on
     */
    public CommandOutcome render(EyeDisplay display) {
        ElimeProperties.Render config = properties.getRender();
        Path photoFolder = PhotoFolders.requireDirectory(properties.getPhotoFolder(), "elime.photo-folder");
        Path targetFolder = PhotoFolders.requireDirectory(properties.getTargetFolder(), "elime.target-folder");
        if (photoFolder.toAbsolutePath().normalize().equals(targetFolder.toAbsolutePath().normalize())) {
            throw new InvalidConfigurationException("elime.target-folder", "must differ from the photo folder");
        }
        FrameSettings settings = frameSettings(config);
        repository.createTableIfMissing();

        List<PhotoRecord> records = repository.findAllOrderByCaptureDate();
        if (records.isEmpty()) {
            log.error("Database is empty, nothing to render");
            return CommandOutcome.done(0);
        }
        requirePhotos(photoFolder, records);

        List<RenderJob> jobs = scheduler.schedule(records, config.getMode());
        log.info("Rendering {} frames in {} mode to {}", jobs.size(), config.getMode(), targetFolder);

        String loadedName = null;
        BufferedImage loaded = null;
        int written = 0;
        for (RenderJob job : jobs) {
            String name = job.sourceRecord().fileName();
            if (!name.equals(loadedName)) {
                loaded = images.load(photoFolder.resolve(name));
                loadedName = name;
            }
            BufferedImage frame = renderer.render(loaded, job, settings);

            if (config.isShow()) {
                display.showFrame(PREVIEW_WINDOW, frame);
                InputEvent event = EyeDisplay.nextAcknowledgement(display, PREVIEW_WINDOW);
                if (event.isKey(Key.QUIT)) {
                    display.close(PREVIEW_WINDOW);
                    log.info("Quit after {} frames", written);
                    return CommandOutcome.cancelled(written);
                }
            }
            images.writeJpeg(frame, targetFolder.resolve(job.outputFileName()));
            written++;
            log.debug("Wrote {} from {} at brightness {}", job.outputFileName(), name, job.brightness());
        }
        if (config.isShow()) {
            display.close(PREVIEW_WINDOW);
        }
        log.info("Rendered {} frames", written);
        return CommandOutcome.done(written);
    }

    /**
     * Fails before anything is written if a photo with eye positions is gone.
     */
    static void requirePhotos(Path photoFolder, List<PhotoRecord> records) {
        for (PhotoRecord record : records) {
            if (!record.isComplete()) {
                continue;
            }
            Path file = photoFolder.resolve(record.fileName());
            if (!Files.isRegularFile(file)) {
                log.error("{} is in the database but missing on disk", file);
                throw new ResourceMissingException("Photo referenced by database is missing", file);
            }
        }
    }

    static FrameSettings frameSettings(ElimeProperties.Render config) {
        Locale locale = Locale.forLanguageTag(config.getLocale());
        DateTimeFormatter dateFormat = config.getDatePattern() == null || config.getDatePattern().isBlank()
            ? DateTimeFormatter.ofLocalizedDate(FormatStyle.SHORT).withLocale(locale)
            : DateTimeFormatter.ofPattern(config.getDatePattern(), locale);
        return new FrameSettings(config.getOffsetX(), config.getOffsetY(), config.getWidth(), config.getHeight(),
            loadFont(config.getFontPath(), config.getFontSize()), dateFormat, config.isPositionDebug());
    }

    static Font loadFont(String fontPath, int size) {
        if (fontPath == null || fontPath.isBlank()) {
            return null;
        }
        Path file = Path.of(fontPath);
        if (!Files.isRegularFile(file)) {
            throw new InvalidConfigurationException("elime.render.font-path", "'" + fontPath + "' is not a file");
        }
        try {
            return Font.createFont(Font.TRUETYPE_FONT, file.toFile()).deriveFont((float) size);
        } catch (FontFormatException e) {
            throw new InvalidConfigurationException("elime.render.font-path", "not a TrueType font: " + e.getMessage());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read font " + file, e);
        }
    }
}
