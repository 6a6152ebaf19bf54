package com.elime.service;

import com.elime.config.ElimeProperties;
import com.elime.model.Cascade;
import com.elime.model.ParameterSet;
import com.elime.model.PhotoRecord;
import com.elime.model.Point;
import com.elime.model.Rectangle;
import com.elime.repository.EyePositionRepository;
import com.elime.service.correction.CoarseState;
import com.elime.service.correction.CorrectionResult;
import com.elime.service.correction.CorrectionService;
import com.elime.service.correction.EyeDisplay;
import com.elime.service.correction.EyeList;
import com.elime.service.correction.SessionStatus;
import com.elime.service.correction.ZoomSettings;
import com.elime.service.detection.CascadeDetector;
import com.elime.service.detection.DetectionListener;
import com.elime.service.detection.DetectorProvider;
import com.elime.service.detection.DetectorProviderFactory;
import com.elime.service.detection.EyeDetection;
import com.elime.service.detection.EyeDetectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * The {@code add} and {@code check} commands: detect or load eye positions,
 * let the operator correct them and store the result, one photo at a time.
 */
@Service
public class EyeCollectionService {

    private static final Logger log = LoggerFactory.getLogger(EyeCollectionService.class);

    static final String DETECTION_WINDOW = "Detection";

    private final EyePositionRepository repository;
    private final ConsistencyService consistency;
    private final ImageService images;
    private final CaptureDateService captureDates;
    private final EyeDetectionService detection;
    private final DetectorProviderFactory detectors;
    private final CorrectionService correction;
    private final TransactionTemplate transactionTemplate;
    private final ElimeProperties properties;

    public EyeCollectionService(EyePositionRepository repository, ConsistencyService consistency,
                                ImageService images, CaptureDateService captureDates,
                                EyeDetectionService detection, DetectorProviderFactory detectors,
                                CorrectionService correction, TransactionTemplate transactionTemplate,
                                ElimeProperties properties) {
        this.repository = repository;
        this.consistency = consistency;
        this.images = images;
        this.captureDates = captureDates;
        this.detection = detection;
        this.detectors = detectors;
        this.correction = correction;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
    }

    /**
     * Processes every photo that has no record yet, or one without eyes.
     */
    public CommandOutcome add(EyeDisplay display) {
        Path photoFolder = PhotoFolders.requireDirectory(properties.getPhotoFolder(), "elime.photo-folder");
        repository.createTableIfMissing();

        List<String> photos = PhotoFolders.listPhotos(photoFolder);
        if (!consistency.folderCoversStore(photos.size())) {
            return CommandOutcome.done(0);
        }

        Path cascadeFolder = Path.of(properties.getDetection().getCascadeFolder());
        ZoomSettings zoom = new ZoomSettings();
        int added = 0;
        try (DetectorProvider provider = detectors.open(cascadeFolder)) {
            for (String name : photos) {
                Optional<PhotoRecord> existing = consistency.findSingle(name);
                if (existing.isPresent() && existing.get().isComplete()) {
                    continue;
                }
                log.info("Processing {}", name);
                Path file = photoFolder.resolve(name);
                CorrectionResult result = locateAndCorrect(display, provider, file, name, zoom);
                if (result.isCancelled()) {
                    log.info("Quit after adding {} photos", added);
                    return CommandOutcome.cancelled(added);
                }
                store(file, name, existing.isPresent(), result);
                added++;
            }
        }
        log.info("Added {} photos", added);
        return CommandOutcome.done(added);
    }

    /**
     * Walks stored photos again so the operator can fix their eye positions.
     *
     * @param beginWith file name to start at, or null for the first photo
     */
    public CommandOutcome check(EyeDisplay display, String beginWith) {
        Path photoFolder = PhotoFolders.requireDirectory(properties.getPhotoFolder(), "elime.photo-folder");
        repository.createTableIfMissing();

        List<String> photos = PhotoFolders.listPhotos(photoFolder);
        int start = 0;
        if (beginWith != null) {
            start = photos.indexOf(beginWith);
            if (start < 0) {
                log.error("{} is not in {}", beginWith, photoFolder);
                return CommandOutcome.done(0);
            }
        }

        ZoomSettings zoom = new ZoomSettings();
        int checked = 0;
        for (String name : photos.subList(start, photos.size())) {
            Optional<PhotoRecord> stored = consistency.findSingle(name);
            if (stored.isEmpty()) {
                log.error("{} is not in the database, run add first", name);
                continue;
            }
            if (!stored.get().isComplete()) {
                log.warn("{} has no eye positions yet, run add first", name);
                continue;
            }
            log.info("Checking {}", name);
            CorrectionResult result = recheck(display, photoFolder.resolve(name), name, stored.get(), zoom);
            if (result.isCancelled()) {
                log.info("Quit after checking {} photos", checked);
                return CommandOutcome.cancelled(checked);
            }
            transactionTemplate.executeWithoutResult(status ->
                repository.updateEyes(name, result.leftEye(), result.rightEye()));
            checked++;
        }
        log.info("Checked {} photos", checked);
        return CommandOutcome.done(checked);
    }

    private CorrectionResult locateAndCorrect(EyeDisplay display, DetectorProvider provider, Path file, String name,
                                              ZoomSettings zoom) {
        BufferedImage nativeImage = images.load(file);
        CoordinateMapper mapper = CoordinateMapper.forImage(
            nativeImage.getWidth(), nativeImage.getHeight(), properties.getMaxSize());
        BufferedImage working = images.workingCopy(nativeImage, mapper);

        DetectionListener listener = properties.getDetection().isDebug()
            ? new ShowingDetectionListener(display, working)
            : DetectionListener.NONE;
        EyeDetection found;
        try (CascadeDetector detector = provider.detectorFor(working)) {
            found = detection.locateEyes(working.getWidth(), working.getHeight(), detector, listener);
        }
        log.info("Found {} eyes in {}", found.eyeCenters().size(), name);

        CoarseState coarse = correction.correctCoarse(display, name, working, EyeList.of(found.eyeCenters()));
        if (coarse.status() == SessionStatus.CANCELLED) {
            return CorrectionResult.cancelled();
        }
        Point left = mapper.toNative(coarse.eyes().get(0));
        Point right = mapper.toNative(coarse.eyes().get(1));
        return correction.refine(display, name, nativeImage, left, right, zoom, properties.getZoomSize());
    }

    private CorrectionResult recheck(EyeDisplay display, Path file, String name, PhotoRecord record,
                                     ZoomSettings zoom) {
        BufferedImage nativeImage = images.load(file);
        Point left = record.leftEye();
        Point right = record.rightEye();

        if (!properties.getCheck().isDetailOnly()) {
            CoordinateMapper mapper = CoordinateMapper.forImage(
                nativeImage.getWidth(), nativeImage.getHeight(), properties.getMaxSize());
            BufferedImage working = images.workingCopy(nativeImage, mapper);
            EyeList storedEyes = EyeList.of(mapper.toWorking(left), mapper.toWorking(right));
            CoarseState coarse = correction.correctCoarse(display, name, working, storedEyes);
            if (coarse.status() == SessionStatus.CANCELLED) {
                return CorrectionResult.cancelled();
            }
            // Untouched points keep their native precision
            if (!coarse.eyes().equals(storedEyes)) {
                left = mapper.toNative(coarse.eyes().get(0));
                right = mapper.toNative(coarse.eyes().get(1));
            }
        }
        return correction.refine(display, name, nativeImage, left, right, zoom, properties.getZoomSize());
    }

    private void store(Path file, String name, boolean exists, CorrectionResult result) {
        if (exists) {
            transactionTemplate.executeWithoutResult(status ->
                repository.updateEyes(name, result.leftEye(), result.rightEye()));
            log.info("Updated {}", name);
            return;
        }
        PhotoRecord record = new PhotoRecord(name,
            captureDates.captureTime(file, properties.getCustomDateFormat()),
            result.leftEye(), result.rightEye());
        transactionTemplate.executeWithoutResult(status -> repository.insert(record));
        log.info("Stored {}", name);
    }

    /**
     * Shows every detection pass and waits for a key before going on.
     */
    private static final class ShowingDetectionListener implements DetectionListener {

        private final EyeDisplay display;
        private final BufferedImage image;

        ShowingDetectionListener(EyeDisplay display, BufferedImage image) {
            this.display = display;
            this.image = image;
        }

        @Override
        public void onPass(Cascade cascade, ParameterSet parameters, Rectangle region, List<Rectangle> found) {
            List<Rectangle> placed = found.stream().map(r -> r.relativeTo(region)).toList();
            if (cascade == Cascade.FRONTAL_FACE) {
                display.showDetection(DETECTION_WINDOW, image, placed, null, List.of());
            } else {
                display.showDetection(DETECTION_WINDOW, image, List.of(), region, placed);
            }
            EyeDisplay.nextAcknowledgement(display, DETECTION_WINDOW);
        }

        @Override
        public void onResult(EyeDetection result) {
            display.showDetection(DETECTION_WINDOW, image, result.faces(), result.biggestFace(), result.eyes());
            EyeDisplay.nextAcknowledgement(display, DETECTION_WINDOW);
            display.close(DETECTION_WINDOW);
        }
    }
}
