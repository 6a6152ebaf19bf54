package com.elime.service.correction;

import com.elime.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;

/**
 * Drives the correction state machines against a display until the operator
 * commits or quits.
 */
@Service
public class CorrectionService {

    private static final Logger log = LoggerFactory.getLogger(CorrectionService.class);

    public CoarseState correctCoarse(EyeDisplay display, String title, BufferedImage image, EyeList initial) {
        CoarseState state = CoarseCorrection.start(initial, image.getWidth(), image.getHeight());
        display.showCoarse(title, image, state);
        while (state.status() == SessionStatus.ACTIVE) {
            CoarseState next = CoarseCorrection.step(state, display.nextEvent(title));
            if (!next.equals(state)) {
                display.showCoarse(title, image, next);
            }
            state = next;
        }
        display.close(title);
        log.debug("Coarse correction of {} ended {} with {}", title, state.status(), state.eyes());
        return state;
    }

    public FineState correctFine(EyeDisplay display, String title, BufferedImage nativeImage, Point start, int index,
                                 ZoomSettings zoom, int zoomSize) {
        FineState state = FineCorrection.start(start, index, nativeImage.getWidth(), nativeImage.getHeight(),
            zoom, zoomSize);
        display.showFine(title, nativeImage, state);
        while (state.status() == SessionStatus.ACTIVE) {
            FineState next = FineCorrection.step(state, display.nextEvent(title));
            if (!next.equals(state)) {
                display.showFine(title, nativeImage, next);
            }
            state = next;
        }
        zoom.remember(state);
        display.close(title);
        log.debug("Fine correction of {} ended {} at {}", title, state.status(), state.point());
        return state;
    }

    /**
     * Fine-corrects both eyes, left first.
     */
    public CorrectionResult refine(EyeDisplay display, String title, BufferedImage nativeImage,
                                   Point leftEye, Point rightEye, ZoomSettings zoom, int zoomSize) {
        FineState left = correctFine(display, title + " (left eye)", nativeImage, leftEye, 0, zoom, zoomSize);
        if (left.status() == SessionStatus.CANCELLED) {
            return CorrectionResult.cancelled();
        }
        FineState right = correctFine(display, title + " (right eye)", nativeImage, rightEye, 1, zoom, zoomSize);
        if (right.status() == SessionStatus.CANCELLED) {
            return CorrectionResult.cancelled();
        }
        return CorrectionResult.committed(left.point(), right.point());
    }
}
