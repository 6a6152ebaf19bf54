package com.elime.service.correction;

import com.elime.model.Rectangle;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Where correction sessions draw their state and read operator input from.
 * Windows are identified by title and opened on first use.
 */
public interface EyeDisplay extends AutoCloseable {

    void showCoarse(String title, BufferedImage image, CoarseState state);

    /**
     * @param nativeImage the full resolution image; the display crops and zooms
     */
    void showFine(String title, BufferedImage nativeImage, FineState state);

    void showDetection(String title, BufferedImage image, List<Rectangle> faces, Rectangle biggestFace,
                       List<Rectangle> eyes);

    void showFrame(String title, BufferedImage frame);

    /**
     * Blocks until the operator produces the next input in window {@code title}.
     */
    InputEvent nextEvent(String title);

    /**
     * Blocks until the operator acknowledges window {@code title}, skipping
     * pointer presses and moves.
     */
    static InputEvent nextAcknowledgement(EyeDisplay display, String title) {
        InputEvent event = display.nextEvent(title);
        while (!event.acknowledges()) {
            event = display.nextEvent(title);
        }
        return event;
    }

    void close(String title);

    @Override
    void close();
}
