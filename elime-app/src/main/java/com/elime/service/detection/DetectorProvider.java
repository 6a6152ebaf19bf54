package com.elime.service.detection;

import java.awt.image.BufferedImage;

/**
 * Hands out detectors bound to single images for the length of a command run.
 */
public interface DetectorProvider extends AutoCloseable {

    CascadeDetector detectorFor(BufferedImage image);

    @Override
    void close();
}
