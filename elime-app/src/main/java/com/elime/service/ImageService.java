package com.elime.service;

import net.coobird.thumbnailator.Thumbnails;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Image loading, resizing and saving through Thumbnailator.
 */
@Service
public class ImageService {

    static final double JPEG_QUALITY = 0.95;

    /**
     * Loads a photo upright, applying its EXIF orientation.
     */
    public BufferedImage load(Path file) {
        try {
            return Thumbnails.of(file.toFile())
                .scale(1.0)
                .useExifOrientation(true)
                .asBufferedImage();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        }
    }

    public BufferedImage resize(BufferedImage image, int width, int height) {
        if (image.getWidth() == width && image.getHeight() == height) {
            return image;
        }
        try {
            return Thumbnails.of(image).forceSize(width, height).asBufferedImage();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not resize image", e);
        }
    }

    /**
     * Downscaled copy for detection and coarse correction.
     */
    public BufferedImage workingCopy(BufferedImage image, CoordinateMapper mapper) {
        return resize(image, mapper.workingLength(image.getWidth()), mapper.workingLength(image.getHeight()));
    }

    public void writeJpeg(BufferedImage image, Path target) {
        try {
            Thumbnails.of(image)
                .scale(1.0)
                .outputFormat("jpg")
                .outputQuality(JPEG_QUALITY)
                .toFile(target.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + target, e);
        }
    }
}
