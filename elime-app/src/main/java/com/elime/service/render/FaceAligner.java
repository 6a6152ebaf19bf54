package com.elime.service.render;

import com.elime.model.Point;
import org.springframework.stereotype.Component;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

/**
 * Rotates, scales and crops a photo so that the eyes land on fixed output
 * positions: the left eye at (offsetX * width, offsetY * height) and the right
 * eye on the same row, mirrored about the vertical center line.
 */
@Component
public class FaceAligner {

    public BufferedImage align(BufferedImage image, Point leftEye, Point rightEye,
                               double offsetX, double offsetY, int width, int height) {
        AffineTransform transform = transform(leftEye, rightEye, offsetX, offsetY, width, height);

        BufferedImage aligned = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = aligned.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, transform, null);
        } finally {
            g.dispose();
        }
        return aligned;
    }

    /**
     * Maps source pixels to output pixels.
     */
    static AffineTransform transform(Point leftEye, Point rightEye,
                                     double offsetX, double offsetY, int width, int height) {
        int offsetH = (int) Math.floor(offsetX * width);
        int offsetV = (int) Math.floor(offsetY * height);

        double dx = rightEye.x() - leftEye.x();
        double dy = rightEye.y() - leftEye.y();
        double distance = Math.hypot(dx, dy);
        if (distance == 0) {
            throw new IllegalArgumentException("Eyes must not coincide: " + leftEye);
        }
        double reference = width - 2.0 * offsetH;
        if (reference <= 0) {
            throw new IllegalArgumentException("Horizontal offset " + offsetX + " leaves no room between the eyes");
        }
        double scale = distance / reference;

        AffineTransform transform = new AffineTransform();
        transform.translate(offsetH, offsetV);
        transform.scale(1.0 / scale, 1.0 / scale);
        transform.rotate(-Math.atan2(dy, dx));
        transform.translate(-leftEye.x(), -leftEye.y());
        return transform;
    }
}
