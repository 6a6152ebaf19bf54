package com.elime.ui;

import com.elime.model.Point;
import com.elime.model.Rectangle;
import com.elime.service.correction.CoarseState;
import com.elime.service.correction.FineState;
import org.springframework.stereotype.Component;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Draws correction and detection state onto copies of the photo.
 */
@Component
public class OverlayPainter {

    static final Color FIRST_EYE = new Color(0, 255, 0);
    static final Color FIRST_EYE_SELECTED = new Color(200, 255, 200);
    static final Color SECOND_EYE = new Color(255, 0, 0);
    static final Color SECOND_EYE_SELECTED = new Color(255, 200, 200);
    static final Color EXTRA_EYE = new Color(255, 0, 255);
    static final Color EXTRA_EYE_SELECTED = new Color(255, 200, 255);

    static final Color FIRST_CROSSHAIR = new Color(125, 255, 125);
    static final Color SECOND_CROSSHAIR = new Color(255, 125, 125);

    static final Color FACE = Color.BLUE;
    static final Color BIGGEST_FACE = new Color(128, 0, 128);
    static final Color EYE = Color.YELLOW;

    public BufferedImage paintCoarse(BufferedImage image, CoarseState state) {
        BufferedImage canvas = copy(image);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setStroke(new BasicStroke(2));
            int radius = coarseRadius(image.getWidth(), image.getHeight());
            List<Point> points = state.eyes().points();
            for (int i = 0; i < points.size(); i++) {
                boolean selected = state.selected() != null && state.selected() == i;
                g.setColor(coarseColor(i, selected));
                Point p = points.get(i);
                g.drawOval(p.x() - radius, p.y() - radius, 2 * radius, 2 * radius);
            }
        } finally {
            g.dispose();
        }
        return canvas;
    }

    /**
     * Crops the eye window out of the native image, draws the crosshair and
     * zooms it to the display size. Parts of the window outside the image stay
     * black.
     */
    public BufferedImage paintFine(BufferedImage nativeImage, FineState state) {
        int eyeSize = state.eyeSize();
        Point p = state.point();
        int left = p.x() - eyeSize / 2;
        int top = p.y() - eyeSize / 2;

        BufferedImage crop = new BufferedImage(eyeSize, eyeSize, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = crop.createGraphics();
        try {
            g.drawImage(nativeImage, -left, -top, null);
            g.setColor(state.index() == 0 ? FIRST_CROSSHAIR : SECOND_CROSSHAIR);
            drawCrosshair(g, p.x() - left, p.y() - top, eyeSize, state.crosshairStyle());
        } finally {
            g.dispose();
        }

        int zoomSize = state.zoomSize();
        BufferedImage zoomed = new BufferedImage(zoomSize, zoomSize, BufferedImage.TYPE_INT_RGB);
        Graphics2D z = zoomed.createGraphics();
        try {
            z.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            z.drawImage(crop, 0, 0, zoomSize, zoomSize, null);
        } finally {
            z.dispose();
        }
        return zoomed;
    }

    public BufferedImage paintDetection(BufferedImage image, List<Rectangle> faces, Rectangle biggestFace,
                                        List<Rectangle> eyes) {
        BufferedImage canvas = copy(image);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setStroke(new BasicStroke(2));
            g.setColor(FACE);
            faces.forEach(r -> g.drawRect(r.x(), r.y(), r.width(), r.height()));
            if (biggestFace != null) {
                g.setColor(BIGGEST_FACE);
                g.drawRect(biggestFace.x(), biggestFace.y(), biggestFace.width(), biggestFace.height());
            }
            g.setColor(EYE);
            eyes.forEach(r -> g.drawRect(r.x(), r.y(), r.width(), r.height()));
        } finally {
            g.dispose();
        }
        return canvas;
    }

    static int coarseRadius(int width, int height) {
        return Math.max(10, (int) (0.05 * Math.max(width, height)));
    }

    static Color coarseColor(int index, boolean selected) {
        return switch (index) {
            case 0 -> selected ? FIRST_EYE_SELECTED : FIRST_EYE;
            case 1 -> selected ? SECOND_EYE_SELECTED : SECOND_EYE;
            default -> selected ? EXTRA_EYE_SELECTED : EXTRA_EYE;
        };
    }

    /**
     * Style 0 is a small cross, 1 a dot, 2 long cross hairs. 3 to 7 add a
     * growing circle to the dot, 8 to 14 add one to the cross hairs. 15 draws
     * nothing.
     */
    static void drawCrosshair(Graphics2D g, int cx, int cy, int eyeSize, int style) {
        if (style == 0) {
            g.drawLine(cx - 1, cy, cx + 1, cy);
            g.drawLine(cx, cy - 1, cx, cy + 1);
            return;
        }
        if (style == 1 || (style >= 3 && style <= 7)) {
            g.fillRect(cx, cy, 1, 1);
        }
        if (style == 2 || (style >= 8 && style <= 14)) {
            int reach = eyeSize / 3;
            g.drawLine(cx - reach, cy, cx + reach, cy);
            g.drawLine(cx, cy - reach, cx, cy + reach);
        }
        int steps = style >= 3 && style <= 7 ? style - 2 : style >= 8 && style <= 14 ? style - 7 : 0;
        if (steps > 0) {
            int radius = (int) (eyeSize * 0.05 * steps);
            g.drawOval(cx - radius, cy - radius, 2 * radius, 2 * radius);
        }
    }

    private static BufferedImage copy(BufferedImage image) {
        BufferedImage copy = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = copy.createGraphics();
        g.drawImage(image, 0, 0, null);
        g.dispose();
        return copy;
    }
}
