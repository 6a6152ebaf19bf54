package com.elime.service.render;

import com.elime.model.PhotoRecord;
import com.elime.model.Point;
import com.elime.model.RenderJob;
import org.springframework.stereotype.Component;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.RescaleOp;

/**
 * Produces one output frame from a loaded photo: align on the eyes, darken,
 * stamp the date.
 */
@Component
public class FrameRenderer {

    static final int TEXT_MARGIN = 10;

    private final FaceAligner aligner;

    public FrameRenderer(FaceAligner aligner) {
        this.aligner = aligner;
    }

    public BufferedImage render(BufferedImage photo, RenderJob job, FrameSettings settings) {
        PhotoRecord record = job.sourceRecord();
        BufferedImage source = settings.positionDebug() ? markEyes(photo, record) : photo;

        BufferedImage frame = aligner.align(source, record.leftEye(), record.rightEye(),
            settings.offsetX(), settings.offsetY(), settings.width(), settings.height());

        if (job.brightness() < 1.0) {
            new RescaleOp((float) job.brightness(), 0f, null).filter(frame, frame);
        }
        if (settings.font() != null) {
            stampDate(frame, settings.dateFormat().format(job.displayDate()), settings);
        }
        return frame;
    }

    private static void stampDate(BufferedImage frame, String text, FrameSettings settings) {
        Graphics2D g = frame.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setFont(settings.font());
            g.setColor(Color.WHITE);
            FontMetrics metrics = g.getFontMetrics();
            // Text box top sits at height - (margin + textHeight)
            int baseline = frame.getHeight() - TEXT_MARGIN - metrics.getDescent();
            g.drawString(text, TEXT_MARGIN, baseline);
        } finally {
            g.dispose();
        }
    }

    private static BufferedImage markEyes(BufferedImage photo, PhotoRecord record) {
        BufferedImage copy = new BufferedImage(photo.getWidth(), photo.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(photo, 0, 0, null);
            int radius = Math.max(3, Math.max(photo.getWidth(), photo.getHeight()) / 200);
            g.setStroke(new BasicStroke(Math.max(1, radius / 3f)));
            g.setColor(Color.GREEN);
            circle(g, record.leftEye(), radius);
            g.setColor(Color.RED);
            circle(g, record.rightEye(), radius);
        } finally {
            g.dispose();
        }
        return copy;
    }

    private static void circle(Graphics2D g, Point center, int radius) {
        g.drawOval(center.x() - radius, center.y() - radius, 2 * radius, 2 * radius);
    }
}
