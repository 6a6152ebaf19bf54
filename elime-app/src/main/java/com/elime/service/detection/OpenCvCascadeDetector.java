package com.elime.service.detection;

import com.elime.model.Cascade;
import com.elime.model.ParameterSet;
import com.elime.model.Rectangle;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.RectVector;
import org.bytedeco.opencv.opencv_core.Size;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link CascadeDetector} backed by OpenCV's detectMultiScale on a grayscale
 * copy of one image.
 */
public class OpenCvCascadeDetector implements CascadeDetector {

    private final Mat gray;
    private final CascadeLibrary library;

    OpenCvCascadeDetector(Mat gray, CascadeLibrary library) {
        this.gray = gray;
        this.library = library;
    }

    @Override
    public List<Rectangle> detect(Cascade cascade, ParameterSet parameters, Rectangle region) {
        Rect roiRect = new Rect(region.x(), region.y(), region.width(), region.height());
        Mat roi = new Mat(gray, roiRect);
        RectVector found = new RectVector();
        Size minSize = new Size(parameters.minWidth(), parameters.minHeight());
        Size maxSize = new Size();
        try {
            library.classifier(cascade).detectMultiScale(roi, found,
                parameters.scaleFactor(), parameters.minNeighbors(), parameters.flags(), minSize, maxSize);
            List<Rectangle> result = new ArrayList<>((int) found.size());
            for (long i = 0; i < found.size(); i++) {
                Rect r = found.get(i);
                result.add(new Rectangle(r.x(), r.y(), r.width(), r.height()));
            }
            return result;
        } finally {
            roi.release();
            roiRect.close();
            found.close();
            minSize.close();
            maxSize.close();
        }
    }

    @Override
    public void close() {
        gray.release();
        gray.close();
    }

    static Mat toGray(BufferedImage image) {
        BufferedImage bgr = image;
        if (image.getType() != BufferedImage.TYPE_3BYTE_BGR) {
            bgr = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
            Graphics2D g = bgr.createGraphics();
            g.drawImage(image, 0, 0, null);
            g.dispose();
        }
        byte[] pixels = ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData();
        Mat color = new Mat(bgr.getHeight(), bgr.getWidth(), opencv_core.CV_8UC3);
        color.data().put(pixels);

        Mat gray = new Mat();
        opencv_imgproc.cvtColor(color, gray, opencv_imgproc.COLOR_BGR2GRAY);
        color.release();
        return gray;
    }
}
