package com.elime.service.detection;

import com.elime.model.Cascade;
import com.elime.model.ParameterSet;
import com.elime.model.Point;
import com.elime.model.Rectangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the two eyes of the dominant face in a working-size image.
 *
 * Faces are searched with a ladder of minimum sizes. If the biggest face
 * covers more than a tenth of the image, eyes are only searched in its upper
 * part. Eye search walks both eye cascades through the parameter table and
 * keeps the pass whose count is closest to two, stopping at the first pass
 * that finds exactly two.
 */
@Service
public class EyeDetectionService {

    private static final Logger log = LoggerFactory.getLogger(EyeDetectionService.class);

    static final int EYES_WANTED = 2;
    static final double FACE_AREA_THRESHOLD = 0.1;
    static final double EYE_REGION_HEIGHT = 0.6;

    public EyeDetection locateEyes(int width, int height, CascadeDetector detector) {
        return locateEyes(width, height, detector, DetectionListener.NONE);
    }

    public EyeDetection locateEyes(int width, int height, CascadeDetector detector, DetectionListener listener) {
        Rectangle wholeImage = new Rectangle(0, 0, width, height);

        List<Rectangle> faces = detectFaces(wholeImage, detector, listener);
        Rectangle biggestFace = biggest(faces);

        Rectangle region = wholeImage;
        if (biggestFace != null && (double) biggestFace.area() / wholeImage.area() > FACE_AREA_THRESHOLD) {
            region = new Rectangle(biggestFace.x(), biggestFace.y(),
                biggestFace.width(), (int) (biggestFace.height() * EYE_REGION_HEIGHT));
            log.debug("Searching eyes inside face {}", region);
        }

        List<Rectangle> eyes = new ArrayList<>();
        for (Rectangle eye : detectEyes(region, detector, listener)) {
            eyes.add(eye.relativeTo(region));
        }
        eyes.sort(Comparator.comparingInt(r -> r.center().x()));

        List<Point> centers = eyes.stream().map(Rectangle::center).toList();
        log.debug("Eye centers: {}", centers);

        EyeDetection detection = new EyeDetection(List.copyOf(faces), biggestFace, List.copyOf(eyes), centers);
        listener.onResult(detection);
        return detection;
    }

    private List<Rectangle> detectFaces(Rectangle wholeImage, CascadeDetector detector, DetectionListener listener) {
        Set<Rectangle> faces = new LinkedHashSet<>();
        int minDimension = Math.min(wholeImage.width(), wholeImage.height());
        for (ParameterSet parameters : DetectionParameters.faceParameters(minDimension)) {
            List<Rectangle> found = detector.detect(Cascade.FRONTAL_FACE, parameters, wholeImage);
            log.debug("{} faces found, args: {}", found.size(), parameters);
            listener.onPass(Cascade.FRONTAL_FACE, parameters, wholeImage, found);
            faces.addAll(found);
        }
        return new ArrayList<>(faces);
    }

    private List<Rectangle> detectEyes(Rectangle region, CascadeDetector detector, DetectionListener listener) {
        List<Rectangle> best = List.of();
        for (Cascade cascade : DetectionParameters.EYE_CASCADES) {
            if (best.size() == EYES_WANTED) {
                break;
            }
            for (ParameterSet parameters : DetectionParameters.EYE_PARAMETERS) {
                List<Rectangle> found = detector.detect(cascade, parameters, region);
                log.debug("{}: {} eyes found, args: {}", cascade, found.size(), parameters);
                listener.onPass(cascade, parameters, region, found);

                if (found.isEmpty()) {
                    continue;
                }
                if (found.size() == EYES_WANTED) {
                    best = found;
                    break;
                }
                if (best.isEmpty() || distanceToWanted(found) < distanceToWanted(best)) {
                    best = found;
                }
            }
        }
        return best;
    }

    private static int distanceToWanted(List<Rectangle> eyes) {
        return Math.abs(eyes.size() - EYES_WANTED);
    }

    static Rectangle biggest(List<Rectangle> faces) {
        Rectangle biggest = null;
        for (Rectangle face : faces) {
            if (biggest == null || face.area() > biggest.area()) {
                biggest = face;
            }
        }
        return biggest;
    }
}
