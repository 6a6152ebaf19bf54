package com.elime.service.detection;

import com.elime.model.Cascade;
import com.elime.service.ResourceMissingException;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_objdetect.CascadeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * Loaded Haar classifiers for one command run. Every cascade file is checked
 * when the library is opened, so a bad cascade folder fails before any photo
 * is touched.
 */
public final class CascadeLibrary implements DetectorProvider {

    private static final Logger log = LoggerFactory.getLogger(CascadeLibrary.class);

    private final Map<Cascade, CascadeClassifier> classifiers;

    private CascadeLibrary(Map<Cascade, CascadeClassifier> classifiers) {
        this.classifiers = classifiers;
    }

    public static CascadeLibrary open(Path cascadeFolder) {
        if (cascadeFolder == null || !Files.isDirectory(cascadeFolder)) {
            throw new ResourceMissingException("Path to opencv haarcascades is wrong", cascadeFolder);
        }
        Map<Cascade, CascadeClassifier> classifiers = new EnumMap<>(Cascade.class);
        for (Cascade cascade : Cascade.values()) {
            Path file = cascadeFolder.resolve(cascade.fileName());
            if (!Files.isRegularFile(file)) {
                classifiers.values().forEach(CascadeClassifier::close);
                throw new ResourceMissingException("Haar cascade file missing", file);
            }
            CascadeClassifier classifier = new CascadeClassifier(file.toString());
            if (classifier.empty()) {
                classifier.close();
                classifiers.values().forEach(CascadeClassifier::close);
                throw new ResourceMissingException("Haar cascade file could not be loaded", file);
            }
            classifiers.put(cascade, classifier);
        }
        log.debug("Loaded {} cascades from {}", classifiers.size(), cascadeFolder);
        return new CascadeLibrary(classifiers);
    }

    CascadeClassifier classifier(Cascade cascade) {
        return classifiers.get(cascade);
    }

    @Override
    public CascadeDetector detectorFor(BufferedImage image) {
        Mat gray = OpenCvCascadeDetector.toGray(image);
        return new OpenCvCascadeDetector(gray, this);
    }

    @Override
    public void close() {
        classifiers.values().forEach(CascadeClassifier::close);
        classifiers.clear();
    }
}
