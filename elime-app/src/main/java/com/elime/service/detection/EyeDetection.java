package com.elime.service.detection;

import com.elime.model.Point;
import com.elime.model.Rectangle;

import java.util.List;

/**
 * Outcome of one detection run, all in the coordinates of the image that was
 * searched.
 *
 * @param faces       every distinct face candidate, in detection order
 * @param biggestFace largest face, or null when none was found
 * @param eyes        chosen eye rectangles, sorted by center x
 * @param eyeCenters  centers of {@code eyes}, same order
 */
public record EyeDetection(
    List<Rectangle> faces,
    Rectangle biggestFace,
    List<Rectangle> eyes,
    List<Point> eyeCenters
) {}
