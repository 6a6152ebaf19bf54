package com.elime.service.detection;

import com.elime.model.Cascade;
import com.elime.model.ParameterSet;
import com.elime.model.Rectangle;

import java.util.List;

/**
 * One image's worth of cascade evaluation. Close it once the image is done.
 */
public interface CascadeDetector extends AutoCloseable {

    /**
     * Runs {@code cascade} with {@code parameters} over {@code region} of the
     * bound image.
     *
     * @return candidate rectangles relative to the region's top left corner,
     *         in the order the classifier reported them
     */
    List<Rectangle> detect(Cascade cascade, ParameterSet parameters, Rectangle region);

    @Override
    default void close() {
    }
}
