package com.elime.service.render;

import java.awt.Font;
import java.time.format.DateTimeFormatter;

/**
 * Output geometry and overlay for rendered frames.
 *
 * @param font          date overlay font, or null for no overlay
 * @param positionDebug mark the eye anchors before aligning
 */
public record FrameSettings(
    double offsetX,
    double offsetY,
    int width,
    int height,
    Font font,
    DateTimeFormatter dateFormat,
    boolean positionDebug
) {}
