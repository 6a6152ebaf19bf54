package com.elime.service.correction;

import com.elime.model.Point;

/**
 * Zoomed single-eye correction state. All coordinates are native.
 *
 * @param point          current eye position
 * @param index          which eye this is, 0 or 1; only used for display
 * @param eyeSize        side of the square crop shown around the point
 * @param zoomSize       side of the zoomed display window
 * @param crosshairStyle rendering variant, 0 to 15
 */
public record FineState(
    Point point,
    int index,
    int imageWidth,
    int imageHeight,
    int speed,
    int eyeSize,
    int zoomSize,
    int crosshairStyle,
    SessionStatus status
) {
    FineState withPoint(Point point) {
        return new FineState(point, index, imageWidth, imageHeight, speed, eyeSize, zoomSize, crosshairStyle, status);
    }

    FineState withSpeed(int speed) {
        return new FineState(point, index, imageWidth, imageHeight, speed, eyeSize, zoomSize, crosshairStyle, status);
    }

    FineState withEyeSize(int eyeSize) {
        return new FineState(point, index, imageWidth, imageHeight, speed, eyeSize, zoomSize, crosshairStyle, status);
    }

    FineState withCrosshairStyle(int crosshairStyle) {
        return new FineState(point, index, imageWidth, imageHeight, speed, eyeSize, zoomSize, crosshairStyle, status);
    }

    FineState withStatus(SessionStatus status) {
        return new FineState(point, index, imageWidth, imageHeight, speed, eyeSize, zoomSize, crosshairStyle, status);
    }
}
