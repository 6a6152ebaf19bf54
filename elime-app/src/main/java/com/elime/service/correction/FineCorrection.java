package com.elime.service.correction;

import com.elime.model.Point;
import com.elime.service.correction.InputEvent.Button;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transition function for the zoomed per-eye correction.
 *
 * Nudges are refused when the crop window around the point would leave the
 * image. Releasing the primary button over the zoomed window moves the point
 * to the pixel under the cursor.
 */
public final class FineCorrection {

    private static final Logger log = LoggerFactory.getLogger(FineCorrection.class);

    static final int INITIAL_SPEED = 1;
    static final int SPEED_STEP = 5;
    static final int SPEED_WRAP = 10;
    static final int EYE_SIZE_STEP = 5;
    static final int MIN_EYE_SIZE = 5;
    static final int EDGE_MARGIN = 5;
    public static final int CROSSHAIR_STYLES = 16;

    private FineCorrection() {
    }

    public static FineState start(Point point, int index, int imageWidth, int imageHeight,
                                  ZoomSettings zoom, int zoomSize) {
        return new FineState(point, index, imageWidth, imageHeight, INITIAL_SPEED,
            zoom.eyeSize(imageWidth, imageHeight), zoomSize, zoom.crosshairStyle(), SessionStatus.ACTIVE);
    }

    public static FineState step(FineState state, InputEvent event) {
        if (state.status() != SessionStatus.ACTIVE) {
            return state;
        }
        return switch (event.kind()) {
            case POINTER_UP -> event.button() == Button.PRIMARY ? click(state, event.position()) : state;
            case POINTER_DOWN, POINTER_MOVE -> state;
            case KEY -> key(state, event.key());
        };
    }

    private static FineState click(FineState state, Point zoomed) {
        int eyeSize = state.eyeSize();
        double zoom = state.zoomSize();
        int cropX = (int) (zoomed.x() / zoom * eyeSize);
        int cropY = (int) (zoomed.y() / zoom * eyeSize);
        Point point = state.point();
        return state.withPoint(new Point(
            (int) (cropX + point.x() - eyeSize / 2.0),
            (int) (cropY + point.y() - eyeSize / 2.0)));
    }

    private static FineState key(FineState state, Key key) {
        Point p = state.point();
        int speed = state.speed();
        int half = state.eyeSize() / 2;
        switch (key) {
            case UP:
                return p.y() - half >= speed ? state.withPoint(p.translate(0, -speed)) : state;
            case DOWN:
                return p.y() + half <= state.imageHeight() - speed ? state.withPoint(p.translate(0, speed)) : state;
            case LEFT:
                return p.x() - half >= speed ? state.withPoint(p.translate(-speed, 0)) : state;
            case RIGHT:
                return p.x() + half <= state.imageWidth() - speed ? state.withPoint(p.translate(speed, 0)) : state;
            case SPEED:
                int next = (speed + SPEED_STEP) % SPEED_WRAP;
                log.info("Speed: {}", next);
                return state.withSpeed(next);
            case STYLE:
                return state.withCrosshairStyle((state.crosshairStyle() + 1) % CROSSHAIR_STYLES);
            case ZOOM_IN:
                return state.eyeSize() > MIN_EYE_SIZE
                    ? state.withEyeSize(Math.max(MIN_EYE_SIZE, state.eyeSize() - EYE_SIZE_STEP))
                    : state;
            case ZOOM_OUT:
                return fitsGrown(state) ? state.withEyeSize(state.eyeSize() + EYE_SIZE_STEP) : state;
            case COMMIT:
            case NEXT:
                return state.withStatus(SessionStatus.COMMITTED);
            case QUIT:
                return state.withStatus(SessionStatus.CANCELLED);
            default:
                return state;
        }
    }

    private static boolean fitsGrown(FineState state) {
        int half = (state.eyeSize() + EYE_SIZE_STEP) / 2;
        Point p = state.point();
        return p.x() - half > EDGE_MARGIN
            && p.x() + half < state.imageWidth() - EDGE_MARGIN
            && p.y() - half > EDGE_MARGIN
            && p.y() + half < state.imageHeight() - EDGE_MARGIN;
    }
}
