package com.elime.service.correction;

import com.elime.model.Point;
import com.elime.service.correction.InputEvent.Button;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FineCorrectionTest {

    private static final int WIDTH = 2000;
    private static final int HEIGHT = 1500;
    private static final int ZOOM = 640;

    private static FineState at(int x, int y, int eyeSize) {
        return new FineState(new Point(x, y), 0, WIDTH, HEIGHT, 1, eyeSize, ZOOM, 0, SessionStatus.ACTIVE);
    }

    private static FineState run(FineState state, InputEvent... events) {
        for (InputEvent event : events) {
            state = FineCorrection.step(state, event);
        }
        return state;
    }

    private static InputEvent key(Key key) {
        return InputEvent.key(key);
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        void sizesCropFromLongerSide() {
            FineState state = FineCorrection.start(new Point(10, 10), 0, WIDTH, HEIGHT, new ZoomSettings(), ZOOM);

            assertThat(state.eyeSize()).isEqualTo(200);
        }

        @Test
        void cropIsAtLeastTwentyPixels() {
            FineState state = FineCorrection.start(new Point(10, 10), 0, 100, 80, new ZoomSettings(), ZOOM);

            assertThat(state.eyeSize()).isEqualTo(20);
        }

        @Test
        void carriesOverRememberedSettings() {
            ZoomSettings zoom = new ZoomSettings();
            FineState first = FineCorrection.start(new Point(500, 500), 0, WIDTH, HEIGHT, zoom, ZOOM);
            zoom.remember(run(first, key(Key.ZOOM_IN), key(Key.STYLE), key(Key.STYLE)));

            FineState second = FineCorrection.start(new Point(900, 500), 1, 4000, 3000, zoom, ZOOM);

            assertThat(second.eyeSize()).isEqualTo(195);
            assertThat(second.crosshairStyle()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("click")
    class Click {

        @Test
        void centerClickKeepsPoint() {
            FineState state = run(at(500, 400, 200), InputEvent.pointerUp(320, 320, Button.PRIMARY));

            assertThat(state.point()).isEqualTo(new Point(500, 400));
        }

        @Test
        void cornerClickMovesToCropCorner() {
            FineState state = run(at(500, 400, 200), InputEvent.pointerUp(0, 640, Button.PRIMARY));

            assertThat(state.point()).isEqualTo(new Point(400, 500));
        }

        @Test
        void mapsThroughZoom() {
            FineState state = run(at(500, 400, 200), InputEvent.pointerUp(400, 100, Button.PRIMARY));

            // 400/640*200 = 125, 100/640*200 = 31
            assertThat(state.point()).isEqualTo(new Point(525, 331));
        }

        @Test
        void ignoresSecondaryButton() {
            FineState initial = at(500, 400, 200);

            assertThat(run(initial, InputEvent.pointerUp(0, 0, Button.SECONDARY))).isEqualTo(initial);
        }
    }

    @Nested
    @DisplayName("nudge")
    class Nudge {

        @Test
        void movesBySpeed() {
            FineState state = run(at(500, 400, 200), key(Key.SPEED), key(Key.LEFT), key(Key.UP));

            assertThat(state.point()).isEqualTo(new Point(494, 394));
        }

        @Test
        void refusesToPushCropOffTheTop() {
            FineState state = run(at(500, 100, 200), key(Key.UP));

            assertThat(state.point()).isEqualTo(new Point(500, 100));
        }

        @Test
        void allowsMoveThatStillFits() {
            FineState state = run(at(500, 101, 200), key(Key.UP));

            assertThat(state.point()).isEqualTo(new Point(500, 100));
        }

        @Test
        void refusesToPushCropOffTheRight() {
            FineState state = run(at(1900, 400, 200), key(Key.RIGHT));

            assertThat(state.point()).isEqualTo(new Point(1900, 400));
        }

        @Test
        void refusesToPushCropOffTheBottomAndLeft() {
            FineState state = run(at(100, 1400, 200), key(Key.DOWN), key(Key.LEFT));

            assertThat(state.point()).isEqualTo(new Point(100, 1400));
        }

        @Test
        void speedCyclesBetweenOneAndSix() {
            FineState state = run(at(500, 400, 200), key(Key.SPEED));
            assertThat(state.speed()).isEqualTo(6);

            state = run(state, key(Key.SPEED));
            assertThat(state.speed()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("zoom")
    class Zoom {

        @Test
        void zoomInShrinksCropDownToFive() {
            FineState state = run(at(500, 400, 15), key(Key.ZOOM_IN), key(Key.ZOOM_IN), key(Key.ZOOM_IN));

            assertThat(state.eyeSize()).isEqualTo(5);
        }

        @Test
        void zoomInStopsAtFiveFromOddSize() {
            FineState state = run(at(500, 400, 12), key(Key.ZOOM_IN), key(Key.ZOOM_IN), key(Key.ZOOM_IN));

            assertThat(state.eyeSize()).isEqualTo(5);
        }

        @Test
        void zoomOutGrowsCropWhenItFits() {
            FineState state = run(at(500, 400, 200), key(Key.ZOOM_OUT));

            assertThat(state.eyeSize()).isEqualTo(205);
        }

        @Test
        void zoomOutRefusedNearEdge() {
            FineState state = run(at(107, 400, 200), key(Key.ZOOM_OUT));

            assertThat(state.eyeSize()).isEqualTo(200);
        }
    }

    @Test
    void styleWrapsAfterFifteen() {
        FineState state = new FineState(new Point(5, 5), 0, WIDTH, HEIGHT, 1, 20, ZOOM, 15, SessionStatus.ACTIVE);

        assertThat(run(state, key(Key.STYLE)).crosshairStyle()).isZero();
    }

    @Test
    void commitAndNextEndTheSession() {
        assertThat(run(at(500, 400, 200), key(Key.COMMIT)).status()).isEqualTo(SessionStatus.COMMITTED);
        assertThat(run(at(500, 400, 200), key(Key.NEXT)).status()).isEqualTo(SessionStatus.COMMITTED);
    }

    @Test
    void quitCancels() {
        assertThat(run(at(500, 400, 200), key(Key.QUIT)).status()).isEqualTo(SessionStatus.CANCELLED);
    }
}
