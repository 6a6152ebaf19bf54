package com.elime.service.correction;

import com.elime.model.Point;
import com.elime.service.correction.InputEvent.Button;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CoarseCorrectionTest {

    private static final int WIDTH = 1000;
    private static final int HEIGHT = 800;

    private static CoarseState start(Point... points) {
        return CoarseCorrection.start(EyeList.of(points), WIDTH, HEIGHT);
    }

    private static CoarseState run(CoarseState state, InputEvent... events) {
        for (InputEvent event : events) {
            state = CoarseCorrection.step(state, event);
            assertThat(state.eyes().points()).isSortedAccordingTo((a, b) -> Integer.compare(a.x(), b.x()));
        }
        return state;
    }

    private static InputEvent key(Key key) {
        return InputEvent.key(key);
    }

    @Nested
    @DisplayName("commit")
    class Commit {

        @Test
        void acceptsExactlyTwoPoints() {
            CoarseState state = run(start(new Point(100, 100), new Point(300, 100)), key(Key.COMMIT));

            assertThat(state.status()).isEqualTo(SessionStatus.COMMITTED);
        }

        @Test
        void rejectsZeroOneOrThreePoints() {
            List<CoarseState> states = List.of(
                start(),
                start(new Point(100, 100)),
                start(new Point(100, 100), new Point(200, 100), new Point(300, 100)));

            for (CoarseState state : states) {
                assertThat(CoarseCorrection.step(state, key(Key.COMMIT))).isEqualTo(state);
            }
        }

        @Test
        void ignoresInputAfterCommit() {
            CoarseState committed = run(start(new Point(100, 100), new Point(300, 100)), key(Key.COMMIT));

            assertThat(CoarseCorrection.step(committed, key(Key.DELETE))).isSameAs(committed);
        }
    }

    @Test
    void quitCancels() {
        CoarseState state = run(start(new Point(1, 1)), key(Key.QUIT));

        assertThat(state.status()).isEqualTo(SessionStatus.CANCELLED);
    }

    @Nested
    @DisplayName("pointer")
    class Pointer {

        @Test
        void primaryCreatesFirstPointOnEmptyList() {
            CoarseState state = run(start(), InputEvent.pointerDown(400, 300, Button.PRIMARY));

            assertThat(state.eyes().points()).containsExactly(new Point(400, 300));
        }

        @Test
        void primaryMovesIndexZero() {
            CoarseState state = run(start(new Point(100, 100), new Point(300, 100)),
                InputEvent.pointerDown(150, 120, Button.PRIMARY));

            assertThat(state.eyes().points()).containsExactly(new Point(150, 120), new Point(300, 100));
        }

        @Test
        void secondaryAppendsUntilTwoThenMovesIndexOne() {
            CoarseState state = run(start(new Point(100, 100)),
                InputEvent.pointerDown(500, 100, Button.SECONDARY),
                InputEvent.pointerUp(500, 100, Button.SECONDARY),
                InputEvent.pointerDown(450, 90, Button.SECONDARY));

            assertThat(state.eyes().points()).containsExactly(new Point(100, 100), new Point(450, 90));
        }

        @Test
        void secondaryOnEmptyListCreatesOnePoint() {
            CoarseState state = run(start(), InputEvent.pointerDown(40, 50, Button.SECONDARY));

            assertThat(state.eyes().points()).containsExactly(new Point(40, 50));
        }

        @Test
        void dragFollowsHeldButtonUntilRelease() {
            CoarseState state = run(start(new Point(100, 100), new Point(300, 100)),
                InputEvent.pointerDown(110, 100, Button.PRIMARY),
                InputEvent.pointerMove(120, 105),
                InputEvent.pointerMove(130, 110),
                InputEvent.pointerUp(130, 110, Button.PRIMARY),
                InputEvent.pointerMove(900, 900));

            assertThat(state.eyes().points()).containsExactly(new Point(130, 110), new Point(300, 100));
            assertThat(state.dragging()).isNull();
        }

        @Test
        void moveWithoutButtonDoesNothing() {
            CoarseState initial = start(new Point(100, 100));

            assertThat(CoarseCorrection.step(initial, InputEvent.pointerMove(5, 5))).isEqualTo(initial);
        }

        @Test
        void ignoredWithMoreThanTwoPoints() {
            CoarseState state = run(start(new Point(1, 1), new Point(2, 2), new Point(3, 3)),
                InputEvent.pointerDown(500, 500, Button.PRIMARY));

            assertThat(state.eyes().points()).containsExactly(new Point(1, 1), new Point(2, 2), new Point(3, 3));
        }

        @Test
        void clickSelectsPlacedPointForNudging() {
            CoarseState state = run(start(new Point(100, 100), new Point(300, 100)),
                InputEvent.pointerDown(150, 120, Button.PRIMARY),
                InputEvent.pointerUp(150, 120, Button.PRIMARY),
                key(Key.RIGHT));

            assertThat(state.selected()).isEqualTo(0);
            assertThat(state.eyes().points()).containsExactly(new Point(151, 120), new Point(300, 100));
        }

        @Test
        void secondaryClickSelectsAppendedPoint() {
            CoarseState state = run(start(new Point(500, 100)),
                InputEvent.pointerDown(200, 100, Button.SECONDARY),
                InputEvent.pointerUp(200, 100, Button.SECONDARY),
                key(Key.DELETE));

            assertThat(state.eyes().points()).containsExactly(new Point(500, 100));
        }

        @Test
        void selectionFollowsPointAcrossResort() {
            CoarseState state = run(start(new Point(100, 100), new Point(300, 100)),
                key(Key.NEXT),
                InputEvent.pointerDown(400, 100, Button.PRIMARY));

            assertThat(state.eyes().points()).containsExactly(new Point(300, 100), new Point(400, 100));
            assertThat(state.selected()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("selection")
    class Selection {

        @Test
        void nextCyclesThroughPointsThenNone() {
            CoarseState state = start(new Point(100, 100), new Point(300, 100));

            state = run(state, key(Key.NEXT));
            assertThat(state.selected()).isEqualTo(0);
            state = run(state, key(Key.NEXT));
            assertThat(state.selected()).isEqualTo(1);
            state = run(state, key(Key.NEXT));
            assertThat(state.selected()).isNull();
            state = run(state, key(Key.NEXT));
            assertThat(state.selected()).isEqualTo(0);
        }

        @Test
        void nextOnEmptyListSelectsNothing() {
            assertThat(run(start(), key(Key.NEXT)).selected()).isNull();
        }

        @Test
        void deselectClearsSelection() {
            CoarseState state = run(start(new Point(100, 100)), key(Key.NEXT), key(Key.DESELECT));

            assertThat(state.selected()).isNull();
        }

        @Test
        void deleteRemovesSelectedPoint() {
            CoarseState state = run(start(new Point(100, 100), new Point(300, 100)),
                key(Key.NEXT), key(Key.NEXT), key(Key.DELETE));

            assertThat(state.eyes().points()).containsExactly(new Point(100, 100));
            assertThat(state.selected()).isNull();
        }

        @Test
        void deleteWithoutSelectionDoesNothing() {
            CoarseState state = run(start(new Point(100, 100)), key(Key.DELETE));

            assertThat(state.eyes().size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        void guessesFirstPointOnEmptyList() {
            CoarseState state = run(start(), key(Key.CREATE));

            assertThat(state.eyes().points()).containsExactly(new Point(400, 280));
            assertThat(state.selected()).isEqualTo(0);
        }

        @Test
        void mirrorsPointFromLeftHalf() {
            CoarseState state = run(start(new Point(300, 250)), key(Key.CREATE));

            assertThat(state.eyes().points()).containsExactly(new Point(300, 250), new Point(700, 250));
            assertThat(state.selected()).isEqualTo(1);
        }

        @Test
        void mirrorsPointFromRightHalf() {
            CoarseState state = run(start(new Point(800, 250)), key(Key.CREATE));

            assertThat(state.eyes().points()).containsExactly(new Point(200, 250), new Point(800, 250));
            assertThat(state.selected()).isEqualTo(0);
        }

        @Test
        void neverGrowsPastTwo() {
            CoarseState state = run(start(new Point(100, 100), new Point(300, 100)), key(Key.CREATE));

            assertThat(state.eyes().size()).isEqualTo(2);
        }

        @Test
        void listStaysWithinTwoForAnyMixOfOperations() {
            CoarseState state = run(start(),
                key(Key.CREATE), key(Key.CREATE), key(Key.CREATE),
                InputEvent.pointerDown(10, 10, Button.SECONDARY),
                key(Key.NEXT), key(Key.DELETE),
                InputEvent.pointerDown(900, 10, Button.SECONDARY),
                InputEvent.pointerDown(5, 10, Button.SECONDARY),
                key(Key.CREATE));

            assertThat(state.eyes().size()).isLessThanOrEqualTo(2);
        }
    }

    @Nested
    @DisplayName("nudge")
    class Nudge {

        @Test
        void movesSelectedPointBySpeed() {
            CoarseState state = run(start(new Point(100, 100)),
                key(Key.NEXT), key(Key.RIGHT), key(Key.DOWN), key(Key.DOWN));

            assertThat(state.eyes().get(0)).isEqualTo(new Point(101, 102));
        }

        @Test
        void ignoredWithoutSelection() {
            CoarseState initial = start(new Point(100, 100));

            assertThat(CoarseCorrection.step(initial, key(Key.LEFT))).isEqualTo(initial);
        }

        @Test
        void speedCyclesInStepsOfTen() {
            CoarseState state = start(new Point(100, 100));

            state = run(state, key(Key.SPEED));
            assertThat(state.speed()).isEqualTo(11);
            state = run(state, key(Key.SPEED));
            assertThat(state.speed()).isEqualTo(21);
            state = run(state, key(Key.SPEED));
            assertThat(state.speed()).isEqualTo(1);
        }

        @Test
        void nudgePastNeighbourResortsAndKeepsSelection() {
            CoarseState state = run(start(new Point(100, 100), new Point(105, 100)),
                key(Key.NEXT), key(Key.SPEED), key(Key.RIGHT));

            assertThat(state.eyes().points()).containsExactly(new Point(105, 100), new Point(111, 100));
            assertThat(state.selected()).isEqualTo(1);
        }
    }
}
