package com.elime.service.correction;

import com.elime.model.Point;
import com.elime.service.correction.InputEvent.Button;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transition function for whole-image correction.
 *
 * The primary button places the point at index 0 and the secondary button the
 * one at index 1; the placed point becomes the selection and holding a button
 * drags it. Pointer input is ignored
 * while the list holds more than two points. Keys nudge, select, create and
 * delete points. Commit is only accepted with exactly two points.
 */
public final class CoarseCorrection {

    private static final Logger log = LoggerFactory.getLogger(CoarseCorrection.class);

    static final int INITIAL_SPEED = 1;
    static final int SPEED_STEP = 10;
    static final int SPEED_WRAP = 30;

    private CoarseCorrection() {
    }

    public static CoarseState start(EyeList eyes, int width, int height) {
        return new CoarseState(eyes, null, INITIAL_SPEED, null, width, height, SessionStatus.ACTIVE);
    }

    public static CoarseState step(CoarseState state, InputEvent event) {
        if (state.status() != SessionStatus.ACTIVE) {
            return state;
        }
        return switch (event.kind()) {
            case POINTER_DOWN -> place(state.withDragging(event.button()), event.button(), event.position());
            case POINTER_MOVE -> state.dragging() == null
                ? state
                : place(state, state.dragging(), event.position());
            case POINTER_UP -> state.withDragging(null);
            case KEY -> key(state, event.key());
        };
    }

    private static CoarseState place(CoarseState state, Button button, Point position) {
        EyeList eyes = state.eyes();
        if (eyes.size() > EyeList.MAX_EYES) {
            return state;
        }
        EyeList.Change change;
        Integer placed;
        if (button == Button.PRIMARY) {
            if (eyes.isEmpty()) {
                change = eyes.insert(0, position);
                placed = change.inserted();
            } else {
                change = eyes.set(0, position);
                placed = change.track(0);
            }
        } else if (eyes.size() < EyeList.MAX_EYES) {
            change = eyes.insert(eyes.size(), position);
            placed = change.inserted();
        } else {
            change = eyes.set(1, position);
            placed = change.track(1);
        }
        return state.withEyes(change.eyes(), placed);
    }

    private static CoarseState key(CoarseState state, Key key) {
        EyeList eyes = state.eyes();
        Integer selected = state.selected();
        switch (key) {
            case UP:
                return nudge(state, 0, -state.speed());
            case DOWN:
                return nudge(state, 0, state.speed());
            case LEFT:
                return nudge(state, -state.speed(), 0);
            case RIGHT:
                return nudge(state, state.speed(), 0);
            case NEXT:
                return state.withSelected(nextSelection(selected, eyes.size()));
            case DESELECT:
                return state.withSelected(null);
            case CREATE:
                return create(state);
            case DELETE:
                if (selected == null) {
                    return state;
                }
                return state.withEyes(eyes.remove(selected), null);
            case SPEED:
                int speed = (state.speed() + SPEED_STEP) % SPEED_WRAP;
                log.info("Speed: {}", speed);
                return state.withSpeed(speed);
            case COMMIT:
                if (eyes.size() != EyeList.MAX_EYES) {
                    log.info("Need exactly {} eyes to continue, have {}", EyeList.MAX_EYES, eyes.size());
                    return state;
                }
                return state.withStatus(SessionStatus.COMMITTED);
            case QUIT:
                return state.withStatus(SessionStatus.CANCELLED);
            default:
                return state;
        }
    }

    private static CoarseState nudge(CoarseState state, int dx, int dy) {
        Integer selected = state.selected();
        if (selected == null) {
            return state;
        }
        EyeList.Change change = state.eyes().set(selected, state.eyes().get(selected).translate(dx, dy));
        return state.withEyes(change.eyes(), change.track(selected));
    }

    static Integer nextSelection(Integer selected, int size) {
        if (size == 0) {
            return null;
        }
        if (selected == null) {
            return 0;
        }
        int next = (selected + 1) % size;
        return next == 0 ? null : next;
    }

    private static CoarseState create(CoarseState state) {
        EyeList eyes = state.eyes();
        EyeList.Change change;
        if (eyes.size() == 1) {
            Point existing = eyes.get(0);
            Point mirrored = new Point(state.width() - existing.x(), existing.y());
            int index = existing.x() < state.width() / 2.0 ? 1 : 0;
            change = eyes.insert(index, mirrored);
        } else if (eyes.isEmpty()) {
            Point guess = new Point(
                (int) (state.width() / 2.0 - 0.1 * state.width()),
                (int) (0.35 * state.height()));
            change = eyes.insert(0, guess);
        } else {
            return state;
        }
        return state.withEyes(change.eyes(), change.inserted());
    }
}
