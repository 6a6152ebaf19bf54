package com.elime.service.correction;

import com.elime.service.correction.InputEvent.Button;

/**
 * Whole-image correction state.
 *
 * @param eyes     current points in working image coordinates
 * @param selected selected index, or null
 * @param speed    nudge step in pixels
 * @param dragging button currently held down, or null
 * @param width    working image width
 * @param height   working image height
 */
public record CoarseState(
    EyeList eyes,
    Integer selected,
    int speed,
    Button dragging,
    int width,
    int height,
    SessionStatus status
) {
    CoarseState withEyes(EyeList eyes, Integer selected) {
        return new CoarseState(eyes, selected, speed, dragging, width, height, status);
    }

    CoarseState withSelected(Integer selected) {
        return new CoarseState(eyes, selected, speed, dragging, width, height, status);
    }

    CoarseState withSpeed(int speed) {
        return new CoarseState(eyes, selected, speed, dragging, width, height, status);
    }

    CoarseState withDragging(Button dragging) {
        return new CoarseState(eyes, selected, speed, dragging, width, height, status);
    }

    CoarseState withStatus(SessionStatus status) {
        return new CoarseState(eyes, selected, speed, dragging, width, height, status);
    }
}
