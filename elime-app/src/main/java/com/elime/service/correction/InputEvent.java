package com.elime.service.correction;

import com.elime.model.Point;

/**
 * One discrete operator input. Pointer events carry a position in display
 * coordinates and the button involved (null for plain moves); key events carry
 * only the key.
 */
public record InputEvent(Kind kind, Point position, Button button, Key key) {

    public enum Kind { POINTER_DOWN, POINTER_MOVE, POINTER_UP, KEY }

    public enum Button { PRIMARY, SECONDARY }

    public static InputEvent pointerDown(int x, int y, Button button) {
        return new InputEvent(Kind.POINTER_DOWN, new Point(x, y), button, null);
    }

    public static InputEvent pointerMove(int x, int y) {
        return new InputEvent(Kind.POINTER_MOVE, new Point(x, y), null, null);
    }

    public static InputEvent pointerUp(int x, int y, Button button) {
        return new InputEvent(Kind.POINTER_UP, new Point(x, y), button, null);
    }

    public static InputEvent key(Key key) {
        return new InputEvent(Kind.KEY, null, null, key);
    }

    public boolean isKey(Key expected) {
        return kind == Kind.KEY && key == expected;
    }

    /**
     * Any key or a released button; presses and moves do not acknowledge a shown image.
     */
    public boolean acknowledges() {
        return kind == Kind.KEY || kind == Kind.POINTER_UP;
    }
}
