package com.elime.ui;

import com.elime.service.correction.Key;

import java.awt.event.KeyEvent;

/**
 * Physical keys to correction commands.
 */
public final class KeyBindings {

    private KeyBindings() {
    }

    public static Key keyFor(int keyCode, char keyChar) {
        switch (keyCode) {
            case KeyEvent.VK_UP:
                return Key.UP;
            case KeyEvent.VK_DOWN:
                return Key.DOWN;
            case KeyEvent.VK_LEFT:
                return Key.LEFT;
            case KeyEvent.VK_RIGHT:
                return Key.RIGHT;
            case KeyEvent.VK_TAB:
                return Key.NEXT;
            case KeyEvent.VK_ESCAPE:
                return Key.DESELECT;
            case KeyEvent.VK_SPACE:
                return Key.COMMIT;
            case KeyEvent.VK_ADD:
                return Key.ZOOM_IN;
            case KeyEvent.VK_SUBTRACT:
                return Key.ZOOM_OUT;
            default:
                break;
        }
        switch (Character.toLowerCase(keyChar)) {
            case 'c':
                return Key.CREATE;
            case 'd':
            case 'x':
                return Key.DELETE;
            case 'n':
                return Key.COMMIT;
            case 'q':
                return Key.QUIT;
            case 'f':
                return Key.SPEED;
            case 's':
                return Key.STYLE;
            case '+':
                return Key.ZOOM_IN;
            case '-':
                return Key.ZOOM_OUT;
            default:
                return Key.OTHER;
        }
    }
}
