package com.elime.ui;

import com.elime.service.correction.Key;
import org.junit.jupiter.api.Test;

import java.awt.event.KeyEvent;

import static org.assertj.core.api.Assertions.assertThat;

class KeyBindingsTest {

    @Test
    void mapsArrowsAndNavigationKeys() {
        assertThat(KeyBindings.keyFor(KeyEvent.VK_UP, KeyEvent.CHAR_UNDEFINED)).isEqualTo(Key.UP);
        assertThat(KeyBindings.keyFor(KeyEvent.VK_LEFT, KeyEvent.CHAR_UNDEFINED)).isEqualTo(Key.LEFT);
        assertThat(KeyBindings.keyFor(KeyEvent.VK_TAB, '\t')).isEqualTo(Key.NEXT);
        assertThat(KeyBindings.keyFor(KeyEvent.VK_ESCAPE, (char) 27)).isEqualTo(Key.DESELECT);
        assertThat(KeyBindings.keyFor(KeyEvent.VK_SPACE, ' ')).isEqualTo(Key.COMMIT);
    }

    @Test
    void lettersAreCaseInsensitive() {
        assertThat(KeyBindings.keyFor(KeyEvent.VK_Q, 'Q')).isEqualTo(Key.QUIT);
        assertThat(KeyBindings.keyFor(KeyEvent.VK_C, 'c')).isEqualTo(Key.CREATE);
        assertThat(KeyBindings.keyFor(KeyEvent.VK_X, 'x')).isEqualTo(Key.DELETE);
        assertThat(KeyBindings.keyFor(KeyEvent.VK_D, 'D')).isEqualTo(Key.DELETE);
        assertThat(KeyBindings.keyFor(KeyEvent.VK_N, 'n')).isEqualTo(Key.COMMIT);
    }

    @Test
    void zoomKeysFromKeypadOrCharacters() {
        assertThat(KeyBindings.keyFor(KeyEvent.VK_ADD, '+')).isEqualTo(Key.ZOOM_IN);
        assertThat(KeyBindings.keyFor(KeyEvent.VK_EQUALS, '+')).isEqualTo(Key.ZOOM_IN);
        assertThat(KeyBindings.keyFor(KeyEvent.VK_MINUS, '-')).isEqualTo(Key.ZOOM_OUT);
    }

    @Test
    void anythingElseIsOther() {
        assertThat(KeyBindings.keyFor(KeyEvent.VK_Z, 'z')).isEqualTo(Key.OTHER);
    }
}
