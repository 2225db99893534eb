package org.tims.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FrameWindowTest {

    @Test
    public void isHalfOpen() {
        FrameWindow window = new FrameWindow(3, 6);

        assertEquals(3, window.size());
        assertTrue(window.contains(3));
        assertTrue(window.contains(5));
        assertFalse(window.contains(6));
        assertEquals("[3, 6)", window.toString());
    }

    @Test
    public void rejectsEmptyRange() {
        assertThrows(IllegalArgumentException.class, () -> new FrameWindow(4, 4));
    }

    @Test
    public void polaritySymbols() {
        assertEquals(Polarity.POSITIVE, Polarity.fromSymbol("+"));
        assertEquals(Polarity.NEGATIVE, Polarity.fromSymbol(" - "));
        assertEquals(Polarity.UNKNOWN, Polarity.fromSymbol("?"));
        assertEquals(Polarity.UNKNOWN, Polarity.fromSymbol(null));
    }
}
