package com.gt.flashcards.fsrs;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PowerForgettingCurveTests {

    private final ForgettingCurve forgettingCurve = new PowerForgettingCurve();

    @Test
    public void testRetrievability() {
        // R(S) = 0.9 by construction
        assertEquals(0.9, forgettingCurve.retrievability(10, 10), 1e-9);
        assertEquals(0.5, forgettingCurve.retrievability(9 * 4.5, 4.5), 1e-9);
    }

    @Test
    public void testEdgeCases() {
        assertEquals(1.0, forgettingCurve.retrievability(0, 3.2));
        assertEquals(0.0, forgettingCurve.retrievability(5, 0));
    }

    @Test
    public void testDecreasesWithTime() {
        assertTrue(forgettingCurve.retrievability(2, 5) > forgettingCurve.retrievability(20, 5));
        assertTrue(forgettingCurve.retrievability(20, 50) > forgettingCurve.retrievability(20, 5));
    }
}
