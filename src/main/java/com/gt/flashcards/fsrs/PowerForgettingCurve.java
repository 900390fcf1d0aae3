package com.gt.flashcards.fsrs;

import org.springframework.stereotype.Component;

/**
 * FSRS power forgetting curve, R(t, S) = (1 + t / (9 * S))^-1.
 */
@Component
public class PowerForgettingCurve implements ForgettingCurve {

    private static final double DECAY_FACTOR = 9.0;

    @Override
    public double retrievability(double elapsedDays, double stability) {
        if (stability <= 0) {
            return 0;
        }
        if (elapsedDays <= 0) {
            return 1;
        }

        return Math.pow(1 + elapsedDays / (DECAY_FACTOR * stability), -1);
    }
}
