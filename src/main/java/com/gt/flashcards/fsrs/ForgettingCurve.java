package com.gt.flashcards.fsrs;

// Probability of recall after a number of elapsed days, as defined by the scheduler that owns stability.
public interface ForgettingCurve {

    double retrievability(double elapsedDays, double stability);
}
