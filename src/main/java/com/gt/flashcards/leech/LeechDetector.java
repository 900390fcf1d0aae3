package com.gt.flashcards.leech;

import com.gt.flashcards.exception.InvalidArgumentException;

// Decides whether a lapse count fires the leech policy. Fires first at the threshold and then again every
// max(threshold / 2, 1) lapses after it.
public class LeechDetector {

    public static boolean isLeechFiring(int lapses, int threshold) {
        validateThreshold(threshold);

        if (lapses < threshold) {
            return false;
        }

        int halfThreshold = Math.max(threshold / 2, 1);
        return lapses == threshold || (lapses - threshold) % halfThreshold == 0;
    }

    public static boolean isLeech(int lapses, int threshold) {
        validateThreshold(threshold);

        return lapses >= threshold;
    }

    public static void validateThreshold(int threshold) {
        if (threshold < 1) {
            throw new InvalidArgumentException("Leech threshold must be at least 1, got " + threshold);
        }
    }
}
