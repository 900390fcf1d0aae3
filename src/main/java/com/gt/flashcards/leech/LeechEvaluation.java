package com.gt.flashcards.leech;

import com.gt.flashcards.model.LeechAction;

public record LeechEvaluation(boolean isLeech, int lapses, int threshold, LeechAction action, boolean wasTagged, boolean wasPaused) {

    public static LeechEvaluation withoutSideEffects(boolean isLeech, int lapses, int threshold, LeechAction action) {
        return new LeechEvaluation(isLeech, lapses, threshold, action, false, false);
    }
}
