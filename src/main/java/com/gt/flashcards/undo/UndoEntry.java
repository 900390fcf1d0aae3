package com.gt.flashcards.undo;

import com.gt.flashcards.model.Rating;
import com.gt.flashcards.model.SchedulingState;

import java.time.Instant;

// Snapshot of a card's scheduling state taken just before a review was applied
public record UndoEntry(String cardId,
                        String reviewLogId,
                        Rating rating,
                        String cardFrontPreview,
                        SchedulingState previousState,
                        Instant timestamp) {

    public String describe() {
        return "Undo " + rating.getDbValue() + " on \"" + cardFrontPreview + "\"";
    }
}
