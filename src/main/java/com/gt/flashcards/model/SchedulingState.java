package com.gt.flashcards.model;

import java.time.Instant;

public record SchedulingState(CardType cardType,
                              Instant due,
                              int intervalDays,
                              double stability,
                              double difficulty,
                              int reps,
                              int lapses,
                              Instant lastReviewAt) {

    public static final SchedulingState NEW_CARD_STATE = new SchedulingState(CardType.New, null, 0, 0, 0, 0, 0, null);

    public boolean isNew() {
        return cardType == CardType.New;
    }

    // A new card has no due date and no interval
    public boolean satisfiesNewCardInvariant() {
        return cardType != CardType.New || (due == null && intervalDays == 0);
    }

    public SchedulingState withLastReviewAt(Instant lastReviewAt) {
        return new SchedulingState(cardType, due, intervalDays, stability, difficulty, reps, lapses, lastReviewAt);
    }
}
