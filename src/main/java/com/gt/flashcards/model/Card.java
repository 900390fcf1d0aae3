package com.gt.flashcards.model;

import java.time.Instant;

public record Card(String id,
                   String noteId,
                   String deckId,
                   String owner,
                   int templateOrdinal,
                   SchedulingState scheduling,
                   SuspensionState suspension,
                   int flag,
                   Integer position,
                   Instant createInstant,
                   Instant updateInstant) {

    public boolean isSuspended() {
        return suspension != null && suspension.suspended();
    }
}
