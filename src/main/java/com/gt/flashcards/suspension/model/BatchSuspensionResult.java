package com.gt.flashcards.suspension.model;

import java.util.List;

public record BatchSuspensionResult(int affectedCount, List<String> cardIds) {

    public static BatchSuspensionResult of(List<String> cardIds) {
        return new BatchSuspensionResult(cardIds.size(), List.copyOf(cardIds));
    }
}
