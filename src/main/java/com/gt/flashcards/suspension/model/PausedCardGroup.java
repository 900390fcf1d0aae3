package com.gt.flashcards.suspension.model;

import java.util.List;

public record PausedCardGroup(String groupName, PausedCardGrouping groupType, int count, List<PausedCard> cards) {

    public PausedCardGroup(String groupName, PausedCardGrouping groupType, List<PausedCard> cards) {
        this(groupName, groupType, cards.size(), List.copyOf(cards));
    }
}
