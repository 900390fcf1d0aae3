package com.gt.flashcards.suspension.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gt.flashcards.exception.InvalidArgumentException;

public enum PausedCardGrouping {
    Tag("tag"),
    Deck("deck"),
    Reason("reason");

    private final String value;

    PausedCardGrouping(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static PausedCardGrouping fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }

        for (PausedCardGrouping grouping : values()) {
            if (grouping.value.equalsIgnoreCase(value)) {
                return grouping;
            }
        }

        throw new InvalidArgumentException("Unknown paused card grouping " + value);
    }
}
