package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReviewType {
    Learning("learning"),
    Review("review"),
    Relearning("relearning"),
    Filtered("filtered");

    private final String dbValue;

    ReviewType(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String getDbValue() {
        return dbValue;
    }

    public static ReviewType forCardType(CardType cardType) {
        switch (cardType) {
            case Review:
                return Review;
            case Relearning:
                return Relearning;
            default:
                return Learning;
        }
    }

    public static ReviewType fromDbValue(String dbValue) {
        if (dbValue == null) {
            return Review;
        }

        for (ReviewType reviewType : values()) {
            if (reviewType.dbValue.equals(dbValue)) {
                return reviewType;
            }
        }

        throw new IllegalArgumentException("Unknown review type " + dbValue);
    }
}
