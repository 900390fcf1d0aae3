package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.flashcards.serialization.CardTypeSerializer;

@JsonSerialize(using = CardTypeSerializer.class, as = String.class)
public enum CardType {
    New("new"),
    Learning("learning"),
    Review("review"),
    Relearning("relearning");

    private final String dbValue;

    CardType(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    @JsonCreator
    public static CardType fromDbValue(String dbValue) {
        for (CardType cardType : values()) {
            if (cardType.dbValue.equals(dbValue)) {
                return cardType;
            }
        }

        throw new IllegalArgumentException("Unknown card type " + dbValue);
    }
}
