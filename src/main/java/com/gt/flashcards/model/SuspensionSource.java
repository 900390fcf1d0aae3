package com.gt.flashcards.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.flashcards.serialization.SuspensionSourceSerializer;

// Records who or what suspended a card
@JsonSerialize(using = SuspensionSourceSerializer.class, as = String.class)
public enum SuspensionSource {
    Manual("manual"),
    TagBatch("tag_batch"),
    DeckBatch("deck_batch"),
    LeechAuto("leech_auto");

    private final String dbValue;

    SuspensionSource(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    public static SuspensionSource fromDbValue(String dbValue) {
        if (dbValue == null) {
            return null;
        }

        for (SuspensionSource source : values()) {
            if (source.dbValue.equals(dbValue)) {
                return source;
            }
        }

        throw new IllegalArgumentException("Unknown suspension source " + dbValue);
    }
}
