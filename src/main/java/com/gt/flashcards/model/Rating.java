package com.gt.flashcards.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Rating {
    Again("again", 1),
    Hard("hard", 2),
    Good("good", 3),
    Easy("easy", 4);

    private final String dbValue;
    private final int grade;

    Rating(String dbValue, int grade) {
        this.dbValue = dbValue;
        this.grade = grade;
    }

    @JsonValue
    public String getDbValue() {
        return dbValue;
    }

    public int getGrade() {
        return grade;
    }

    // Clients send either the name ("good") or the button grade (3)
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Rating fromValue(Object value) {
        for (Rating rating : values()) {
            if (rating.dbValue.equalsIgnoreCase(String.valueOf(value)) || String.valueOf(rating.grade).equals(String.valueOf(value))) {
                return rating;
            }
        }

        throw new IllegalArgumentException("Unknown rating " + value);
    }
}
