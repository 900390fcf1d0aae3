package com.gt.flashcards.model;

// Per-user labels created on demand by the engine. Slug is unique per user.
public enum ReservedLabel {
    Leech("Leech", "leech", "#EF4444", "Cards that have been failed many times"),
    Marked("Marked", "marked", "#F59E0B", "Manually marked notes for review");

    private final String displayName;
    private final String slug;
    private final String color;
    private final String description;

    ReservedLabel(String displayName, String slug, String color, String description) {
        this.displayName = displayName;
        this.slug = slug;
        this.color = color;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getSlug() {
        return slug;
    }

    public String getColor() {
        return color;
    }

    public String getDescription() {
        return description;
    }
}
