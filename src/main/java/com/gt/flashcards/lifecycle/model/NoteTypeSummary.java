package com.gt.flashcards.lifecycle.model;

import java.util.List;

public record NoteTypeSummary(String id, String name, List<String> templateNames) {

    public String templateName(int templateOrdinal) {
        if (templateOrdinal >= 0 && templateOrdinal < templateNames.size()) {
            String templateName = templateNames.get(templateOrdinal);
            if (templateName != null && !templateName.isBlank()) {
                return templateName;
            }
        }

        return "Card " + (templateOrdinal + 1);
    }
}
