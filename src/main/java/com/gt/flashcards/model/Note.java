package com.gt.flashcards.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Note(String id, String owner, String noteTypeId, Map<String, String> fields, Instant createInstant, Instant updateInstant) {

    public Note {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String firstFieldValue() {
        return fields.isEmpty() ? "" : fields.values().iterator().next();
    }
}
