package com.gt.flashcards.util;

import com.gt.flashcards.exception.NotFoundException;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

// Card store keys are uuid columns; ids travel through the service as strings.
public class IdUtil {

    public static UUID toUuid(String id) {
        if (id == null || id.isBlank()) {
            throw new NotFoundException("Blank id does not resolve");
        }

        try {
            return UUID.fromString(id);
        } catch (IllegalArgumentException ex) {
            throw new NotFoundException("Id \"" + id + "\" does not resolve");
        }
    }

    public static List<UUID> toUuids(Collection<String> ids) {
        return ids.stream().map(IdUtil::toUuid).toList();
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }
}
