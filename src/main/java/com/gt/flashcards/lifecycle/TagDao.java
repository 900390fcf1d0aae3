package com.gt.flashcards.lifecycle;

import com.gt.flashcards.lifecycle.model.NoteTag;
import com.gt.flashcards.model.ReservedLabel;

import java.util.List;
import java.util.Optional;

public interface TagDao {

    String ensureReservedLabel(String owner, ReservedLabel reservedLabel);

    boolean attachTag(String noteId, String tagId);

    boolean detachTag(String noteId, String tagId);

    List<NoteTag> loadTagsForNote(String noteId);

    Optional<String> loadTagOwner(String tagId);
}
