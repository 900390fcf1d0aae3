package com.gt.flashcards.lifecycle;

import com.gt.flashcards.lifecycle.model.NoteTypeSummary;
import com.gt.flashcards.model.Note;

import java.util.Map;
import java.util.Optional;

public interface NoteDao {

    Optional<Note> loadNote(String noteId);

    Optional<Note> loadNoteForUpdate(String noteId);

    int copyNote(String sourceNoteId, String newNoteId);

    int copyNoteTags(String sourceNoteId, String newNoteId);

    Optional<Map<String, String>> mergeFields(String noteId, Map<String, String> fieldUpdates);

    void updateSortField(String noteId, String sortFieldValue, int firstFieldChecksum);

    int touchCardsForNote(String noteId);

    Optional<NoteTypeSummary> loadNoteTypeSummary(String noteTypeId);
}
