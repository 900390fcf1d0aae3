package com.gt.flashcards.lifecycle.model;

import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.Note;

import java.util.List;

public record CopyNoteResult(Note note, List<Card> cards) { }
