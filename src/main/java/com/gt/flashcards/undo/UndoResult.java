package com.gt.flashcards.undo;

import com.gt.flashcards.model.Rating;

public record UndoResult(String cardId, Rating rating, String description, boolean leechSuspensionCleared) { }
