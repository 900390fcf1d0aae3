package com.gt.flashcards.suspension.model;

import com.gt.flashcards.model.SuspensionSource;

import java.time.Instant;
import java.time.LocalDate;

public record PausedCard(String cardId,
                         String noteId,
                         String deckName,
                         String frontPreview,
                         Instant pausedAt,
                         SuspensionSource pausedBy,
                         LocalDate resumeDate,
                         String pauseReason) { }
