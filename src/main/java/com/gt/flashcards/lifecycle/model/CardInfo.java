package com.gt.flashcards.lifecycle.model;

import com.gt.flashcards.model.CardType;
import com.gt.flashcards.model.SuspensionSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CardInfo(String cardId,
                       String noteId,
                       String deckName,
                       List<String> deckPath,
                       String noteTypeName,
                       Map<String, String> fields,
                       List<String> tags,
                       CardType cardType,
                       boolean suspended,
                       SuspensionSource suspendedBy,
                       int flag,
                       Instant due,
                       int intervalDays,
                       double stability,
                       double difficulty,
                       double retrievability,
                       double easeFactor,
                       int reps,
                       int lapses,
                       Instant createInstant,
                       Instant lastReviewAt,
                       Instant firstReviewAt,
                       long averageTimeMs,
                       int totalReviews,
                       boolean leech,
                       boolean marked,
                       Integer position,
                       int templateOrdinal,
                       String templateName) { }
