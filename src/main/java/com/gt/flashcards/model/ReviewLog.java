package com.gt.flashcards.model;

import java.time.Instant;

public record ReviewLog(String id,
                        String cardId,
                        Rating rating,
                        int intervalBefore,
                        int intervalAfter,
                        double stabilityBefore,
                        double stabilityAfter,
                        double difficultyBefore,
                        double difficultyAfter,
                        long timeSpentMs,
                        ReviewType reviewType,
                        Instant reviewedAt) { }
