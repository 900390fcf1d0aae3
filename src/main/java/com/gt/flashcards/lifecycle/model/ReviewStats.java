package com.gt.flashcards.lifecycle.model;

import java.time.Instant;

public record ReviewStats(Instant firstReviewAt, long averageTimeMs, int totalReviews) {

    public static final ReviewStats NO_REVIEWS = new ReviewStats(null, 0, 0);
}
