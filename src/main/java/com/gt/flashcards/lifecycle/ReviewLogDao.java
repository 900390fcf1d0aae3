package com.gt.flashcards.lifecycle;

import com.gt.flashcards.lifecycle.model.ReviewStats;
import com.gt.flashcards.model.ReviewLog;

import java.util.Optional;

public interface ReviewLogDao {

    void createReviewLog(ReviewLog reviewLog);

    int deleteReviewLog(String reviewLogId);

    Optional<ReviewLog> loadLatestReviewLog(String cardId);

    ReviewStats loadReviewStats(String cardId);
}
