package com.gt.flashcards.review.model;

import com.gt.flashcards.leech.LeechEvaluation;
import com.gt.flashcards.model.SchedulingState;

// leechEvaluation is null when the review did not add a lapse
public record ReviewOutcome(String cardId, String reviewLogId, SchedulingState schedulingState, LeechEvaluation leechEvaluation) { }
