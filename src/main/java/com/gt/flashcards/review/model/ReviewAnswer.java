package com.gt.flashcards.review.model;

import com.gt.flashcards.model.Rating;
import com.gt.flashcards.model.SchedulingState;

public record ReviewAnswer(String cardId, Rating rating, SchedulingState nextState, long timeSpentMs) { }
