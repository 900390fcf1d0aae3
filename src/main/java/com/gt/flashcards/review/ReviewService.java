package com.gt.flashcards.review;

import com.gt.flashcards.exception.InvalidArgumentException;
import com.gt.flashcards.exception.InvalidStateException;
import com.gt.flashcards.exception.NotFoundException;
import com.gt.flashcards.leech.LeechEvaluation;
import com.gt.flashcards.leech.LeechService;
import com.gt.flashcards.lifecycle.CardDao;
import com.gt.flashcards.lifecycle.ReviewLogDao;
import com.gt.flashcards.model.*;
import com.gt.flashcards.review.model.ReviewOutcome;
import com.gt.flashcards.transaction.CardStoreTransactions;
import com.gt.flashcards.undo.UndoEntry;
import com.gt.flashcards.undo.UndoService;
import com.gt.flashcards.undo.UndoStack;
import com.gt.flashcards.util.IdUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Component
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final CardDao cardDao;
    private final ReviewLogDao reviewLogDao;
    private final LeechService leechService;
    private final UndoService undoService;
    private final CardStoreTransactions transactions;
    private final Clock clock;

    @Autowired
    public ReviewService(CardDao cardDao,
                         ReviewLogDao reviewLogDao,
                         LeechService leechService,
                         UndoService undoService,
                         CardStoreTransactions transactions,
                         Clock clock) {
        this.cardDao = cardDao;
        this.reviewLogDao = reviewLogDao;
        this.leechService = leechService;
        this.undoService = undoService;
        this.transactions = transactions;
        this.clock = clock;
    }

    public ReviewOutcome applyReview(UndoStack undoStack, String cardId, Rating rating, SchedulingState nextState, long timeSpentMs) {
        validateReview(rating, nextState, timeSpentMs);

        Instant reviewedAt = clock.instant();
        SchedulingState reviewedState = nextState.withLastReviewAt(reviewedAt);

        AppliedReview appliedReview = transactions.inTransaction("applyReview", () -> {
            Card card = cardDao.loadCardForUpdate(cardId).orElseThrow(() -> NotFoundException.card(cardId));
            if (card.isSuspended()) {
                String errMsg = "Card " + cardId + " is suspended and cannot be reviewed";

                log.warn(errMsg);
                throw new InvalidStateException(errMsg);
            }

            SchedulingState previousState = card.scheduling();
            String reviewLogId = IdUtil.newId();

            cardDao.updateSchedulingState(cardId, reviewedState);
            reviewLogDao.createReviewLog(new ReviewLog(
                    reviewLogId,
                    cardId,
                    rating,
                    previousState.intervalDays(),
                    reviewedState.intervalDays(),
                    previousState.stability(),
                    reviewedState.stability(),
                    previousState.difficulty(),
                    reviewedState.difficulty(),
                    timeSpentMs,
                    ReviewType.forCardType(previousState.cardType()),
                    reviewedAt));

            UndoEntry undoEntry = undoService.buildEntry(card, reviewLogId, rating);

            LeechEvaluation leechEvaluation = null;
            if (reviewedState.lapses() > previousState.lapses()) {
                leechEvaluation = leechService.applyLeechPolicy(withScheduling(card, reviewedState));
            }

            return new AppliedReview(new ReviewOutcome(cardId, reviewLogId, reviewedState, leechEvaluation), undoEntry);
        });

        undoStack.recordAction(appliedReview.undoEntry());

        log.debug("Recorded {} review for card {}", rating.getDbValue(), cardId);
        return appliedReview.outcome();
    }

    private static void validateReview(Rating rating, SchedulingState nextState, long timeSpentMs) {
        if (rating == null) {
            throw new InvalidArgumentException("Rating is required");
        }
        if (nextState == null || nextState.cardType() == null) {
            throw new InvalidArgumentException("Next scheduling state is required");
        }
        if (!nextState.satisfiesNewCardInvariant()) {
            throw new InvalidArgumentException("A new card cannot have a due date or an interval");
        }
        if (nextState.reps() < 0 || nextState.lapses() < 0 || nextState.intervalDays() < 0
                || nextState.stability() < 0 || nextState.difficulty() < 0) {
            throw new InvalidArgumentException("Scheduling values cannot be negative");
        }
        if (timeSpentMs < 0) {
            throw new InvalidArgumentException("Time spent cannot be negative");
        }
    }

    private static Card withScheduling(Card card, SchedulingState scheduling) {
        return new Card(card.id(), card.noteId(), card.deckId(), card.owner(), card.templateOrdinal(), scheduling,
                card.suspension(), card.flag(), card.position(), card.createInstant(), card.updateInstant());
    }

    private record AppliedReview(ReviewOutcome outcome, UndoEntry undoEntry) { }
}
