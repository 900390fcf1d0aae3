package com.gt.flashcards.undo;

import com.gt.flashcards.exception.NotFoundException;
import com.gt.flashcards.lifecycle.CardDao;
import com.gt.flashcards.lifecycle.NoteDao;
import com.gt.flashcards.lifecycle.ReviewLogDao;
import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.Note;
import com.gt.flashcards.model.Rating;
import com.gt.flashcards.suspension.SuspensionService;
import com.gt.flashcards.transaction.CardStoreTransactions;
import com.gt.flashcards.util.NoteFieldUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class UndoService implements UndoStack.Restorer {

    private static final Logger log = LoggerFactory.getLogger(UndoService.class);

    static final int FRONT_PREVIEW_LENGTH = 50;

    private final CardDao cardDao;
    private final NoteDao noteDao;
    private final ReviewLogDao reviewLogDao;
    private final SuspensionService suspensionService;
    private final CardStoreTransactions transactions;
    private final Clock clock;
    private final int capacity;

    @Autowired
    public UndoService(CardDao cardDao,
                       NoteDao noteDao,
                       ReviewLogDao reviewLogDao,
                       SuspensionService suspensionService,
                       CardStoreTransactions transactions,
                       Clock clock,
                       @Value("${flashcards.undo.capacity:50}") int capacity) {
        this.cardDao = cardDao;
        this.noteDao = noteDao;
        this.reviewLogDao = reviewLogDao;
        this.suspensionService = suspensionService;
        this.transactions = transactions;
        this.clock = clock;
        this.capacity = capacity;
    }

    public UndoStack newStack() {
        return new UndoStack(capacity, this, clock);
    }

    // Must be called with the pre-review card, before its scheduling state is overwritten
    public UndoEntry buildEntry(Card card, String reviewLogId, Rating rating) {
        String firstField = noteDao.loadNote(card.noteId()).map(Note::firstFieldValue).orElse("");

        return new UndoEntry(
                card.id(),
                reviewLogId,
                rating,
                NoteFieldUtil.preview(firstField, FRONT_PREVIEW_LENGTH),
                card.scheduling(),
                clock.instant());
    }

    @Override
    public UndoResult restore(UndoEntry entry) {
        return transactions.inTransaction("undo", () -> {
            cardDao.loadCardForUpdate(entry.cardId()).orElseThrow(() -> NotFoundException.card(entry.cardId()));

            cardDao.updateSchedulingState(entry.cardId(), entry.previousState());
            int logsDeleted = reviewLogDao.deleteReviewLog(entry.reviewLogId());
            boolean leechSuspensionCleared = suspensionService.clearLeechSuspension(entry.cardId());

            if (logsDeleted == 0) {
                log.warn("Review log {} for card {} was already gone during undo", entry.reviewLogId(), entry.cardId());
            }
            log.info("Undid {} review on card {}. Leech suspension cleared: {}", entry.rating().getDbValue(), entry.cardId(), leechSuspensionCleared);

            return new UndoResult(entry.cardId(), entry.rating(), entry.describe(), leechSuspensionCleared);
        });
    }
}
