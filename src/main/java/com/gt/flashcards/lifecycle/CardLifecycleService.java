package com.gt.flashcards.lifecycle;

import com.gt.flashcards.exception.InvalidArgumentException;
import com.gt.flashcards.exception.InvalidStateException;
import com.gt.flashcards.exception.NotFoundException;
import com.gt.flashcards.fsrs.ForgettingCurve;
import com.gt.flashcards.lifecycle.model.*;
import com.gt.flashcards.model.*;
import com.gt.flashcards.transaction.CardStoreTransactions;
import com.gt.flashcards.util.IdUtil;
import com.gt.flashcards.util.NoteFieldUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

@Component
public class CardLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(CardLifecycleService.class);

    private static final double MILLIS_PER_DAY = 24 * 60 * 60 * 1000.0;

    private static final int MIN_FLAG = 0;
    private static final int MAX_FLAG = 7;

    private static final double DEFAULT_EASE_FACTOR = 2.5;
    private static final double MAX_EASE_FACTOR = 3.0;
    private static final double MIN_EASE_FACTOR = 1.3;

    private final CardDao cardDao;
    private final NoteDao noteDao;
    private final TagDao tagDao;
    private final DeckDao deckDao;
    private final ReviewLogDao reviewLogDao;
    private final ForgettingCurve forgettingCurve;
    private final CardStoreTransactions transactions;
    private final Clock clock;
    private final Random random = new Random();

    @Autowired
    public CardLifecycleService(CardDao cardDao,
                                NoteDao noteDao,
                                TagDao tagDao,
                                DeckDao deckDao,
                                ReviewLogDao reviewLogDao,
                                ForgettingCurve forgettingCurve,
                                CardStoreTransactions transactions,
                                Clock clock) {
        this.cardDao = cardDao;
        this.noteDao = noteDao;
        this.tagDao = tagDao;
        this.deckDao = deckDao;
        this.reviewLogDao = reviewLogDao;
        this.forgettingCurve = forgettingCurve;
        this.transactions = transactions;
        this.clock = clock;
    }

    public void setDueDate(String cardId, Instant due) {
        requireDue(due);

        transactions.inTransaction("setDueDate", () -> {
            Card card = cardDao.loadCardForUpdate(cardId).orElseThrow(() -> NotFoundException.card(cardId));

            if (card.scheduling().isNew()) {
                cardDao.promoteNewCard(cardId, due, intervalDaysUntil(due));
            } else {
                cardDao.updateDue(cardId, due);
            }
        });
    }

    public int batchSetDueDate(List<String> cardIds, Instant due) {
        if (cardIds == null || cardIds.isEmpty()) {
            return 0;
        }
        requireDue(due);

        Set<String> distinctCardIds = new LinkedHashSet<>(cardIds);
        int intervalDays = intervalDaysUntil(due);

        return transactions.inTransaction("batchSetDueDate", () -> {
            // Non-new cards first, so freshly promoted cards are not rescheduled and counted twice
            int rescheduled = cardDao.updateDueForNonNewCards(distinctCardIds, due);
            int promoted = cardDao.promoteNewCards(distinctCardIds, due, intervalDays);

            log.info("Set due date on {} cards ({} promoted from new)", promoted + rescheduled, promoted);
            return promoted + rescheduled;
        });
    }

    public void resetToNew(String cardId) {
        int rowsUpdated = transactions.inTransaction("resetToNew", () -> cardDao.resetToNew(List.of(cardId)));

        if (rowsUpdated == 0) {
            throw NotFoundException.card(cardId);
        }
    }

    public int batchResetToNew(List<String> cardIds) {
        if (cardIds == null || cardIds.isEmpty()) {
            return 0;
        }

        return transactions.inTransaction("batchResetToNew", () -> cardDao.resetToNew(new LinkedHashSet<>(cardIds)));
    }

    public Map<String, Integer> repositionNewCards(List<String> cardIds, int start, int step, boolean randomize) {
        if (cardIds == null || cardIds.isEmpty()) {
            return Map.of();
        }

        List<String> distinctCardIds = List.copyOf(new LinkedHashSet<>(cardIds));

        return transactions.inTransaction("repositionNewCards", () -> {
            Map<String, CardType> cardTypes = cardDao.loadCardTypesForUpdate(distinctCardIds);

            List<String> missingCardIds = distinctCardIds.stream().filter(cardId -> !cardTypes.containsKey(cardId)).toList();
            if (!missingCardIds.isEmpty()) {
                throw new NotFoundException("Cards not found: " + String.join(", ", missingCardIds));
            }

            List<String> nonNewCardIds = distinctCardIds.stream().filter(cardId -> cardTypes.get(cardId) != CardType.New).toList();
            if (!nonNewCardIds.isEmpty()) {
                String errMsg = "Only new cards can be repositioned. Not new: " + String.join(", ", nonNewCardIds);

                log.warn(errMsg);
                throw new InvalidStateException(errMsg);
            }

            List<Integer> positions = new ArrayList<>(distinctCardIds.size());
            for (int index = 0; index < distinctCardIds.size(); index++) {
                positions.add(start + index * step);
            }

            if (randomize) {
                Collections.shuffle(positions, random);
            }

            cardDao.updatePositions(distinctCardIds, positions);

            Map<String, Integer> assignedPositions = new LinkedHashMap<>();
            for (int index = 0; index < distinctCardIds.size(); index++) {
                assignedPositions.put(distinctCardIds.get(index), positions.get(index));
            }

            return assignedPositions;
        });
    }

    public CopyNoteResult copyNote(String noteId, String targetDeckId) {
        return transactions.inTransaction("copyNote", () -> {
            noteDao.loadNote(noteId).orElseThrow(() -> NotFoundException.note(noteId));

            boolean hasTargetDeck = targetDeckId != null && !targetDeckId.isBlank();
            if (hasTargetDeck && deckDao.loadDeckOwner(targetDeckId).isEmpty()) {
                throw NotFoundException.deck(targetDeckId);
            }

            String newNoteId = IdUtil.newId();
            noteDao.copyNote(noteId, newNoteId);
            noteDao.copyNoteTags(noteId, newNoteId);

            // One new card per template, placed in the deck of the first source card using it unless a target is given
            Map<Integer, String> deckByOrdinal = new TreeMap<>();
            for (Card sourceCard : cardDao.loadCardsForNote(noteId)) {
                deckByOrdinal.putIfAbsent(sourceCard.templateOrdinal(), hasTargetDeck ? targetDeckId : sourceCard.deckId());
            }

            for (Map.Entry<Integer, String> ordinalAndDeck : deckByOrdinal.entrySet()) {
                cardDao.createNewCard(IdUtil.newId(), newNoteId, ordinalAndDeck.getValue(), ordinalAndDeck.getKey());
            }

            log.info("Copied note {} to {} with {} cards", noteId, newNoteId, deckByOrdinal.size());

            Note copiedNote = noteDao.loadNote(newNoteId).orElseThrow(() -> NotFoundException.note(newNoteId));
            return new CopyNoteResult(copiedNote, cardDao.loadCardsForNote(newNoteId));
        });
    }

    public boolean toggleMarked(String noteId) {
        return transactions.inTransaction("toggleMarked", () -> {
            Note note = noteDao.loadNoteForUpdate(noteId).orElseThrow(() -> NotFoundException.note(noteId));
            String markedTagId = tagDao.ensureReservedLabel(note.owner(), ReservedLabel.Marked);

            if (tagDao.detachTag(noteId, markedTagId)) {
                return false;
            }

            tagDao.attachTag(noteId, markedTagId);
            return true;
        });
    }

    public CardInfo getCardInfo(String cardId) {
        Card card = cardDao.loadCard(cardId).orElseThrow(() -> NotFoundException.card(cardId));
        Note note = noteDao.loadNote(card.noteId()).orElseThrow(() -> NotFoundException.note(card.noteId()));
        Optional<NoteTypeSummary> noteType = noteDao.loadNoteTypeSummary(note.noteTypeId());

        List<NoteTag> noteTags = tagDao.loadTagsForNote(note.id());
        Set<String> tagSlugs = noteTags.stream().map(NoteTag::slug).collect(Collectors.toSet());
        List<String> deckPath = deckDao.loadDeckPath(card.deckId());
        ReviewStats reviewStats = reviewLogDao.loadReviewStats(cardId);
        SchedulingState scheduling = card.scheduling();

        return new CardInfo(
                card.id(),
                card.noteId(),
                deckPath.isEmpty() ? null : deckPath.get(deckPath.size() - 1),
                deckPath,
                noteType.map(NoteTypeSummary::name).orElse(null),
                note.fields(),
                noteTags.stream().map(NoteTag::name).toList(),
                scheduling.cardType(),
                card.isSuspended(),
                card.suspension().suspendedBy(),
                card.flag(),
                scheduling.due(),
                scheduling.intervalDays(),
                scheduling.stability(),
                scheduling.difficulty(),
                currentRetrievability(scheduling),
                toEaseFactor(scheduling.difficulty()),
                scheduling.reps(),
                scheduling.lapses(),
                card.createInstant(),
                scheduling.lastReviewAt(),
                reviewStats.firstReviewAt(),
                reviewStats.averageTimeMs(),
                reviewStats.totalReviews(),
                tagSlugs.contains(ReservedLabel.Leech.getSlug()),
                tagSlugs.contains(ReservedLabel.Marked.getSlug()),
                card.position(),
                card.templateOrdinal(),
                noteType.map(type -> type.templateName(card.templateOrdinal())).orElse("Card " + (card.templateOrdinal() + 1)));
    }

    public Optional<ReviewLog> getPreviousCardInfo(String cardId) {
        cardDao.loadCard(cardId).orElseThrow(() -> NotFoundException.card(cardId));

        return reviewLogDao.loadLatestReviewLog(cardId);
    }

    public void editDuringReview(String noteId, Map<String, String> fieldUpdates) {
        if (fieldUpdates == null || fieldUpdates.isEmpty()) {
            return;
        }

        transactions.inTransaction("editDuringReview", () -> {
            Map<String, String> mergedFields = noteDao.mergeFields(noteId, fieldUpdates).orElseThrow(() -> NotFoundException.note(noteId));

            String sortFieldValue = mergedFields.isEmpty() ? "" : Objects.requireNonNullElse(mergedFields.values().iterator().next(), "");
            noteDao.updateSortField(noteId, sortFieldValue, NoteFieldUtil.firstFieldChecksum(sortFieldValue));
            noteDao.touchCardsForNote(noteId);
        });
    }

    public void setFlag(String cardId, int flag) {
        if (flag < MIN_FLAG || flag > MAX_FLAG) {
            throw new InvalidArgumentException("Flag must be between " + MIN_FLAG + " and " + MAX_FLAG + ", got " + flag);
        }

        int rowsUpdated = transactions.inTransaction("setFlag", () -> cardDao.updateFlag(cardId, flag));
        if (rowsUpdated == 0) {
            throw NotFoundException.card(cardId);
        }
    }

    double currentRetrievability(SchedulingState scheduling) {
        if (scheduling.lastReviewAt() == null || scheduling.stability() <= 0) {
            return 0;
        }

        double elapsedDays = Duration.between(scheduling.lastReviewAt(), clock.instant()).toMillis() / MILLIS_PER_DAY;
        double retrievability = forgettingCurve.retrievability(elapsedDays, scheduling.stability());

        return Math.round(retrievability * 10000) / 10000.0;
    }

    // Legacy ease factor for display: difficulty 1 maps to 3.0 and difficulty 10 to 1.3
    static double toEaseFactor(double difficulty) {
        if (difficulty <= 0) {
            return DEFAULT_EASE_FACTOR;
        }

        double easeFactor = MAX_EASE_FACTOR - ((difficulty - 1) / 9) * (MAX_EASE_FACTOR - MIN_EASE_FACTOR);
        return Math.round(easeFactor * 100) / 100.0;
    }

    private int intervalDaysUntil(Instant due) {
        long days = Math.round(Duration.between(clock.instant(), due).toMillis() / MILLIS_PER_DAY);

        return (int) Math.max(1, days);
    }

    private static void requireDue(Instant due) {
        if (due == null) {
            throw new InvalidArgumentException("Due date is required");
        }
    }
}
