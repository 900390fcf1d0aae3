package com.gt.flashcards.suspension;

import com.gt.flashcards.exception.InvalidArgumentException;
import com.gt.flashcards.exception.NotFoundException;
import com.gt.flashcards.lifecycle.DeckDao;
import com.gt.flashcards.lifecycle.TagDao;
import com.gt.flashcards.model.SuspensionSource;
import com.gt.flashcards.suspension.model.BatchSuspensionResult;
import com.gt.flashcards.suspension.model.PausedCard;
import com.gt.flashcards.suspension.model.PausedCardGroup;
import com.gt.flashcards.suspension.model.PausedCardGrouping;
import com.gt.flashcards.transaction.CardStoreTransactions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;
import java.util.function.Function;

@Component
public class SuspensionService {

    private static final Logger log = LoggerFactory.getLogger(SuspensionService.class);

    public static final String ALL_PAUSED_CARDS_GROUP = "All Paused Cards";
    public static final String NO_REASON_GROUP = "No reason specified";
    public static final String UNTAGGED_GROUP = "Untagged";
    public static final String SKIPPED_UNTIL_TOMORROW_REASON = "Skipped until tomorrow";

    private static final int FRONT_PREVIEW_LENGTH = 100;

    private final SuspensionDao suspensionDao;
    private final TagDao tagDao;
    private final DeckDao deckDao;
    private final CardStoreTransactions transactions;
    private final Clock clock;

    @Autowired
    public SuspensionService(SuspensionDao suspensionDao, TagDao tagDao, DeckDao deckDao, CardStoreTransactions transactions, Clock clock) {
        this.suspensionDao = suspensionDao;
        this.tagDao = tagDao;
        this.deckDao = deckDao;
        this.transactions = transactions;
        this.clock = clock;
    }

    public void pause(String cardId, String reason) {
        suspendCard("pause", cardId, null, normalizeReason(reason));
    }

    public void resume(String cardId) {
        int rowsUpdated = transactions.inTransaction("resume", () -> suspensionDao.resumeCard(cardId));
        if (rowsUpdated == 0) {
            throw NotFoundException.card(cardId);
        }
    }

    public void skipUntilTomorrow(String cardId) {
        suspendCard("skipUntilTomorrow", cardId, today().plusDays(1), SKIPPED_UNTIL_TOMORROW_REASON);
    }

    public void pauseUntil(String cardId, LocalDate resumeDate, String reason) {
        if (resumeDate == null || !resumeDate.isAfter(today())) {
            String errMsg = "Resume date must be in the future, got " + resumeDate;

            log.warn(errMsg);
            throw new InvalidArgumentException(errMsg);
        }

        suspendCard("pauseUntil", cardId, resumeDate, normalizeReason(reason));
    }

    private void suspendCard(String operation, String cardId, LocalDate resumeDate, String reason) {
        int rowsUpdated = transactions.inTransaction(operation,
                () -> suspensionDao.suspendCard(cardId, SuspensionSource.Manual, resumeDate, reason));

        if (rowsUpdated == 0) {
            throw NotFoundException.card(cardId);
        }
    }

    public BatchSuspensionResult pauseByTag(String tagId, boolean includeChildren, String reason) {
        return transactions.inTransaction("pauseByTag", () -> {
            verifyTagExists(tagId);
            BatchSuspensionResult result = BatchSuspensionResult.of(suspensionDao.suspendCardsByTag(tagId, includeChildren, normalizeReason(reason)));

            log.info("Paused {} cards tagged {} (includeChildren={})", result.affectedCount(), tagId, includeChildren);
            return result;
        });
    }

    public BatchSuspensionResult resumeByTag(String tagId, boolean includeChildren) {
        return transactions.inTransaction("resumeByTag", () -> {
            verifyTagExists(tagId);
            BatchSuspensionResult result = BatchSuspensionResult.of(suspensionDao.resumeCardsByTag(tagId, includeChildren));

            log.info("Resumed {} cards tagged {} (includeChildren={})", result.affectedCount(), tagId, includeChildren);
            return result;
        });
    }

    public BatchSuspensionResult pauseByDeck(String deckId, boolean includeSubdecks, String reason) {
        return transactions.inTransaction("pauseByDeck", () -> {
            verifyDeckExists(deckId);
            BatchSuspensionResult result = BatchSuspensionResult.of(suspensionDao.suspendCardsByDeck(deckId, includeSubdecks, normalizeReason(reason)));

            log.info("Paused {} cards in deck {} (includeSubdecks={})", result.affectedCount(), deckId, includeSubdecks);
            return result;
        });
    }

    public BatchSuspensionResult resumeByDeck(String deckId, boolean includeSubdecks) {
        return transactions.inTransaction("resumeByDeck", () -> {
            verifyDeckExists(deckId);
            BatchSuspensionResult result = BatchSuspensionResult.of(suspensionDao.resumeCardsByDeck(deckId, includeSubdecks));

            log.info("Resumed {} cards in deck {} (includeSubdecks={})", result.affectedCount(), deckId, includeSubdecks);
            return result;
        });
    }

    public int unburyDueToday(String userId) {
        int rowsUpdated = transactions.inTransaction("unburyDueToday", () -> suspensionDao.resumeExpiredForUser(userId, today()));

        log.debug("Unburied {} cards for user {}", rowsUpdated, userId);
        return rowsUpdated;
    }

    public int resumeExpiredTimedPauses() {
        return transactions.inTransaction("resumeExpiredTimedPauses", () -> suspensionDao.resumeAllExpired(today()));
    }

    public List<PausedCardGroup> getPausedCards(String userId, PausedCardGrouping groupBy) {
        List<PausedCard> pausedCards = suspensionDao.loadPausedCards(userId, FRONT_PREVIEW_LENGTH);

        if (groupBy == null) {
            return List.of(new PausedCardGroup(ALL_PAUSED_CARDS_GROUP, PausedCardGrouping.Reason, pausedCards));
        }

        switch (groupBy) {
            case Deck:
                return groupBy(pausedCards, PausedCardGrouping.Deck, pausedCard -> List.of(pausedCard.deckName()));
            case Reason:
                return groupBy(pausedCards, PausedCardGrouping.Reason, pausedCard -> List.of(
                        pausedCard.pauseReason() == null || pausedCard.pauseReason().isBlank() ? NO_REASON_GROUP : pausedCard.pauseReason()));
            case Tag:
                return groupByTag(userId, pausedCards);
            default:
                throw new InvalidArgumentException("Unsupported grouping " + groupBy);
        }
    }

    private List<PausedCardGroup> groupByTag(String userId, List<PausedCard> pausedCards) {
        if (pausedCards.isEmpty()) {
            return List.of();
        }

        Map<String, List<String>> tagNamesByCard =
                suspensionDao.loadTagNamesForCards(userId, pausedCards.stream().map(PausedCard::cardId).toList());

        return groupBy(pausedCards, PausedCardGrouping.Tag, pausedCard -> {
            List<String> tagNames = tagNamesByCard.get(pausedCard.cardId());
            if (tagNames == null || tagNames.isEmpty()) {
                return List.of(UNTAGGED_GROUP);
            }

            return List.copyOf(new LinkedHashSet<>(tagNames));
        });
    }

    // Groups keep the order in which their first card appears; a card lands in every group it maps to
    private static List<PausedCardGroup> groupBy(List<PausedCard> pausedCards,
                                                 PausedCardGrouping grouping,
                                                 Function<PausedCard, List<String>> groupNames) {
        Map<String, List<PausedCard>> cardsByGroup = new LinkedHashMap<>();

        for (PausedCard pausedCard : pausedCards) {
            for (String groupName : groupNames.apply(pausedCard)) {
                cardsByGroup.computeIfAbsent(groupName, name -> new ArrayList<>()).add(pausedCard);
            }
        }

        return cardsByGroup.entrySet()
                .stream()
                .map(entry -> new PausedCardGroup(entry.getKey(), grouping, entry.getValue()))
                .toList();
    }

    public int getPausedCardCount(String userId) {
        return suspensionDao.countPausedCards(userId);
    }

    public boolean suspendForLeech(String cardId, int lapses, int threshold) {
        String reason = "Leech detected: " + lapses + " lapses (threshold: " + threshold + ")";

        return transactions.inTransaction("suspendForLeech",
                () -> suspensionDao.suspendActiveCard(cardId, SuspensionSource.LeechAuto, reason) > 0);
    }

    public boolean clearLeechSuspension(String cardId) {
        return transactions.inTransaction("clearLeechSuspension",
                () -> suspensionDao.clearSuspension(cardId, SuspensionSource.LeechAuto) > 0);
    }

    private void verifyTagExists(String tagId) {
        if (tagDao.loadTagOwner(tagId).isEmpty()) {
            throw NotFoundException.tag(tagId);
        }
    }

    private void verifyDeckExists(String deckId) {
        if (deckDao.loadDeckOwner(deckId).isEmpty()) {
            throw NotFoundException.deck(deckId);
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private static String normalizeReason(String reason) {
        return reason == null || reason.isBlank() ? null : reason;
    }
}
