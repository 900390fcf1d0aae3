package com.gt.flashcards.leech;

import com.gt.flashcards.exception.NotFoundException;
import com.gt.flashcards.lifecycle.CardDao;
import com.gt.flashcards.lifecycle.TagDao;
import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.LeechAction;
import com.gt.flashcards.model.ReservedLabel;
import com.gt.flashcards.suspension.SuspensionService;
import com.gt.flashcards.transaction.CardStoreTransactions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class LeechService {

    private static final Logger log = LoggerFactory.getLogger(LeechService.class);

    private final CardDao cardDao;
    private final TagDao tagDao;
    private final SuspensionService suspensionService;
    private final CardStoreTransactions transactions;
    private final int defaultThreshold;
    private final LeechAction defaultAction;

    @Autowired
    public LeechService(CardDao cardDao,
                        TagDao tagDao,
                        SuspensionService suspensionService,
                        CardStoreTransactions transactions,
                        @Value("${flashcards.leech.threshold:8}") int defaultThreshold,
                        @Value("${flashcards.leech.action:tag_only}") String defaultAction) {
        LeechDetector.validateThreshold(defaultThreshold);

        this.cardDao = cardDao;
        this.tagDao = tagDao;
        this.suspensionService = suspensionService;
        this.transactions = transactions;
        this.defaultThreshold = defaultThreshold;
        this.defaultAction = LeechAction.fromConfigValue(defaultAction);
    }

    public int getDefaultThreshold() {
        return defaultThreshold;
    }

    public LeechAction getDefaultAction() {
        return defaultAction;
    }

    public LeechEvaluation checkLeech(String cardId) {
        return checkLeech(cardId, defaultThreshold, defaultAction);
    }

    public LeechEvaluation checkLeech(String cardId, int threshold, LeechAction action) {
        LeechDetector.validateThreshold(threshold);

        return transactions.inTransaction("checkLeech", () -> {
            Card card = cardDao.loadCardForUpdate(cardId).orElseThrow(() -> NotFoundException.card(cardId));

            return applyLeechPolicy(card, threshold, action);
        });
    }

    public LeechEvaluation applyLeechPolicy(Card card) {
        return applyLeechPolicy(card, defaultThreshold, defaultAction);
    }

    // The card must already be locked by the caller's transaction
    public LeechEvaluation applyLeechPolicy(Card card, int threshold, LeechAction action) {
        LeechAction leechAction = action == null ? defaultAction : action;
        int lapses = card.scheduling().lapses();

        if (!LeechDetector.isLeech(lapses, threshold)) {
            return LeechEvaluation.withoutSideEffects(false, lapses, threshold, leechAction);
        }

        if (!LeechDetector.isLeechFiring(lapses, threshold)) {
            return LeechEvaluation.withoutSideEffects(true, lapses, threshold, leechAction);
        }

        return transactions.inTransaction("applyLeechPolicy", () -> {
            String leechTagId = tagDao.ensureReservedLabel(card.owner(), ReservedLabel.Leech);
            boolean wasTagged = tagDao.attachTag(card.noteId(), leechTagId);

            boolean wasPaused = false;
            if (leechAction == LeechAction.Pause && !card.isSuspended()) {
                wasPaused = suspensionService.suspendForLeech(card.id(), lapses, threshold);
            }

            log.info("Card {} is a leech at {} lapses (threshold {}). Tagged: {}, paused: {}", card.id(), lapses, threshold, wasTagged, wasPaused);

            return new LeechEvaluation(true, lapses, threshold, leechAction, wasTagged, wasPaused);
        });
    }
}
