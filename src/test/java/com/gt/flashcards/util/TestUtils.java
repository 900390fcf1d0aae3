package com.gt.flashcards.util;

import com.gt.flashcards.model.*;
import com.gt.flashcards.transaction.CardStoreTransactions;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.mockito.Mockito.mock;

public class TestUtils {

    public static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");
    public static final Clock FIXED_CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    public static final String TEST_USER_ID = "7b0e4a52-3c1f-4d7a-9a51-0f2b8c6d1e11";
    public static final String TEST_DECK_ID = "2c9d7f3e-5a61-4b8e-8f0c-6e1d2a3b4c55";

    public static CardStoreTransactions getTestTransactions() {
        return new CardStoreTransactions(new TransactionTemplate(mock(PlatformTransactionManager.class)));
    }

    public static Card newCard(String cardId, String noteId) {
        return new Card(cardId, noteId, TEST_DECK_ID, TEST_USER_ID, 0, SchedulingState.NEW_CARD_STATE, SuspensionState.ACTIVE,
                0, null, Instant.EPOCH, Instant.EPOCH);
    }

    public static Card reviewCard(String cardId, String noteId, int lapses) {
        SchedulingState scheduling = new SchedulingState(CardType.Review, NOW.plusSeconds(86400 * 3), 3, 4.5, 6.2, 10, lapses,
                NOW.minusSeconds(86400 * 2));

        return new Card(cardId, noteId, TEST_DECK_ID, TEST_USER_ID, 0, scheduling, SuspensionState.ACTIVE, 0, null, Instant.EPOCH, Instant.EPOCH);
    }

    public static Card withSuspension(Card card, SuspensionState suspension) {
        return new Card(card.id(), card.noteId(), card.deckId(), card.owner(), card.templateOrdinal(), card.scheduling(), suspension,
                card.flag(), card.position(), card.createInstant(), card.updateInstant());
    }

    public static String randomId() {
        return UUID.randomUUID().toString();
    }
}
