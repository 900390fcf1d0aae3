package com.gt.flashcards.lifecycle;

import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.CardType;
import com.gt.flashcards.model.SchedulingState;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface CardDao {

    // Key under which the new-queue position is kept in the card's custom data
    String POSITION_KEY = "position";

    Optional<Card> loadCard(String cardId);

    Optional<Card> loadCardForUpdate(String cardId);

    List<Card> loadCardsForNote(String noteId);

    Map<String, CardType> loadCardTypesForUpdate(Collection<String> cardIds);

    int promoteNewCard(String cardId, Instant due, int intervalDays);

    int updateDue(String cardId, Instant due);

    int promoteNewCards(Collection<String> cardIds, Instant due, int intervalDays);

    int updateDueForNonNewCards(Collection<String> cardIds, Instant due);

    int resetToNew(Collection<String> cardIds);

    void updatePositions(List<String> cardIds, List<Integer> positions);

    int updateSchedulingState(String cardId, SchedulingState schedulingState);

    void createNewCard(String cardId, String noteId, String deckId, int templateOrdinal);

    int updateFlag(String cardId, int flag);
}
