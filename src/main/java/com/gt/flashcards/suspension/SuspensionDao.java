package com.gt.flashcards.suspension;

import com.gt.flashcards.model.SuspensionSource;
import com.gt.flashcards.suspension.model.PausedCard;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface SuspensionDao {

    int suspendCard(String cardId, SuspensionSource suspendedBy, LocalDate resumeDate, String pauseReason);

    int suspendActiveCard(String cardId, SuspensionSource suspendedBy, String pauseReason);

    int resumeCard(String cardId);

    int clearSuspension(String cardId, SuspensionSource suspendedBy);

    List<String> suspendCardsByTag(String tagId, boolean includeChildren, String pauseReason);

    List<String> resumeCardsByTag(String tagId, boolean includeChildren);

    List<String> suspendCardsByDeck(String deckId, boolean includeSubdecks, String pauseReason);

    List<String> resumeCardsByDeck(String deckId, boolean includeSubdecks);

    int resumeExpiredForUser(String owner, LocalDate today);

    int resumeAllExpired(LocalDate today);

    List<PausedCard> loadPausedCards(String owner, int previewLength);

    int countPausedCards(String owner);

    Map<String, List<String>> loadTagNamesForCards(String owner, Collection<String> cardIds);
}
