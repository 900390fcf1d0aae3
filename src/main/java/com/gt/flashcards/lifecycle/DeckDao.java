package com.gt.flashcards.lifecycle;

import java.util.List;
import java.util.Optional;

public interface DeckDao {

    Optional<String> loadDeckOwner(String deckId);

    // Deck names from the root deck down to the given deck
    List<String> loadDeckPath(String deckId);
}
