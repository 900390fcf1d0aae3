package com.gt.flashcards.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a card, note, tag or deck id does not resolve
@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class NotFoundException extends RuntimeException {

    public NotFoundException(String msg) {
        super(msg);
    }

    public static NotFoundException card(String cardId) {
        return new NotFoundException("Card \"" + cardId + "\" not found");
    }

    public static NotFoundException note(String noteId) {
        return new NotFoundException("Note \"" + noteId + "\" not found");
    }

    public static NotFoundException tag(String tagId) {
        return new NotFoundException("Tag \"" + tagId + "\" not found");
    }

    public static NotFoundException deck(String deckId) {
        return new NotFoundException("Deck \"" + deckId + "\" not found");
    }
}
