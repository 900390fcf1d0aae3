package com.gt.flashcards.security;

import com.gt.flashcards.exception.NotFoundException;
import com.gt.flashcards.exception.UserAccessException;
import com.gt.flashcards.lifecycle.CardDao;
import com.gt.flashcards.lifecycle.DeckDao;
import com.gt.flashcards.lifecycle.NoteDao;
import com.gt.flashcards.lifecycle.TagDao;
import com.gt.flashcards.model.Card;
import com.gt.flashcards.model.Note;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;

// Rejects requests that touch cards, notes, tags or decks owned by someone other than the signed in user
@Component
public class CardAccessVerifier {

    private static final Logger log = LoggerFactory.getLogger(CardAccessVerifier.class);

    private final CardDao cardDao;
    private final NoteDao noteDao;
    private final TagDao tagDao;
    private final DeckDao deckDao;

    @Autowired
    public CardAccessVerifier(CardDao cardDao, NoteDao noteDao, TagDao tagDao, DeckDao deckDao) {
        this.cardDao = cardDao;
        this.noteDao = noteDao;
        this.tagDao = tagDao;
        this.deckDao = deckDao;
    }

    public void verifyCardAccess(String cardId, String userId) {
        String owner = cardDao.loadCard(cardId).map(Card::owner).orElseThrow(() -> NotFoundException.card(cardId));
        verifyOwner("card", cardId, owner, userId);
    }

    public void verifyCardAccess(Collection<String> cardIds, String userId) {
        for (String cardId : cardIds) {
            verifyCardAccess(cardId, userId);
        }
    }

    public void verifyNoteAccess(String noteId, String userId) {
        String owner = noteDao.loadNote(noteId).map(Note::owner).orElseThrow(() -> NotFoundException.note(noteId));
        verifyOwner("note", noteId, owner, userId);
    }

    public void verifyTagAccess(String tagId, String userId) {
        String owner = tagDao.loadTagOwner(tagId).orElseThrow(() -> NotFoundException.tag(tagId));
        verifyOwner("tag", tagId, owner, userId);
    }

    public void verifyDeckAccess(String deckId, String userId) {
        String owner = deckDao.loadDeckOwner(deckId).orElseThrow(() -> NotFoundException.deck(deckId));
        verifyOwner("deck", deckId, owner, userId);
    }

    private static void verifyOwner(String kind, String id, String owner, String userId) {
        if (!owner.equals(userId)) {
            String errMsg = "User " + userId + " does not have access to " + kind + " " + id;

            log.warn(errMsg);
            throw new UserAccessException(errMsg);
        }
    }
}
