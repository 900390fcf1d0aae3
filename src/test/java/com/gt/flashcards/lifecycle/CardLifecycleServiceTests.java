package com.gt.flashcards.lifecycle;

import com.gt.flashcards.exception.InvalidArgumentException;
import com.gt.flashcards.exception.InvalidStateException;
import com.gt.flashcards.exception.NotFoundException;
import com.gt.flashcards.fsrs.PowerForgettingCurve;
import com.gt.flashcards.lifecycle.model.*;
import com.gt.flashcards.model.*;
import com.gt.flashcards.util.NoteFieldUtil;
import com.gt.flashcards.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalMatchers.not;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class CardLifecycleServiceTests {

    private static final String NOTE_ID = TestUtils.randomId();
    private static final String NOTE_TYPE_ID = TestUtils.randomId();
    private static final String NEW_CARD_ID = TestUtils.randomId();
    private static final String REVIEW_CARD_ID = TestUtils.randomId();
    private static final String MARKED_TAG_ID = TestUtils.randomId();

    private static final Note NOTE = new Note(NOTE_ID, TestUtils.TEST_USER_ID, NOTE_TYPE_ID,
            orderedFields("Front", "猫", "Back", "cat"), Instant.EPOCH, Instant.EPOCH);

    @Mock private CardDao cardDao;
    @Mock private NoteDao noteDao;
    @Mock private TagDao tagDao;
    @Mock private DeckDao deckDao;
    @Mock private ReviewLogDao reviewLogDao;

    private CardLifecycleService cardLifecycleService;

    @BeforeEach
    public void setup() {
        cardLifecycleService = new CardLifecycleService(cardDao, noteDao, tagDao, deckDao, reviewLogDao, new PowerForgettingCurve(),
                TestUtils.getTestTransactions(), TestUtils.FIXED_CLOCK);

        when(cardDao.loadCardForUpdate(NEW_CARD_ID)).thenReturn(Optional.of(TestUtils.newCard(NEW_CARD_ID, NOTE_ID)));
        when(cardDao.loadCardForUpdate(REVIEW_CARD_ID)).thenReturn(Optional.of(TestUtils.reviewCard(REVIEW_CARD_ID, NOTE_ID, 2)));
        when(cardDao.loadCard(REVIEW_CARD_ID)).thenReturn(Optional.of(TestUtils.reviewCard(REVIEW_CARD_ID, NOTE_ID, 2)));
        when(noteDao.loadNote(NOTE_ID)).thenReturn(Optional.of(NOTE));
        when(noteDao.loadNoteForUpdate(NOTE_ID)).thenReturn(Optional.of(NOTE));
        when(tagDao.ensureReservedLabel(TestUtils.TEST_USER_ID, ReservedLabel.Marked)).thenReturn(MARKED_TAG_ID);
        when(reviewLogDao.loadReviewStats(anyString())).thenReturn(ReviewStats.NO_REVIEWS);
    }

    @Test
    public void testSetDueDate_NewCardIsPromoted() {
        Instant due = TestUtils.NOW.plus(Duration.ofDays(5));

        cardLifecycleService.setDueDate(NEW_CARD_ID, due);

        verify(cardDao).promoteNewCard(NEW_CARD_ID, due, 5);
        verify(cardDao, never()).updateDue(anyString(), any());
    }

    @Test
    public void testSetDueDate_IntervalIsAtLeastOneDay() {
        Instant due = TestUtils.NOW.plus(Duration.ofHours(2));

        cardLifecycleService.setDueDate(NEW_CARD_ID, due);

        verify(cardDao).promoteNewCard(NEW_CARD_ID, due, 1);
    }

    @Test
    public void testSetDueDate_ReviewCardOnlyMovesDue() {
        Instant due = TestUtils.NOW.plus(Duration.ofDays(30));

        cardLifecycleService.setDueDate(REVIEW_CARD_ID, due);

        verify(cardDao).updateDue(REVIEW_CARD_ID, due);
        verify(cardDao, never()).promoteNewCard(anyString(), any(), anyInt());
    }

    @Test
    public void testSetDueDate_Errors() {
        assertThrows(NotFoundException.class, () -> cardLifecycleService.setDueDate(TestUtils.randomId(), TestUtils.NOW));
        assertThrows(InvalidArgumentException.class, () -> cardLifecycleService.setDueDate(NEW_CARD_ID, null));
    }

    @Test
    public void testSetDueDate_PromotionIsIdempotent() {
        Map<String, SchedulingState> storedStates = useStoredSchedulingStates(TestUtils.newCard(NEW_CARD_ID, NOTE_ID));
        Instant due = TestUtils.NOW.plus(Duration.ofDays(5));

        cardLifecycleService.setDueDate(NEW_CARD_ID, due);
        SchedulingState afterFirstCall = storedStates.get(NEW_CARD_ID);

        cardLifecycleService.setDueDate(NEW_CARD_ID, due);
        SchedulingState afterSecondCall = storedStates.get(NEW_CARD_ID);

        assertEquals(CardType.Review, afterFirstCall.cardType());
        assertEquals(due, afterFirstCall.due());
        assertEquals(5, afterFirstCall.intervalDays());
        assertEquals(afterFirstCall, afterSecondCall);
        verify(cardDao, times(1)).promoteNewCard(NEW_CARD_ID, due, 5);
        verify(cardDao, times(1)).updateDue(NEW_CARD_ID, due);
    }

    @Test
    public void testBatchSetDueDate() {
        String otherNewCardId = TestUtils.randomId();
        Map<String, SchedulingState> storedStates = useStoredSchedulingStates(
                TestUtils.newCard(NEW_CARD_ID, NOTE_ID),
                TestUtils.newCard(otherNewCardId, NOTE_ID),
                TestUtils.reviewCard(REVIEW_CARD_ID, NOTE_ID, 2));
        Instant due = TestUtils.NOW.plus(Duration.ofDays(3));

        int rowsTouched = cardLifecycleService.batchSetDueDate(
                List.of(NEW_CARD_ID, otherNewCardId, REVIEW_CARD_ID, NEW_CARD_ID, TestUtils.randomId()), due);

        assertEquals(3, rowsTouched);
        assertEquals(3, storedStates.get(NEW_CARD_ID).intervalDays());
        assertEquals(CardType.Review, storedStates.get(otherNewCardId).cardType());
        assertEquals(due, storedStates.get(otherNewCardId).due());
        assertEquals(3, storedStates.get(REVIEW_CARD_ID).intervalDays());
        assertEquals(due, storedStates.get(REVIEW_CARD_ID).due());
    }

    @Test
    public void testBatchSetDueDate_OnlyNewCards() {
        String otherNewCardId = TestUtils.randomId();
        useStoredSchedulingStates(TestUtils.newCard(NEW_CARD_ID, NOTE_ID), TestUtils.newCard(otherNewCardId, NOTE_ID));

        assertEquals(2, cardLifecycleService.batchSetDueDate(List.of(NEW_CARD_ID, otherNewCardId), TestUtils.NOW.plus(Duration.ofDays(3))));
    }

    @Test
    public void testBatchSetDueDate_EmptyInput() {
        assertEquals(0, cardLifecycleService.batchSetDueDate(List.of(), TestUtils.NOW));
        assertEquals(0, cardLifecycleService.batchSetDueDate(null, TestUtils.NOW));

        verifyNoInteractions(cardDao);
    }

    @Test
    public void testResetToNew() {
        when(cardDao.resetToNew(List.of(REVIEW_CARD_ID))).thenReturn(1);

        cardLifecycleService.resetToNew(REVIEW_CARD_ID);

        verify(cardDao).resetToNew(List.of(REVIEW_CARD_ID));
    }

    @Test
    public void testResetToNew_IsFixedPoint() {
        Map<String, SchedulingState> storedStates = useStoredSchedulingStates(TestUtils.reviewCard(REVIEW_CARD_ID, NOTE_ID, 2));

        cardLifecycleService.resetToNew(REVIEW_CARD_ID);
        SchedulingState afterFirstReset = storedStates.get(REVIEW_CARD_ID);

        cardLifecycleService.resetToNew(REVIEW_CARD_ID);

        assertEquals(SchedulingState.NEW_CARD_STATE, afterFirstReset);
        assertEquals(afterFirstReset, storedStates.get(REVIEW_CARD_ID));
        assertEquals(1, cardLifecycleService.batchResetToNew(List.of(REVIEW_CARD_ID)));
        assertEquals(SchedulingState.NEW_CARD_STATE, storedStates.get(REVIEW_CARD_ID));
    }

    @Test
    public void testResetToNew_NotFound() {
        when(cardDao.resetToNew(anyCollection())).thenReturn(0);

        assertThrows(NotFoundException.class, () -> cardLifecycleService.resetToNew(TestUtils.randomId()));
    }

    @Test
    public void testBatchResetToNew_DuplicatesCollapse() {
        when(cardDao.resetToNew(anyCollection())).thenAnswer(invocation -> ((Collection<?>) invocation.getArgument(0)).size());

        assertEquals(2, cardLifecycleService.batchResetToNew(List.of(NEW_CARD_ID, REVIEW_CARD_ID, NEW_CARD_ID)));
        assertEquals(0, cardLifecycleService.batchResetToNew(List.of()));
    }

    @Test
    public void testRepositionNewCards() {
        String cardId1 = TestUtils.randomId();
        String cardId2 = TestUtils.randomId();
        String cardId3 = TestUtils.randomId();
        when(cardDao.loadCardTypesForUpdate(anyCollection())).thenReturn(Map.of(
                cardId1, CardType.New, cardId2, CardType.New, cardId3, CardType.New));

        Map<String, Integer> positions = cardLifecycleService.repositionNewCards(List.of(cardId1, cardId2, cardId3), 10, 5, false);

        assertEquals(Map.of(cardId1, 10, cardId2, 15, cardId3, 20), positions);
        verify(cardDao).updatePositions(List.of(cardId1, cardId2, cardId3), List.of(10, 15, 20));
    }

    @Test
    public void testRepositionNewCards_RandomizeKeepsPositionSet() {
        List<String> cardIds = new ArrayList<>();
        Map<String, CardType> cardTypes = new HashMap<>();
        for (int index = 0; index < 20; index++) {
            String cardId = TestUtils.randomId();
            cardIds.add(cardId);
            cardTypes.put(cardId, CardType.New);
        }
        when(cardDao.loadCardTypesForUpdate(anyCollection())).thenReturn(cardTypes);

        Map<String, Integer> positions = cardLifecycleService.repositionNewCards(cardIds, 0, 1, true);

        List<Integer> assigned = new ArrayList<>(positions.values());
        Collections.sort(assigned);
        List<Integer> expected = new ArrayList<>();
        for (int index = 0; index < 20; index++) {
            expected.add(index);
        }
        assertEquals(expected, assigned);
        assertEquals(Set.copyOf(cardIds), positions.keySet());
    }

    @Test
    public void testRepositionNewCards_MissingCard() {
        String missingCardId = TestUtils.randomId();
        when(cardDao.loadCardTypesForUpdate(anyCollection())).thenReturn(Map.of(NEW_CARD_ID, CardType.New));

        NotFoundException ex = assertThrows(NotFoundException.class,
                () -> cardLifecycleService.repositionNewCards(List.of(NEW_CARD_ID, missingCardId), 0, 1, false));

        assertTrue(ex.getMessage().contains(missingCardId));
        verify(cardDao, never()).updatePositions(anyList(), anyList());
    }

    @Test
    public void testRepositionNewCards_NonNewCard() {
        when(cardDao.loadCardTypesForUpdate(anyCollection())).thenReturn(Map.of(NEW_CARD_ID, CardType.New, REVIEW_CARD_ID, CardType.Review));

        InvalidStateException ex = assertThrows(InvalidStateException.class,
                () -> cardLifecycleService.repositionNewCards(List.of(NEW_CARD_ID, REVIEW_CARD_ID), 0, 1, false));

        assertTrue(ex.getMessage().contains(REVIEW_CARD_ID));
        assertFalse(ex.getMessage().contains(NEW_CARD_ID));
        verify(cardDao, never()).updatePositions(anyList(), anyList());
    }

    @Test
    public void testCopyNote() {
        String otherDeckId = TestUtils.randomId();
        Card template0InDefaultDeck = TestUtils.reviewCard(REVIEW_CARD_ID, NOTE_ID, 0);
        Card template1InOtherDeck = new Card(TestUtils.randomId(), NOTE_ID, otherDeckId, TestUtils.TEST_USER_ID, 1,
                SchedulingState.NEW_CARD_STATE, SuspensionState.ACTIVE, 0, null, Instant.EPOCH, Instant.EPOCH);
        when(cardDao.loadCardsForNote(NOTE_ID)).thenReturn(List.of(template1InOtherDeck, template0InDefaultDeck));
        when(noteDao.loadNote(not(eq(NOTE_ID)))).thenReturn(Optional.of(NOTE));

        CopyNoteResult result = cardLifecycleService.copyNote(NOTE_ID, null);

        ArgumentCaptor<String> newNoteId = ArgumentCaptor.forClass(String.class);
        verify(noteDao).copyNote(eq(NOTE_ID), newNoteId.capture());
        assertNotEquals(NOTE_ID, newNoteId.getValue());
        verify(noteDao).copyNoteTags(NOTE_ID, newNoteId.getValue());
        verify(cardDao).createNewCard(anyString(), eq(newNoteId.getValue()), eq(TestUtils.TEST_DECK_ID), eq(0));
        verify(cardDao).createNewCard(anyString(), eq(newNoteId.getValue()), eq(otherDeckId), eq(1));
        assertNotNull(result.note());
    }

    @Test
    public void testCopyNote_TargetDeck() {
        String targetDeckId = TestUtils.randomId();
        when(deckDao.loadDeckOwner(targetDeckId)).thenReturn(Optional.of(TestUtils.TEST_USER_ID));
        when(cardDao.loadCardsForNote(NOTE_ID)).thenReturn(List.of(TestUtils.reviewCard(REVIEW_CARD_ID, NOTE_ID, 0)));
        when(noteDao.loadNote(not(eq(NOTE_ID)))).thenReturn(Optional.of(NOTE));

        cardLifecycleService.copyNote(NOTE_ID, targetDeckId);

        verify(cardDao).createNewCard(anyString(), anyString(), eq(targetDeckId), eq(0));
    }

    @Test
    public void testCopyNote_NotFound() {
        String missingDeckId = TestUtils.randomId();

        assertThrows(NotFoundException.class, () -> cardLifecycleService.copyNote(TestUtils.randomId(), null));
        assertThrows(NotFoundException.class, () -> cardLifecycleService.copyNote(NOTE_ID, missingDeckId));
        verify(noteDao, never()).copyNote(anyString(), anyString());
    }

    @Test
    public void testToggleMarked() {
        when(tagDao.detachTag(NOTE_ID, MARKED_TAG_ID)).thenReturn(false).thenReturn(true);
        when(tagDao.attachTag(NOTE_ID, MARKED_TAG_ID)).thenReturn(true);

        assertTrue(cardLifecycleService.toggleMarked(NOTE_ID));
        assertFalse(cardLifecycleService.toggleMarked(NOTE_ID));
        verify(tagDao, times(1)).attachTag(NOTE_ID, MARKED_TAG_ID);
    }

    @Test
    public void testGetCardInfo() {
        when(noteDao.loadNoteTypeSummary(NOTE_TYPE_ID)).thenReturn(Optional.of(new NoteTypeSummary(NOTE_TYPE_ID, "Basic", List.of("Recognition"))));
        when(tagDao.loadTagsForNote(NOTE_ID)).thenReturn(List.of(
                new NoteTag(TestUtils.randomId(), "Animals", "animals"),
                new NoteTag(TestUtils.randomId(), "Leech", "leech")));
        when(deckDao.loadDeckPath(TestUtils.TEST_DECK_ID)).thenReturn(List.of("Languages", "Japanese"));
        when(reviewLogDao.loadReviewStats(REVIEW_CARD_ID)).thenReturn(new ReviewStats(Instant.parse("2024-01-02T08:00:00Z"), 6500, 12));

        CardInfo cardInfo = cardLifecycleService.getCardInfo(REVIEW_CARD_ID);

        assertEquals("Japanese", cardInfo.deckName());
        assertEquals(List.of("Languages", "Japanese"), cardInfo.deckPath());
        assertEquals("Basic", cardInfo.noteTypeName());
        assertEquals("Recognition", cardInfo.templateName());
        assertEquals(List.of("Animals", "Leech"), cardInfo.tags());
        assertTrue(cardInfo.leech());
        assertFalse(cardInfo.marked());
        assertEquals(CardType.Review, cardInfo.cardType());
        assertEquals(0.9529, cardInfo.retrievability(), 0.00001);
        assertEquals(2.02, cardInfo.easeFactor(), 0.00001);
        assertEquals(6500, cardInfo.averageTimeMs());
        assertEquals(12, cardInfo.totalReviews());
        assertEquals(2, cardInfo.lapses());
    }

    @Test
    public void testGetCardInfo_MissingNoteTypeFallsBackToOrdinal() {
        when(noteDao.loadNoteTypeSummary(NOTE_TYPE_ID)).thenReturn(Optional.empty());

        CardInfo cardInfo = cardLifecycleService.getCardInfo(REVIEW_CARD_ID);

        assertNull(cardInfo.noteTypeName());
        assertNull(cardInfo.deckName());
        assertEquals("Card 1", cardInfo.templateName());
        assertNull(cardInfo.firstReviewAt());
        assertEquals(0, cardInfo.totalReviews());
    }

    @Test
    public void testToEaseFactor() {
        assertEquals(2.5, CardLifecycleService.toEaseFactor(0));
        assertEquals(3.0, CardLifecycleService.toEaseFactor(1));
        assertEquals(1.3, CardLifecycleService.toEaseFactor(10));
        assertEquals(2.15, CardLifecycleService.toEaseFactor(5.5));
    }

    @Test
    public void testCurrentRetrievability_NeverReviewed() {
        assertEquals(0, cardLifecycleService.currentRetrievability(SchedulingState.NEW_CARD_STATE));
    }

    @Test
    public void testGetPreviousCardInfo() {
        ReviewLog reviewLog = new ReviewLog(TestUtils.randomId(), REVIEW_CARD_ID, Rating.Good, 1, 3, 2.0, 4.5, 6.0, 6.2, 4200,
                ReviewType.Review, TestUtils.NOW.minus(Duration.ofDays(2)));
        when(reviewLogDao.loadLatestReviewLog(REVIEW_CARD_ID)).thenReturn(Optional.of(reviewLog));

        assertEquals(Optional.of(reviewLog), cardLifecycleService.getPreviousCardInfo(REVIEW_CARD_ID));
        assertThrows(NotFoundException.class, () -> cardLifecycleService.getPreviousCardInfo(TestUtils.randomId()));
    }

    @Test
    public void testEditDuringReview() {
        Map<String, String> updates = Map.of("Front", "犬");
        when(noteDao.mergeFields(NOTE_ID, updates)).thenReturn(Optional.of(orderedFields("Front", "犬", "Back", "cat")));

        cardLifecycleService.editDuringReview(NOTE_ID, updates);

        verify(noteDao).updateSortField(NOTE_ID, "犬", NoteFieldUtil.firstFieldChecksum("犬"));
        verify(noteDao).touchCardsForNote(NOTE_ID);
    }

    @Test
    public void testEditDuringReview_EmptyUpdatesAreNoOp() {
        cardLifecycleService.editDuringReview(NOTE_ID, Map.of());

        verifyNoInteractions(noteDao);
    }

    @Test
    public void testEditDuringReview_NotFound() {
        when(noteDao.mergeFields(anyString(), anyMap())).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> cardLifecycleService.editDuringReview(TestUtils.randomId(), Map.of("Front", "x")));
        verify(noteDao, never()).touchCardsForNote(anyString());
    }

    @Test
    public void testSetFlag() {
        when(cardDao.updateFlag(REVIEW_CARD_ID, 7)).thenReturn(1);

        cardLifecycleService.setFlag(REVIEW_CARD_ID, 7);

        verify(cardDao).updateFlag(REVIEW_CARD_ID, 7);
    }

    @Test
    public void testSetFlag_OutOfRange() {
        assertThrows(InvalidArgumentException.class, () -> cardLifecycleService.setFlag(REVIEW_CARD_ID, 8));
        assertThrows(InvalidArgumentException.class, () -> cardLifecycleService.setFlag(REVIEW_CARD_ID, -1));
        verify(cardDao, never()).updateFlag(anyString(), anyInt());
    }

    @Test
    public void testSetFlag_NotFound() {
        assertThrows(NotFoundException.class, () -> cardLifecycleService.setFlag(TestUtils.randomId(), 3));
    }

    private static Map<String, String> orderedFields(String... keysAndValues) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int index = 0; index < keysAndValues.length; index += 2) {
            fields.put(keysAndValues[index], keysAndValues[index + 1]);
        }

        return fields;
    }

    // Backs the scheduling writes with a map, applying each statement's card_type predicate
    private Map<String, SchedulingState> useStoredSchedulingStates(Card... cards) {
        Map<String, SchedulingState> storedStates = new HashMap<>();
        for (Card card : cards) {
            storedStates.put(card.id(), card.scheduling());
        }

        when(cardDao.loadCardForUpdate(anyString())).thenAnswer(invocation -> {
            String cardId = invocation.getArgument(0);
            return Optional.ofNullable(storedStates.get(cardId)).map(state -> cardWithState(cardId, state));
        });
        when(cardDao.promoteNewCard(anyString(), any(), anyInt())).thenAnswer(invocation ->
                promote(storedStates, List.of(invocation.<String>getArgument(0)), invocation.<Instant>getArgument(1),
                        invocation.<Integer>getArgument(2), false));
        when(cardDao.updateDue(anyString(), any())).thenAnswer(invocation ->
                moveDue(storedStates, List.of(invocation.<String>getArgument(0)), invocation.<Instant>getArgument(1), false));
        when(cardDao.promoteNewCards(anyCollection(), any(), anyInt())).thenAnswer(invocation ->
                promote(storedStates, invocation.<Collection<String>>getArgument(0), invocation.<Instant>getArgument(1),
                        invocation.<Integer>getArgument(2), true));
        when(cardDao.updateDueForNonNewCards(anyCollection(), any())).thenAnswer(invocation ->
                moveDue(storedStates, invocation.<Collection<String>>getArgument(0), invocation.<Instant>getArgument(1), true));
        when(cardDao.resetToNew(anyCollection())).thenAnswer(invocation -> {
            int rowsUpdated = 0;
            for (String cardId : invocation.<Collection<String>>getArgument(0)) {
                if (storedStates.replace(cardId, SchedulingState.NEW_CARD_STATE) != null) {
                    rowsUpdated++;
                }
            }
            return rowsUpdated;
        });

        return storedStates;
    }

    private static int promote(Map<String, SchedulingState> storedStates, Collection<String> cardIds, Instant due, int intervalDays,
                               boolean onlyNewCards) {
        int rowsUpdated = 0;
        for (String cardId : cardIds) {
            SchedulingState state = storedStates.get(cardId);
            if (state != null && (!onlyNewCards || state.isNew())) {
                storedStates.put(cardId, new SchedulingState(CardType.Review, due, intervalDays, state.stability(), state.difficulty(),
                        state.reps(), state.lapses(), state.lastReviewAt()));
                rowsUpdated++;
            }
        }
        return rowsUpdated;
    }

    private static int moveDue(Map<String, SchedulingState> storedStates, Collection<String> cardIds, Instant due, boolean onlyNonNewCards) {
        int rowsUpdated = 0;
        for (String cardId : cardIds) {
            SchedulingState state = storedStates.get(cardId);
            if (state != null && (!onlyNonNewCards || !state.isNew())) {
                storedStates.put(cardId, new SchedulingState(state.cardType(), due, state.intervalDays(), state.stability(),
                        state.difficulty(), state.reps(), state.lapses(), state.lastReviewAt()));
                rowsUpdated++;
            }
        }
        return rowsUpdated;
    }

    private static Card cardWithState(String cardId, SchedulingState state) {
        return new Card(cardId, NOTE_ID, TestUtils.TEST_DECK_ID, TestUtils.TEST_USER_ID, 0, state, SuspensionState.ACTIVE, 0, null,
                Instant.EPOCH, Instant.EPOCH);
    }
}
