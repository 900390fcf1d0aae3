package com.gt.flashcards.review;

import com.gt.flashcards.leech.LeechEvaluation;
import com.gt.flashcards.leech.LeechService;
import com.gt.flashcards.model.LeechAction;
import com.gt.flashcards.security.CardAccessVerifier;
import com.gt.flashcards.suspension.SuspensionService;
import com.gt.flashcards.undo.UndoSessionRegistry;
import com.gt.flashcards.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class ReviewControllerTests {

    private static final String CARD_ID = TestUtils.randomId();
    private static final UserDetails USER_DETAILS = new User(TestUtils.TEST_USER_ID, "", List.of());

    @Mock private ReviewService reviewService;
    @Mock private LeechService leechService;
    @Mock private SuspensionService suspensionService;
    @Mock private UndoSessionRegistry undoSessionRegistry;
    @Mock private CardAccessVerifier cardAccessVerifier;

    private ReviewController reviewController;

    @BeforeEach
    public void setup() {
        reviewController = new ReviewController(reviewService, leechService, suspensionService, undoSessionRegistry, cardAccessVerifier);
    }

    @Test
    public void testResetSessionEndsUndoSession() {
        reviewController.resetSession(USER_DETAILS);

        verify(undoSessionRegistry).endSession(TestUtils.TEST_USER_ID);
    }

    @Test
    public void testStartSession() {
        when(suspensionService.unburyDueToday(TestUtils.TEST_USER_ID)).thenReturn(4);

        assertEquals(4, reviewController.startSession(USER_DETAILS));
        verify(undoSessionRegistry).startSession(TestUtils.TEST_USER_ID);
    }

    @Test
    public void testCheckLeech_ConfiguredDefaults() {
        LeechEvaluation evaluation = LeechEvaluation.withoutSideEffects(false, 2, 8, LeechAction.TagOnly);
        when(leechService.checkLeech(CARD_ID)).thenReturn(evaluation);

        assertSame(evaluation, reviewController.checkLeech(new ReviewController.CheckLeechRequest(CARD_ID, null, null), USER_DETAILS));

        verify(cardAccessVerifier).verifyCardAccess(CARD_ID, TestUtils.TEST_USER_ID);
        verify(leechService, never()).checkLeech(anyString(), anyInt(), any());
    }

    @Test
    public void testCheckLeech_ThresholdOverride() {
        LeechEvaluation evaluation = new LeechEvaluation(true, 4, 4, LeechAction.TagOnly, true, false);
        when(leechService.getDefaultAction()).thenReturn(LeechAction.TagOnly);
        when(leechService.checkLeech(CARD_ID, 4, LeechAction.TagOnly)).thenReturn(evaluation);

        assertSame(evaluation, reviewController.checkLeech(new ReviewController.CheckLeechRequest(CARD_ID, 4, null), USER_DETAILS));
        verify(leechService, never()).checkLeech(CARD_ID);
    }
}
