package com.gt.flashcards.review;

import com.gt.flashcards.leech.LeechEvaluation;
import com.gt.flashcards.leech.LeechService;
import com.gt.flashcards.model.LeechAction;
import com.gt.flashcards.review.model.ReviewAnswer;
import com.gt.flashcards.review.model.ReviewOutcome;
import com.gt.flashcards.security.CardAccessVerifier;
import com.gt.flashcards.suspension.SuspensionService;
import com.gt.flashcards.undo.UndoResult;
import com.gt.flashcards.undo.UndoSessionRegistry;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/rest/review")
public class ReviewController {

    private static final Logger log = LoggerFactory.getLogger(ReviewController.class);

    private final ReviewService reviewService;
    private final LeechService leechService;
    private final SuspensionService suspensionService;
    private final UndoSessionRegistry undoSessionRegistry;
    private final CardAccessVerifier cardAccessVerifier;

    @Autowired
    public ReviewController(ReviewService reviewService,
                            LeechService leechService,
                            SuspensionService suspensionService,
                            UndoSessionRegistry undoSessionRegistry,
                            CardAccessVerifier cardAccessVerifier) {
        this.reviewService = reviewService;
        this.leechService = leechService;
        this.suspensionService = suspensionService;
        this.undoSessionRegistry = undoSessionRegistry;
        this.cardAccessVerifier = cardAccessVerifier;
    }

    @PostMapping(value = "/startSession", produces = "application/json")
    public int startSession(@AuthenticationPrincipal UserDetails userDetails) {
        int unburied = suspensionService.unburyDueToday(userDetails.getUsername());
        undoSessionRegistry.startSession(userDetails.getUsername());

        log.info("Started study session for user {}. {} cards unburied.", userDetails.getUsername(), unburied);
        return unburied;
    }

    @PostMapping(value = "/resetSession")
    public void resetSession(@AuthenticationPrincipal UserDetails userDetails) {
        undoSessionRegistry.endSession(userDetails.getUsername());
    }

    @PostMapping(value = "/answer", consumes = "application/json", produces = "application/json")
    public ReviewOutcome answer(@RequestBody ReviewAnswer reviewAnswer,
                                @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyCardAccess(reviewAnswer.cardId(), userDetails.getUsername());

        return reviewService.applyReview(
                undoSessionRegistry.getStack(userDetails.getUsername()),
                reviewAnswer.cardId(),
                reviewAnswer.rating(),
                reviewAnswer.nextState(),
                reviewAnswer.timeSpentMs());
    }

    @PostMapping(value = "/undo", produces = "application/json")
    public UndoResult undo(@AuthenticationPrincipal UserDetails userDetails,
                           HttpServletResponse response) {
        UndoResult undoResult = undoSessionRegistry.getStack(userDetails.getUsername()).undo().orElse(null);
        if (undoResult == null) {
            response.setStatus(HttpServletResponse.SC_NO_CONTENT);
        }

        return undoResult;
    }

    @GetMapping(value = "/peekUndo", produces = "application/json")
    public UndoPreview peekUndo(@AuthenticationPrincipal UserDetails userDetails) {
        return new UndoPreview(undoSessionRegistry.getStack(userDetails.getUsername()).peekUndo().orElse(null));
    }

    @GetMapping(value = "/canUndo", produces = "application/json")
    public boolean canUndo(@AuthenticationPrincipal UserDetails userDetails) {
        return undoSessionRegistry.getStack(userDetails.getUsername()).canUndo();
    }

    @PostMapping(value = "/checkLeech", consumes = "application/json", produces = "application/json")
    public LeechEvaluation checkLeech(@RequestBody CheckLeechRequest checkLeechRequest,
                                      @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyCardAccess(checkLeechRequest.cardId(), userDetails.getUsername());

        if (checkLeechRequest.threshold() == null && checkLeechRequest.action() == null) {
            return leechService.checkLeech(checkLeechRequest.cardId());
        }

        int threshold = checkLeechRequest.threshold() == null ? leechService.getDefaultThreshold() : checkLeechRequest.threshold();
        LeechAction action = checkLeechRequest.action() == null ? leechService.getDefaultAction() : checkLeechRequest.action();

        return leechService.checkLeech(checkLeechRequest.cardId(), threshold, action);
    }

    record UndoPreview(String description) { }
    record CheckLeechRequest(String cardId, Integer threshold, LeechAction action) { }
}
