package com.gt.flashcards.lifecycle;

import com.gt.flashcards.lifecycle.model.CardInfo;
import com.gt.flashcards.lifecycle.model.CopyNoteResult;
import com.gt.flashcards.model.ReviewLog;
import com.gt.flashcards.security.CardAccessVerifier;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/rest/cards")
public class CardLifecycleController {

    private final CardLifecycleService cardLifecycleService;
    private final CardAccessVerifier cardAccessVerifier;

    @Autowired
    public CardLifecycleController(CardLifecycleService cardLifecycleService, CardAccessVerifier cardAccessVerifier) {
        this.cardLifecycleService = cardLifecycleService;
        this.cardAccessVerifier = cardAccessVerifier;
    }

    @PostMapping(value = "/setDueDate", consumes = "application/json")
    public void setDueDate(@RequestBody SetDueDateRequest setDueDateRequest,
                           @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyCardAccess(setDueDateRequest.cardId(), userDetails.getUsername());
        cardLifecycleService.setDueDate(setDueDateRequest.cardId(), setDueDateRequest.due());
    }

    @PostMapping(value = "/batchSetDueDate", consumes = "application/json", produces = "application/json")
    public int batchSetDueDate(@RequestBody BatchSetDueDateRequest batchSetDueDateRequest,
                               @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyCardAccess(batchSetDueDateRequest.cardIds(), userDetails.getUsername());
        return cardLifecycleService.batchSetDueDate(batchSetDueDateRequest.cardIds(), batchSetDueDateRequest.due());
    }

    @PostMapping(value = "/resetToNew")
    public void resetToNew(@RequestBody String cardId,
                           @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyCardAccess(cardId, userDetails.getUsername());
        cardLifecycleService.resetToNew(cardId);
    }

    @PostMapping(value = "/batchResetToNew", consumes = "application/json", produces = "application/json")
    public int batchResetToNew(@RequestBody List<String> cardIds,
                               @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyCardAccess(cardIds, userDetails.getUsername());
        return cardLifecycleService.batchResetToNew(cardIds);
    }

    @PostMapping(value = "/reposition", consumes = "application/json", produces = "application/json")
    public Map<String, Integer> repositionNewCards(@RequestBody RepositionRequest repositionRequest,
                                                   @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyCardAccess(repositionRequest.cardIds(), userDetails.getUsername());
        return cardLifecycleService.repositionNewCards(
                repositionRequest.cardIds(),
                repositionRequest.start(),
                repositionRequest.step(),
                repositionRequest.randomize());
    }

    @PutMapping(value = "/copyNote", consumes = "application/json", produces = "application/json")
    public CopyNoteResult copyNote(@RequestBody CopyNoteRequest copyNoteRequest,
                                   @AuthenticationPrincipal UserDetails userDetails,
                                   HttpServletResponse response) {
        cardAccessVerifier.verifyNoteAccess(copyNoteRequest.noteId(), userDetails.getUsername());
        if (copyNoteRequest.targetDeckId() != null && !copyNoteRequest.targetDeckId().isBlank()) {
            cardAccessVerifier.verifyDeckAccess(copyNoteRequest.targetDeckId(), userDetails.getUsername());
        }

        CopyNoteResult copyNoteResult = cardLifecycleService.copyNote(copyNoteRequest.noteId(), copyNoteRequest.targetDeckId());

        response.setStatus(HttpServletResponse.SC_CREATED);
        return copyNoteResult;
    }

    @PostMapping(value = "/toggleMarked", produces = "application/json")
    public boolean toggleMarked(@RequestBody String noteId,
                                @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyNoteAccess(noteId, userDetails.getUsername());
        return cardLifecycleService.toggleMarked(noteId);
    }

    @GetMapping(value = "/cardInfo", produces = "application/json")
    public CardInfo getCardInfo(@RequestParam(value = "id") String cardId,
                                @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyCardAccess(cardId, userDetails.getUsername());
        return cardLifecycleService.getCardInfo(cardId);
    }

    @GetMapping(value = "/previousCardInfo", produces = "application/json")
    public ReviewLog getPreviousCardInfo(@RequestParam(value = "id") String cardId,
                                         @AuthenticationPrincipal UserDetails userDetails,
                                         HttpServletResponse response) {
        cardAccessVerifier.verifyCardAccess(cardId, userDetails.getUsername());

        ReviewLog reviewLog = cardLifecycleService.getPreviousCardInfo(cardId).orElse(null);
        if (reviewLog == null) {
            response.setStatus(HttpServletResponse.SC_NO_CONTENT);
        }

        return reviewLog;
    }

    @PostMapping(value = "/editDuringReview", consumes = "application/json")
    public void editDuringReview(@RequestBody EditDuringReviewRequest editDuringReviewRequest,
                                 @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyNoteAccess(editDuringReviewRequest.noteId(), userDetails.getUsername());
        cardLifecycleService.editDuringReview(editDuringReviewRequest.noteId(), editDuringReviewRequest.fieldUpdates());
    }

    @PostMapping(value = "/setFlag", consumes = "application/json")
    public void setFlag(@RequestBody SetFlagRequest setFlagRequest,
                        @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyCardAccess(setFlagRequest.cardId(), userDetails.getUsername());
        cardLifecycleService.setFlag(setFlagRequest.cardId(), setFlagRequest.flag());
    }

    private record SetDueDateRequest(String cardId, Instant due) { }
    private record BatchSetDueDateRequest(List<String> cardIds, Instant due) { }
    private record RepositionRequest(List<String> cardIds, int start, int step, boolean randomize) { }
    private record CopyNoteRequest(String noteId, String targetDeckId) { }
    private record EditDuringReviewRequest(String noteId, Map<String, String> fieldUpdates) { }
    private record SetFlagRequest(String cardId, int flag) { }
}
