package com.gt.flashcards.suspension;

import com.gt.flashcards.security.CardAccessVerifier;
import com.gt.flashcards.suspension.model.BatchSuspensionResult;
import com.gt.flashcards.suspension.model.PausedCardGroup;
import com.gt.flashcards.suspension.model.PausedCardGrouping;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/rest/suspension")
public class SuspensionController {

    private final SuspensionService suspensionService;
    private final CardAccessVerifier cardAccessVerifier;

    @Autowired
    public SuspensionController(SuspensionService suspensionService, CardAccessVerifier cardAccessVerifier) {
        this.suspensionService = suspensionService;
        this.cardAccessVerifier = cardAccessVerifier;
    }

    @PostMapping(value = "/pause", consumes = "application/json")
    public void pause(@RequestBody PauseRequest pauseRequest,
                      @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyCardAccess(pauseRequest.cardId(), userDetails.getUsername());
        suspensionService.pause(pauseRequest.cardId(), pauseRequest.reason());
    }

    @PostMapping(value = "/resume")
    public void resume(@RequestBody String cardId,
                       @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyCardAccess(cardId, userDetails.getUsername());
        suspensionService.resume(cardId);
    }

    @PostMapping(value = "/skipUntilTomorrow")
    public void skipUntilTomorrow(@RequestBody String cardId,
                                  @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyCardAccess(cardId, userDetails.getUsername());
        suspensionService.skipUntilTomorrow(cardId);
    }

    @PostMapping(value = "/pauseUntil", consumes = "application/json")
    public void pauseUntil(@RequestBody PauseUntilRequest pauseUntilRequest,
                           @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyCardAccess(pauseUntilRequest.cardId(), userDetails.getUsername());
        suspensionService.pauseUntil(pauseUntilRequest.cardId(), pauseUntilRequest.resumeDate(), pauseUntilRequest.reason());
    }

    @PostMapping(value = "/pauseByTag", consumes = "application/json", produces = "application/json")
    public BatchSuspensionResult pauseByTag(@RequestBody TagBatchRequest tagBatchRequest,
                                            @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyTagAccess(tagBatchRequest.tagId(), userDetails.getUsername());
        return suspensionService.pauseByTag(tagBatchRequest.tagId(), tagBatchRequest.includeChildren(), tagBatchRequest.reason());
    }

    @PostMapping(value = "/resumeByTag", consumes = "application/json", produces = "application/json")
    public BatchSuspensionResult resumeByTag(@RequestBody TagBatchRequest tagBatchRequest,
                                             @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyTagAccess(tagBatchRequest.tagId(), userDetails.getUsername());
        return suspensionService.resumeByTag(tagBatchRequest.tagId(), tagBatchRequest.includeChildren());
    }

    @PostMapping(value = "/pauseByDeck", consumes = "application/json", produces = "application/json")
    public BatchSuspensionResult pauseByDeck(@RequestBody DeckBatchRequest deckBatchRequest,
                                             @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyDeckAccess(deckBatchRequest.deckId(), userDetails.getUsername());
        return suspensionService.pauseByDeck(deckBatchRequest.deckId(), deckBatchRequest.includeSubdecks(), deckBatchRequest.reason());
    }

    @PostMapping(value = "/resumeByDeck", consumes = "application/json", produces = "application/json")
    public BatchSuspensionResult resumeByDeck(@RequestBody DeckBatchRequest deckBatchRequest,
                                              @AuthenticationPrincipal UserDetails userDetails) {
        cardAccessVerifier.verifyDeckAccess(deckBatchRequest.deckId(), userDetails.getUsername());
        return suspensionService.resumeByDeck(deckBatchRequest.deckId(), deckBatchRequest.includeSubdecks());
    }

    @PostMapping(value = "/unburyDueToday", produces = "application/json")
    public int unburyDueToday(@AuthenticationPrincipal UserDetails userDetails) {
        return suspensionService.unburyDueToday(userDetails.getUsername());
    }

    @GetMapping(value = "/pausedCards", produces = "application/json")
    public List<PausedCardGroup> getPausedCards(@RequestParam(value = "groupBy") Optional<String> groupBy,
                                                @AuthenticationPrincipal UserDetails userDetails) {
        return suspensionService.getPausedCards(userDetails.getUsername(), PausedCardGrouping.fromValue(groupBy.orElse(null)));
    }

    @GetMapping(value = "/pausedCardCount", produces = "application/json")
    public int getPausedCardCount(@AuthenticationPrincipal UserDetails userDetails) {
        return suspensionService.getPausedCardCount(userDetails.getUsername());
    }

    private record PauseRequest(String cardId, String reason) { }
    private record PauseUntilRequest(String cardId, LocalDate resumeDate, String reason) { }
    private record TagBatchRequest(String tagId, boolean includeChildren, String reason) { }
    private record DeckBatchRequest(String deckId, boolean includeSubdecks, String reason) { }
}
