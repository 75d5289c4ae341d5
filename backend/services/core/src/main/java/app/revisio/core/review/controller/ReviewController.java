package app.revisio.core.review.controller;

import app.revisio.core.review.controller.dto.AnswerCardRequest;
import app.revisio.core.review.controller.dto.CardPreviewResponse;
import app.revisio.core.review.controller.dto.DeckSummaryResponse;
import app.revisio.core.review.controller.dto.DueCardResponse;
import app.revisio.core.review.controller.dto.ReviewAnswerResponse;
import app.revisio.core.review.service.ReviewService;
import app.revisio.core.review.service.ReviewStatsService;
import app.revisio.core.security.CurrentUserProvider;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/review")
public class ReviewController {

    private final CurrentUserProvider currentUserProvider;
    private final ReviewService reviewService;
    private final ReviewStatsService statsService;

    public ReviewController(CurrentUserProvider currentUserProvider,
                            ReviewService reviewService,
                            ReviewStatsService statsService) {
        this.currentUserProvider = currentUserProvider;
        this.reviewService = reviewService;
        this.statsService = statsService;
    }

    // GET /review/decks
    @GetMapping("/decks")
    public List<DeckSummaryResponse> decks(@AuthenticationPrincipal Jwt jwt) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return statsService.deckSummaries(userId);
    }

    // GET /review/decks/{topic}/due
    @GetMapping("/decks/{topic}/due")
    public List<DueCardResponse> due(@AuthenticationPrincipal Jwt jwt,
                                     @PathVariable String topic) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return reviewService.dueCards(userId, topic);
    }

    // GET /review/cards/{cardId}/preview
    @GetMapping("/cards/{cardId}/preview")
    public CardPreviewResponse preview(@AuthenticationPrincipal Jwt jwt,
                                       @PathVariable UUID cardId) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return reviewService.preview(userId, cardId);
    }

    // POST /review/cards/{cardId}/answer
    @PostMapping("/cards/{cardId}/answer")
    public ReviewAnswerResponse answer(@AuthenticationPrincipal Jwt jwt,
                                       @PathVariable UUID cardId,
                                       @Valid @RequestBody AnswerCardRequest req) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return reviewService.answer(userId, cardId, req.rating());
    }
}
