package app.revisio.core.review.controller;

import app.revisio.core.review.controller.dto.CardPreviewResponse;
import app.revisio.core.review.controller.dto.DeckSummaryResponse;
import app.revisio.core.review.controller.dto.DueCardResponse;
import app.revisio.core.review.controller.dto.IntervalPreview;
import app.revisio.core.review.controller.dto.ReviewAnswerResponse;
import app.revisio.core.review.domain.CardState;
import app.revisio.core.review.domain.Rating;
import app.revisio.core.review.exception.CardAccessDeniedException;
import app.revisio.core.review.exception.CardNotFoundException;
import app.revisio.core.review.exception.InvalidRatingException;
import app.revisio.core.review.exception.InvalidSchedulingStateException;
import app.revisio.core.review.service.ReviewService;
import app.revisio.core.review.service.ReviewStatsService;
import app.revisio.core.security.CurrentUserProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReviewController.class)
@ActiveProfiles("test")
class ReviewControllerWebMvcTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    ReviewService reviewService;

    @MockitoBean
    ReviewStatsService statsService;

    @MockitoBean
    CurrentUserProvider currentUserProvider;

    private final UUID userId = UUID.randomUUID();

    private static Map<Rating, IntervalPreview> intervals() {
        Map<Rating, IntervalPreview> out = new EnumMap<>(Rating.class);
        out.put(Rating.AGAIN, new IntervalPreview(NOW.plusSeconds(600), "10m"));
        out.put(Rating.HARD, new IntervalPreview(NOW.plusSeconds(11 * 86400L), "11d"));
        out.put(Rating.GOOD, new IntervalPreview(NOW.plusSeconds(34 * 86400L), "1.1mo"));
        out.put(Rating.EASY, new IntervalPreview(NOW.plusSeconds(35 * 86400L), "1.2mo"));
        return out;
    }

    @Test
    void decks_returnsSummariesForCurrentUser() throws Exception {
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(statsService.deckSummaries(userId)).thenReturn(List.of(
                new DeckSummaryResponse("capitals", 12, 7, 5, 1, 5, 1)
        ));

        mockMvc.perform(get("/review/decks").with(jwt()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].topic").value("capitals"))
                .andExpect(jsonPath("$[0].due").value(7))
                .andExpect(jsonPath("$[0].relearningCount").value(1));
    }

    @Test
    void decks_requiresAuthentication() throws Exception {
        mockMvc.perform(get("/review/decks"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(statsService);
    }

    @Test
    void due_returnsCardsWithIntervalLabels() throws Exception {
        UUID cardId = UUID.randomUUID();
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(reviewService.dueCards(userId, "capitals")).thenReturn(List.of(new DueCardResponse(
                cardId, "Capital of Peru?", "Lima", CardState.REVIEW, 10.0, 5.0, 3, 0, NOW, 90.0, intervals()
        )));

        mockMvc.perform(get("/review/decks/{topic}/due", "capitals").with(jwt()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].cardId").value(cardId.toString()))
                .andExpect(jsonPath("$[0].state").value("REVIEW"))
                .andExpect(jsonPath("$[0].retrievabilityPercent").value(90.0))
                .andExpect(jsonPath("$[0].intervals.AGAIN.display").value("10m"))
                .andExpect(jsonPath("$[0].intervals.GOOD.display").value("1.1mo"));
    }

    @Test
    void preview_returnsEveryRating() throws Exception {
        UUID cardId = UUID.randomUUID();
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(reviewService.preview(userId, cardId))
                .thenReturn(new CardPreviewResponse(cardId, CardState.REVIEW, 90.0, intervals()));

        mockMvc.perform(get("/review/cards/{cardId}/preview", cardId).with(jwt()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intervals.HARD.display").value("11d"))
                .andExpect(jsonPath("$.intervals.EASY.display").value("1.2mo"));
    }

    @Test
    void answer_returnsScheduledOutcome() throws Exception {
        UUID cardId = UUID.randomUUID();
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(reviewService.answer(userId, cardId, 3)).thenReturn(new ReviewAnswerResponse(
                cardId, Rating.GOOD, CardState.REVIEW, NOW.plusSeconds(34 * 86400L), 34, 34.19, 5.34, 90.0
        ));

        mockMvc.perform(post("/review/cards/{cardId}/answer", cardId)
                        .with(jwt())
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rating").value("GOOD"))
                .andExpect(jsonPath("$.scheduledDays").value(34))
                .andExpect(jsonPath("$.stability").value(34.19));
    }

    @Test
    void answer_outOfRangeRating_isBadRequest() throws Exception {
        UUID cardId = UUID.randomUUID();
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(reviewService.answer(userId, cardId, 7)).thenThrow(new InvalidRatingException(7));

        mockMvc.perform(post("/review/cards/{cardId}/answer", cardId)
                        .with(jwt())
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":7}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Failed"))
                .andExpect(jsonPath("$.detail").value("Rating must be between 1 and 4, got 7"));
    }

    @Test
    void answer_missingRating_isBadRequest() throws Exception {
        mockMvc.perform(post("/review/cards/{cardId}/answer", UUID.randomUUID())
                        .with(jwt())
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(reviewService);
    }

    @Test
    void answer_unknownCard_isNotFound() throws Exception {
        UUID cardId = UUID.randomUUID();
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(reviewService.answer(eq(userId), eq(cardId), anyInt())).thenThrow(new CardNotFoundException(cardId));

        mockMvc.perform(post("/review/cards/{cardId}/answer", cardId)
                        .with(jwt())
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":3}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Card Not Found"));
    }

    @Test
    void answer_cardOfAnotherUser_isForbidden() throws Exception {
        UUID cardId = UUID.randomUUID();
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(reviewService.answer(eq(userId), eq(cardId), anyInt())).thenThrow(new CardAccessDeniedException(cardId));

        mockMvc.perform(post("/review/cards/{cardId}/answer", cardId)
                        .with(jwt())
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":3}"))
                .andExpect(status().isForbidden());
    }

    @Test
    void answer_concurrentUpdate_isConflict() throws Exception {
        UUID cardId = UUID.randomUUID();
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(reviewService.answer(eq(userId), eq(cardId), anyInt()))
                .thenThrow(new OptimisticLockingFailureException("row version changed"));

        mockMvc.perform(post("/review/cards/{cardId}/answer", cardId)
                        .with(jwt())
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":3}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.title").value("Concurrent Update"));
    }

    @Test
    void preview_corruptedCard_isServerError() throws Exception {
        UUID cardId = UUID.randomUUID();
        when(currentUserProvider.getUserId(any(Jwt.class))).thenReturn(userId);
        when(reviewService.preview(userId, cardId))
                .thenThrow(new InvalidSchedulingStateException("Invalid stability -0.5 for a review card"));

        mockMvc.perform(get("/review/cards/{cardId}/preview", cardId).with(jwt()))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.title").value("Invalid Scheduling State"));
    }
}
