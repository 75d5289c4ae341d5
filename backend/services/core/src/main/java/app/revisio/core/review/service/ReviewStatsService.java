package app.revisio.core.review.service;

import app.revisio.core.review.controller.dto.DeckSummaryResponse;
import app.revisio.core.review.repository.FlashcardRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
public class ReviewStatsService {

    private final FlashcardRepository cardRepo;
    private final Clock clock;

    public ReviewStatsService(FlashcardRepository cardRepo, Clock clock) {
        this.cardRepo = cardRepo;
        this.clock = clock;
    }

    /**
     * Per-topic card counts by phase, plus how many cards can be studied right now.
     */
    @Transactional(readOnly = true)
    public List<DeckSummaryResponse> deckSummaries(UUID userId) {
        return cardRepo.summarizeByTopic(userId, clock.instant()).stream()
                .map(p -> new DeckSummaryResponse(
                        p.getTopic(),
                        p.getTotal(),
                        p.getDue(),
                        p.getNewCount(),
                        p.getLearningCount(),
                        p.getReviewCount(),
                        p.getRelearningCount()
                ))
                .toList();
    }
}
