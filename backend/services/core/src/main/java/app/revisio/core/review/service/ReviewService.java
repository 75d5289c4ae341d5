package app.revisio.core.review.service;

import app.revisio.core.config.FsrsProps;
import app.revisio.core.review.adapter.SchedulingRecordMapper;
import app.revisio.core.review.algorithm.ForgettingCurve;
import app.revisio.core.review.algorithm.FsrsScheduler;
import app.revisio.core.review.algorithm.ReviewPreview;
import app.revisio.core.review.algorithm.SchedulingRecord;
import app.revisio.core.review.algorithm.SchedulingResult;
import app.revisio.core.review.controller.dto.CardPreviewResponse;
import app.revisio.core.review.controller.dto.DueCardResponse;
import app.revisio.core.review.controller.dto.IntervalPreview;
import app.revisio.core.review.controller.dto.ReviewAnswerResponse;
import app.revisio.core.review.domain.CardState;
import app.revisio.core.review.domain.Rating;
import app.revisio.core.review.entity.FlashcardEntity;
import app.revisio.core.review.entity.ReviewLogEntity;
import app.revisio.core.review.exception.CardAccessDeniedException;
import app.revisio.core.review.exception.CardNotFoundException;
import app.revisio.core.review.repository.FlashcardRepository;
import app.revisio.core.review.repository.ReviewLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final FlashcardRepository cardRepo;
    private final ReviewLogRepository logRepo;
    private final FsrsScheduler scheduler;
    private final SchedulingRecordMapper mapper;
    private final Clock clock;
    private final int newCardsPerSession;

    public ReviewService(FlashcardRepository cardRepo,
                         ReviewLogRepository logRepo,
                         FsrsScheduler scheduler,
                         SchedulingRecordMapper mapper,
                         Clock clock,
                         FsrsProps props) {
        this.cardRepo = cardRepo;
        this.logRepo = logRepo;
        this.scheduler = scheduler;
        this.mapper = mapper;
        this.clock = clock;
        this.newCardsPerSession = props.newCardsLimit();
    }

    /**
     * Applies one rating to a card. The row lock keeps concurrent answers for the same card from interleaving.
     */
    @Transactional
    public ReviewAnswerResponse answer(UUID userId, UUID cardId, int ratingCode) {
        Rating rating = Rating.fromGrade(ratingCode);
        Instant now = clock.instant();

        FlashcardEntity card = cardRepo.findByIdForUpdate(cardId)
                .orElseThrow(() -> new CardNotFoundException(cardId));
        requireOwner(card, userId);

        SchedulingRecord before = mapper.toRecord(card);
        SchedulingResult result = scheduler.review(before, rating, now);
        SchedulingRecord after = result.record();

        mapper.apply(after, card);
        cardRepo.save(card);
        logRepo.save(toLog(card, userId, rating, before, now, result.retrievability()));

        if (before.state() == CardState.REVIEW && after.state() == CardState.RELEARNING) {
            log.info("Card {} lapsed (lapses={}, stability {} -> {})",
                    cardId, after.lapses(), before.stability(), after.stability());
        }
        log.debug("Card {} rated {}: {} -> {}, due {}",
                cardId, rating, before.state(), after.state(), after.due());

        return new ReviewAnswerResponse(
                cardId,
                rating,
                after.state(),
                after.due(),
                after.scheduledDays(),
                SchedulingRecordMapper.unscale(card.getStability()),
                SchedulingRecordMapper.unscale(card.getDifficulty()),
                toPercent(result.retrievability())
        );
    }

    /**
     * Cards of a topic that are due now, followed by a bounded batch of new cards.
     */
    @Transactional(readOnly = true)
    public List<DueCardResponse> dueCards(UUID userId, String topic) {
        Instant now = clock.instant();

        List<FlashcardEntity> cards = new ArrayList<>(cardRepo.findDueCards(userId, topic, now));
        if (newCardsPerSession > 0) {
            cards.addAll(cardRepo.findNewCards(userId, topic, PageRequest.of(0, newCardsPerSession)));
        }

        List<DueCardResponse> out = new ArrayList<>(cards.size());
        for (FlashcardEntity card : cards) {
            SchedulingRecord record = mapper.toRecord(card);
            ReviewPreview preview = scheduler.preview(record, now);
            out.add(new DueCardResponse(
                    card.getCardId(),
                    card.getFront(),
                    card.getBack(),
                    record.state(),
                    record.stability(),
                    record.difficulty(),
                    record.reps(),
                    record.lapses(),
                    record.due(),
                    toPercent(preview.retrievability()),
                    toIntervals(preview)
            ));
        }
        return out;
    }

    @Transactional(readOnly = true)
    public CardPreviewResponse preview(UUID userId, UUID cardId) {
        Instant now = clock.instant();
        FlashcardEntity card = cardRepo.findById(cardId)
                .orElseThrow(() -> new CardNotFoundException(cardId));
        requireOwner(card, userId);

        SchedulingRecord record = mapper.toRecord(card);
        ReviewPreview preview = scheduler.preview(record, now);
        return new CardPreviewResponse(
                cardId,
                record.state(),
                toPercent(preview.retrievability()),
                toIntervals(preview)
        );
    }

    private static void requireOwner(FlashcardEntity card, UUID userId) {
        if (!card.getUserId().equals(userId)) {
            throw new CardAccessDeniedException(card.getCardId());
        }
    }

    private static Map<Rating, IntervalPreview> toIntervals(ReviewPreview preview) {
        Map<Rating, String> labels = preview.labels();
        Map<Rating, IntervalPreview> out = new EnumMap<>(Rating.class);
        for (Rating rating : Rating.values()) {
            out.put(rating, new IntervalPreview(preview.outcome(rating).due(), labels.get(rating)));
        }
        return out;
    }

    private static ReviewLogEntity toLog(FlashcardEntity card,
                                         UUID userId,
                                         Rating rating,
                                         SchedulingRecord before,
                                         Instant now,
                                         double retrievability) {
        ReviewLogEntity entry = new ReviewLogEntity();
        entry.setCardId(card.getCardId());
        entry.setUserId(userId);
        entry.setReviewedAt(now);
        entry.setRating((short) rating.grade());
        entry.setStateBefore(before.state().code());
        entry.setStateAfter(card.getState());
        entry.setStabilityAfter(card.getStability());
        entry.setDifficultyAfter(card.getDifficulty());
        entry.setScheduledDays(card.getScheduledDays());
        entry.setElapsedDays(ForgettingCurve.elapsedDays(before.lastReview(), now));
        entry.setRetrievability(retrievability);
        return entry;
    }

    static double toPercent(double retrievability) {
        return Math.round(retrievability * 1000.0) / 10.0;
    }
}
