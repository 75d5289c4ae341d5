package app.revisio.core.review.adapter;

import app.revisio.core.review.algorithm.SchedulingRecord;
import app.revisio.core.review.domain.CardState;
import app.revisio.core.review.entity.FlashcardEntity;
import org.springframework.stereotype.Component;

/**
 * Converts between the integer columns of {@link FlashcardEntity} (values times 100) and real-valued records.
 */
@Component
public class SchedulingRecordMapper {

    static final double SCALE = 100.0;

    public SchedulingRecord toRecord(FlashcardEntity card) {
        return new SchedulingRecord(
                CardState.fromCode(card.getState()),
                unscale(card.getStability()),
                unscale(card.getDifficulty()),
                card.getScheduledDays(),
                card.getDueAt(),
                card.getLastReviewAt(),
                card.getReps(),
                card.getLapses(),
                card.getStep()
        );
    }

    public void apply(SchedulingRecord record, FlashcardEntity card) {
        card.setState(record.state().code());
        card.setStability(scale(record.stability()));
        card.setDifficulty(scale(record.difficulty()));
        card.setScheduledDays(record.scheduledDays());
        card.setDueAt(record.due());
        card.setLastReviewAt(record.lastReview());
        card.setReps(record.reps());
        card.setLapses(record.lapses());
        card.setStep(record.step());
    }

    public static int scale(double value) {
        long scaled = Math.round(value * SCALE);
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, scaled));
    }

    public static double unscale(int value) {
        return value / SCALE;
    }
}
