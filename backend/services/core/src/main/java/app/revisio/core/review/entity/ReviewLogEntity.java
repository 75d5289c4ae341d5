package app.revisio.core.review.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "review_logs", schema = "app_core")
public class ReviewLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "reviewed_at", nullable = false)
    private Instant reviewedAt;

    @Column(name = "rating", nullable = false)
    private short rating;

    @Column(name = "state_before", nullable = false)
    private int stateBefore;

    @Column(name = "state_after", nullable = false)
    private int stateAfter;

    @Column(name = "stability_after", nullable = false)
    private int stabilityAfter;

    @Column(name = "difficulty_after", nullable = false)
    private int difficultyAfter;

    @Column(name = "scheduled_days", nullable = false)
    private int scheduledDays;

    @Column(name = "elapsed_days", nullable = false)
    private double elapsedDays;

    @Column(name = "retrievability", nullable = false)
    private double retrievability;

    public Long getId() {
        return id;
    }

    public UUID getCardId() {
        return cardId;
    }

    public void setCardId(UUID cardId) {
        this.cardId = cardId;
    }

    public UUID getUserId() {
        return userId;
    }

    public void setUserId(UUID userId) {
        this.userId = userId;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public void setReviewedAt(Instant reviewedAt) {
        this.reviewedAt = reviewedAt;
    }

    public short getRating() {
        return rating;
    }

    public void setRating(short rating) {
        this.rating = rating;
    }

    public int getStateBefore() {
        return stateBefore;
    }

    public void setStateBefore(int stateBefore) {
        this.stateBefore = stateBefore;
    }

    public int getStateAfter() {
        return stateAfter;
    }

    public void setStateAfter(int stateAfter) {
        this.stateAfter = stateAfter;
    }

    public int getStabilityAfter() {
        return stabilityAfter;
    }

    public void setStabilityAfter(int stabilityAfter) {
        this.stabilityAfter = stabilityAfter;
    }

    public int getDifficultyAfter() {
        return difficultyAfter;
    }

    public void setDifficultyAfter(int difficultyAfter) {
        this.difficultyAfter = difficultyAfter;
    }

    public int getScheduledDays() {
        return scheduledDays;
    }

    public void setScheduledDays(int scheduledDays) {
        this.scheduledDays = scheduledDays;
    }

    public double getElapsedDays() {
        return elapsedDays;
    }

    public void setElapsedDays(double elapsedDays) {
        this.elapsedDays = elapsedDays;
    }

    public double getRetrievability() {
        return retrievability;
    }

    public void setRetrievability(double retrievability) {
        this.retrievability = retrievability;
    }
}
