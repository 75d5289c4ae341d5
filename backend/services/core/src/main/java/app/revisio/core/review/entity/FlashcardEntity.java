package app.revisio.core.review.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A flashcard with its scheduling columns. Stability and difficulty are stored multiplied by 100.
 */
@Entity
@Table(name = "flashcards", schema = "app_core")
public class FlashcardEntity {

    @Id
    @Column(name = "card_id")
    private UUID cardId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "topic", nullable = false)
    private String topic;

    @Column(name = "front", nullable = false, columnDefinition = "text")
    private String front;

    @Column(name = "back", nullable = false, columnDefinition = "text")
    private String back;

    @Column(name = "state", nullable = false)
    private int state;

    @Column(name = "stability", nullable = false)
    private int stability;

    @Column(name = "difficulty", nullable = false)
    private int difficulty;

    @Column(name = "scheduled_days", nullable = false)
    private int scheduledDays;

    @Column(name = "due_at", nullable = false)
    private Instant dueAt;

    @Column(name = "last_review_at")
    private Instant lastReviewAt;

    @Column(name = "reps", nullable = false)
    private int reps;

    @Column(name = "lapses", nullable = false)
    private int lapses;

    @Column(name = "step", nullable = false)
    private int step;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Version
    @Column(name = "row_version", nullable = false)
    private long rowVersion;

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

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public String getFront() {
        return front;
    }

    public void setFront(String front) {
        this.front = front;
    }

    public String getBack() {
        return back;
    }

    public void setBack(String back) {
        this.back = back;
    }

    public int getState() {
        return state;
    }

    public void setState(int state) {
        this.state = state;
    }

    public int getStability() {
        return stability;
    }

    public void setStability(int stability) {
        this.stability = stability;
    }

    public int getDifficulty() {
        return difficulty;
    }

    public void setDifficulty(int difficulty) {
        this.difficulty = difficulty;
    }

    public int getScheduledDays() {
        return scheduledDays;
    }

    public void setScheduledDays(int scheduledDays) {
        this.scheduledDays = scheduledDays;
    }

    public Instant getDueAt() {
        return dueAt;
    }

    public void setDueAt(Instant dueAt) {
        this.dueAt = dueAt;
    }

    public Instant getLastReviewAt() {
        return lastReviewAt;
    }

    public void setLastReviewAt(Instant lastReviewAt) {
        this.lastReviewAt = lastReviewAt;
    }

    public int getReps() {
        return reps;
    }

    public void setReps(int reps) {
        this.reps = reps;
    }

    public int getLapses() {
        return lapses;
    }

    public void setLapses(int lapses) {
        this.lapses = lapses;
    }

    public int getStep() {
        return step;
    }

    public void setStep(int step) {
        this.step = step;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public long getRowVersion() {
        return rowVersion;
    }
}
