package app.revisio.core.review.exception;

import java.util.UUID;

public class CardNotFoundException extends RuntimeException {

    public CardNotFoundException(UUID cardId) {
        super("Flashcard not found: " + cardId);
    }
}
