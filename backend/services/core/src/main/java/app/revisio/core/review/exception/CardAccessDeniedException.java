package app.revisio.core.review.exception;

import java.util.UUID;

public class CardAccessDeniedException extends RuntimeException {

    public CardAccessDeniedException(UUID cardId) {
        super("Access denied to card " + cardId);
    }
}
