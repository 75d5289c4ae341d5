package app.revisio.core.review.exception;

/**
 * Raised when a stored scheduling record breaks its own invariants, which points to a persistence bug.
 */
public class InvalidSchedulingStateException extends IllegalArgumentException {

    public InvalidSchedulingStateException(String message) {
        super(message);
    }
}
