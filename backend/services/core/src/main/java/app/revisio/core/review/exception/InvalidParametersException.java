package app.revisio.core.review.exception;

public class InvalidParametersException extends IllegalArgumentException {

    public InvalidParametersException(String message) {
        super(message);
    }
}
