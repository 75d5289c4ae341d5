package app.revisio.core.review.controller;

import app.revisio.core.review.exception.CardAccessDeniedException;
import app.revisio.core.review.exception.CardNotFoundException;
import app.revisio.core.review.exception.InvalidParametersException;
import app.revisio.core.review.exception.InvalidRatingException;
import app.revisio.core.review.exception.InvalidSchedulingStateException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.net.URI;

@RestControllerAdvice
public class ReviewExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ReviewExceptionHandler.class);

    @ExceptionHandler({InvalidRatingException.class, InvalidParametersException.class})
    public ResponseEntity<ProblemDetail> handleValidation(IllegalArgumentException ex, HttpServletRequest request) {
        return problem(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(CardNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(CardNotFoundException ex, HttpServletRequest request) {
        return problem(HttpStatus.NOT_FOUND, "Card Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(CardAccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDenied(CardAccessDeniedException ex, HttpServletRequest request) {
        return problem(HttpStatus.FORBIDDEN, "Access Denied", ex.getMessage(), request);
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ProblemDetail> handleConflict(OptimisticLockingFailureException ex, HttpServletRequest request) {
        log.warn("Concurrent update rejected on {}: {}", request.getRequestURI(), ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Concurrent Update", "The card was modified by another review, retry", request);
    }

    @ExceptionHandler(InvalidSchedulingStateException.class)
    public ResponseEntity<ProblemDetail> handleCorruptedState(InvalidSchedulingStateException ex, HttpServletRequest request) {
        log.error("Stored scheduling state is inconsistent on {}", request.getRequestURI(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Invalid Scheduling State", ex.getMessage(), request);
    }

    private static ResponseEntity<ProblemDetail> problem(HttpStatus status,
                                                         String title,
                                                         String detail,
                                                         HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setInstance(URI.create(request.getRequestURI()));
        return ResponseEntity.status(status).body(problem);
    }
}
