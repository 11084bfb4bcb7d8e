package info.mouts.checkout.exception;

import java.net.URI;
import java.time.Instant;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import lombok.extern.slf4j.Slf4j;

/**
 * Global exception handler for the REST controllers.
 * Maps the service exceptions to HTTP status codes and formats the responses
 * using the Problem Details for HTTP APIs standard (RFC 7807).
 */
@RestControllerAdvice
@Slf4j
public class RestExceptionHandler {
    /**
     * Capture {@link OrderNotFoundException} and returns HTTP 404 Not Found.
     *
     * @param ex      The caught {@link OrderNotFoundException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(OrderNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ProblemDetail handleOrderNotFoundException(OrderNotFoundException ex, WebRequest request) {
        log.warn("Handling OrderNotFoundException: {}", ex.getMessage());

        return problem(HttpStatus.NOT_FOUND, "Order Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(OrderValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleOrderValidationException(OrderValidationException ex, WebRequest request) {
        log.warn("Handling OrderValidationException: {}", ex.getMessage());

        return problem(HttpStatus.BAD_REQUEST, "Invalid Order", ex.getMessage(), request);
    }

    /**
     * Capture {@link WebhookSignatureException} and returns HTTP 400 Bad Request.
     * The detail stays generic so callers learn nothing about the expected
     * signature.
     *
     * @param ex      The caught {@link WebhookSignatureException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(WebhookSignatureException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleWebhookSignatureException(WebhookSignatureException ex, WebRequest request) {
        log.warn("Handling WebhookSignatureException: {}", ex.getMessage());

        return problem(HttpStatus.BAD_REQUEST, "Invalid Signature", "Webhook signature verification failed.",
                request);
    }

    @ExceptionHandler(OrderAccessDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public ProblemDetail handleOrderAccessDeniedException(OrderAccessDeniedException ex, WebRequest request) {
        log.warn("Handling OrderAccessDeniedException: {}", ex.getMessage());

        return problem(HttpStatus.FORBIDDEN, "Access Denied", "Not authorized to access this order.", request);
    }

    /**
     * Capture {@link OrderStatusConflictException} and returns HTTP 409 Conflict.
     * The status observed in the database is exposed as {@code currentStatus}.
     *
     * @param ex      The caught {@link OrderStatusConflictException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(OrderStatusConflictException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ProblemDetail handleOrderStatusConflictException(OrderStatusConflictException ex, WebRequest request) {
        log.warn("Handling OrderStatusConflictException: {}", ex.getMessage());

        ProblemDetail problemDetail = problem(HttpStatus.CONFLICT, "Order Status Conflict", ex.getMessage(), request);
        problemDetail.setProperty("currentStatus", ex.getActualStatus());

        return problemDetail;
    }

    @ExceptionHandler(InvalidStatusTransitionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ProblemDetail handleInvalidStatusTransitionException(InvalidStatusTransitionException ex,
            WebRequest request) {
        log.warn("Handling InvalidStatusTransitionException: {}", ex.getMessage());

        return problem(HttpStatus.CONFLICT, "Invalid Status Transition", ex.getMessage(), request);
    }

    @ExceptionHandler(PaymentGatewayException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public ProblemDetail handlePaymentGatewayException(PaymentGatewayException ex, WebRequest request) {
        log.error("Handling PaymentGatewayException: {}", ex.getMessage());

        return problem(HttpStatus.BAD_GATEWAY, "Payment Gateway Error",
                "The payment processor could not handle the request. Please try again later.", request);
    }

    @ExceptionHandler(CollaboratorUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public ProblemDetail handleCollaboratorUnavailableException(CollaboratorUnavailableException ex,
            WebRequest request) {
        log.error("Handling CollaboratorUnavailableException: {}", ex.getMessage());

        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage(), request);
    }

    /**
     * Capture {@link MethodArgumentTypeMismatchException} and returns HTTP 400 Bad
     * Request.
     * This typically occurs when a path variable expected to be a UUID cannot be
     * parsed correctly.
     *
     * @param ex      The caught {@link MethodArgumentTypeMismatchException}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleMethodArgumentTypeMismatchException(MethodArgumentTypeMismatchException ex,
            WebRequest request) {
        log.warn("Handling MethodArgumentTypeMismatchException: {}", ex.getMessage());

        return problem(HttpStatus.BAD_REQUEST, "Invalid UUID", ex.getMessage(), request);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ProblemDetail handleMissingRequestHeaderException(MissingRequestHeaderException ex, WebRequest request) {
        log.warn("Handling MissingRequestHeaderException: {}", ex.getMessage());

        return problem(HttpStatus.BAD_REQUEST, "Missing Header", ex.getMessage(), request);
    }

    /**
     * Catches any other unhandled exceptions that may occur during request
     * processing.
     * Returns HTTP 500 Internal Server Error with a generic message to avoid
     * exposing internal details.
     *
     * @param ex      The caught {@link Exception}.
     * @param request The current web request.
     * @return A {@link ProblemDetail} object representing the error.
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ProblemDetail handleGenericException(Exception ex, WebRequest request) {
        log.error("Handling unexpected exception: {}", ex.getMessage(), ex);

        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected internal error occurred.", request);
    }

    private ProblemDetail problem(HttpStatus status, String title, String detail, WebRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(title);
        problemDetail.setProperty("timestamp", Instant.now());
        problemDetail.setInstance(URI.create(request.getDescription(false)));

        return problemDetail;
    }
}
