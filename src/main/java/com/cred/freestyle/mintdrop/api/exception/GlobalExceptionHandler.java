package com.cred.freestyle.mintdrop.api.exception;

import com.cred.freestyle.mintdrop.api.dto.ErrorResponse;
import com.cred.freestyle.mintdrop.exception.*;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the mint API.
 * Every {@link MintDropException} maps to the HTTP status of its error code; the code itself
 * is returned in the body so clients can branch on it.
 *
 * @author Mint Drop Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String RETRY_AFTER_SECONDS = "5";

    /**
     * Handle InsufficientSupplyException.
     * Returns 409 CONFLICT with the requested and available quantity.
     */
    @ExceptionHandler(InsufficientSupplyException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientSupplyException(
            InsufficientSupplyException ex,
            HttpServletRequest request
    ) {
        logger.warn("Insufficient supply: {}", ex.getMessage());

        ErrorResponse error = fromMintException(ex, "Insufficient Supply", request);
        error.addDetail("collectionId", ex.getCollectionId());
        error.addDetail("requestedQuantity", ex.getRequestedQuantity());
        error.addDetail("availableQuantity", ex.getAvailableQuantity());

        return ResponseEntity.status(ex.getErrorCode().getHttpStatus()).body(error);
    }

    /**
     * Handle MintLimitExceededException.
     * Returns 403 FORBIDDEN when the wallet would pass the phase limit.
     */
    @ExceptionHandler(MintLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleMintLimitExceededException(
            MintLimitExceededException ex,
            HttpServletRequest request
    ) {
        logger.warn("Mint limit exceeded: {}", ex.getMessage());

        ErrorResponse error = fromMintException(ex, "Mint Limit Exceeded", request);
        error.addDetail("wallet", ex.getWallet());
        error.addDetail("phaseId", ex.getPhaseId());
        error.addDetail("mintLimit", ex.getMintLimit());
        error.addDetail("alreadyHeld", ex.getAlreadyHeld());

        return ResponseEntity.status(ex.getErrorCode().getHttpStatus()).body(error);
    }

    /**
     * Handle ReservationExpiredException.
     * Returns 410 GONE; the client must reserve again under a new key.
     */
    @ExceptionHandler(ReservationExpiredException.class)
    public ResponseEntity<ErrorResponse> handleReservationExpiredException(
            ReservationExpiredException ex,
            HttpServletRequest request
    ) {
        logger.warn("Reservation expired: {}", ex.getMessage());

        ErrorResponse error = fromMintException(ex, "Reservation Expired", request);
        error.addDetail("idempotencyKey", ex.getIdempotencyKey());
        error.addDetail("expiresAt", ex.getExpiresAt());

        return ResponseEntity.status(ex.getErrorCode().getHttpStatus()).body(error);
    }

    /**
     * Handle ResourceNotFoundException.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = fromMintException(ex, "Resource Not Found", request);
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("resourceId", ex.getResourceId());

        return ResponseEntity.status(ex.getErrorCode().getHttpStatus()).body(error);
    }

    /**
     * Handle UpstreamUnavailableException.
     * Returns 503 with Retry-After; nothing was committed.
     */
    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamUnavailableException(
            UpstreamUnavailableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Upstream {} unavailable: {}", ex.getUpstream(), ex.getMessage());

        ErrorResponse error = fromMintException(ex, "Upstream Unavailable", request);
        error.addDetail("upstream", ex.getUpstream());

        return ResponseEntity.status(ex.getErrorCode().getHttpStatus())
                .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                .body(error);
    }

    /**
     * Handle InvariantViolationException.
     * Logged at ERROR; the message is not exposed.
     */
    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolationException(
            InvariantViolationException ex,
            HttpServletRequest request
    ) {
        logger.error("Invariant violation: {}", ex.getMessage(), ex);

        ErrorResponse error = new ErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                ex.getErrorCode().name(),
                "Internal Server Error",
                "The request could not be completed consistently and was rolled back.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Handle the remaining business failures by their error code.
     */
    @ExceptionHandler(MintDropException.class)
    public ResponseEntity<ErrorResponse> handleMintDropException(
            MintDropException ex,
            HttpServletRequest request
    ) {
        logger.warn("{}: {}", ex.getErrorCode(), ex.getMessage());

        ErrorResponse error = fromMintException(ex, ex.getErrorCode().getHttpStatus().getReasonPhrase(), request);
        if (ex instanceof MintValidationException) {
            error.addDetail("field", ((MintValidationException) ex).getField());
        } else if (ex instanceof NotAllowlistedException) {
            error.addDetail("wallet", ((NotAllowlistedException) ex).getWallet());
            error.addDetail("phaseId", ((NotAllowlistedException) ex).getPhaseId());
        } else if (ex instanceof NoActivePhaseException) {
            error.addDetail("collectionId", ((NoActivePhaseException) ex).getCollectionId());
        } else if (ex instanceof CollectionNotActiveException) {
            error.addDetail("collectionId", ((CollectionNotActiveException) ex).getCollectionId());
            error.addDetail("collectionStatus", ((CollectionNotActiveException) ex).getStatus());
        }

        return ResponseEntity.status(ex.getErrorCode().getHttpStatus()).body(error);
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = badRequest("Request validation failed. Please check the field errors.", request);
        error.addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(badRequest("Request body is missing or malformed.", request));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex,
            HttpServletRequest request
    ) {
        logger.warn("Missing parameter: {}", ex.getParameterName());

        ErrorResponse error = badRequest(ex.getMessage(), request);
        error.addDetail("field", ex.getParameterName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle IllegalArgumentException.
     * Returns 400 BAD REQUEST for invalid arguments.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal argument: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(badRequest(ex.getMessage(), request));
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = new ErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "INTERNAL_ERROR",
                "Internal Server Error",
                "An unexpected error occurred. Please try again later.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ErrorResponse fromMintException(MintDropException ex, String title, HttpServletRequest request) {
        ErrorResponse error = new ErrorResponse(
                ex.getErrorCode().getHttpStatus().value(),
                ex.getErrorCode().name(),
                title,
                ex.getMessage(),
                request.getRequestURI()
        );
        error.setRetryable(ex.getErrorCode().isRetryable());
        return error;
    }

    private ErrorResponse badRequest(String message, HttpServletRequest request) {
        return new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                MintErrorCode.VALIDATION_ERROR.name(),
                "Validation Failed",
                message,
                request.getRequestURI()
        );
    }
}
