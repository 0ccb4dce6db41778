package ch.so.arp.explorer.search;

import java.time.Instant;
import java.util.UUID;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Translates exceptions raised by the REST controllers into {@link ApiError} responses. */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(HistoryNotFoundException.class)
    public ResponseEntity<ApiError> handleHistoryNotFound(HistoryNotFoundException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.warn("History record not found [{}]: {}", errorId, ex.getHistoryId());
        return respond(HttpStatus.NOT_FOUND, errorId, ApiError.HISTORY_NOT_FOUND,
                "History item with ID " + ex.getHistoryId() + " not found", request);
    }

    @ExceptionHandler({ ConstraintViolationException.class, HandlerMethodValidationException.class,
            MethodArgumentTypeMismatchException.class })
    public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        LOGGER.warn("Validation error [{}]: {}", errorId, ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        if (ex instanceof ErrorResponse errorResponse && errorResponse.getStatusCode().is4xxClientError()) {
            LOGGER.warn("Request rejected [{}]: {}", errorId, ex.getMessage());
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(new ApiError(errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request.getRequestURI(),
                            Instant.now()));
        }
        LOGGER.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.INTERNAL_ERROR,
                "An unexpected error occurred. Please try again later.", request);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String errorId, String code, String message,
            HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(new ApiError(errorId, code, message, request.getRequestURI(), Instant.now()));
    }

    private String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
