package com.di.modelnova.exception;

import com.di.modelnova.aspect.ErrorCategory;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns exceptions that escape the controllers into a structured {@link ErrorResponse}, categorised with
 * {@link ErrorCategory}. Failures that lifecycle components return as values are mapped by {@link ApiResponses}
 * instead and never reach this handler.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("VALIDATION_EXCEPTION", category, e, false);
        ErrorResponse body = buildErrorResponse(category, "Request body failed validation", HttpStatus.BAD_REQUEST);
        e.getBindingResult().getFieldErrors()
                .forEach(fe -> body.addDetail(fe.getField(), fe.getDefaultMessage()));
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("VALIDATION_EXCEPTION", category, e, false);
        return ResponseEntity.badRequest().body(buildErrorResponse(category, messageOf(e), HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("STATE_EXCEPTION", category, e, true);
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(buildErrorResponse(category, messageOf(e), HttpStatus.CONFLICT));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UNHANDLED_EXCEPTION", category, e, true);
        ErrorResponse body = buildErrorResponse(category, messageOf(e), HttpStatus.INTERNAL_SERVER_ERROR);
        body.addDetail("exceptionType", e.getClass().getName());
        Throwable root = getRootCause(e);
        if (root != e) {
            body.addDetail("rootCauseType", root.getClass().getName());
            body.addDetail("rootCauseMessage", root.getMessage());
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private void logError(String eventType, ErrorCategory category, Throwable e, boolean withStack) {
        Throwable root = getRootCause(e);
        if (withStack) {
            log.error("event={} category={} path={} error={} rootCause={}", eventType, category.name(),
                    requestPath(), messageOf(e), root.getClass().getSimpleName(), e);
        } else {
            log.warn("event={} category={} path={} error={}", eventType, category.name(), requestPath(), messageOf(e));
        }
    }

    static ErrorResponse buildErrorResponse(ErrorCategory category, String message, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(message);
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setPath(requestPath());
        String requestId = MDC.get("requestId");
        if (requestId != null) {
            response.addDetail("requestId", requestId);
        }
        return response;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static Throwable getRootCause(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static String requestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error body for every API error.
     */
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String path;
        private final Map<String, Object> details = new LinkedHashMap<>();

        public String getTimestamp() { return timestamp; }
        public void setTimestamp(String timestamp) { this.timestamp = timestamp; }
        public int getStatus() { return status; }
        public void setStatus(int status) { this.status = status; }
        public String getError() { return error; }
        public void setError(String error) { this.error = error; }
        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
        public String getErrorCategory() { return errorCategory; }
        public void setErrorCategory(String errorCategory) { this.errorCategory = errorCategory; }
        public String getErrorCategoryName() { return errorCategoryName; }
        public void setErrorCategoryName(String errorCategoryName) { this.errorCategoryName = errorCategoryName; }
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public Map<String, Object> getDetails() { return details; }

        public void addDetail(String key, Object value) {
            details.put(key, value);
        }
    }
}
