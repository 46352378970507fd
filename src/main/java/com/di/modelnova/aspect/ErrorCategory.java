package com.di.modelnova.aspect;

import com.di.modelnova.lifecycle.FailureKind;
import com.di.modelnova.lifecycle.backend.DatasetException;
import com.di.modelnova.lifecycle.backend.RegistryException;
import com.di.modelnova.lifecycle.backend.TrainingException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Error categories used in structured error logs and API error responses.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a category: add the constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    DATA_ERROR("Data error", "Training data missing, malformed or too small"),
    TRAINING_BACKEND_ERROR("Training backend error", "Training backend failed or rejected the request"),
    REGISTRY_ERROR("Model registry error", "Model registry could not be read or written"),
    LIFECYCLE_RULE_VIOLATION("Lifecycle rule violation", "Operation would break a version, run or test rule"),
    NOT_FOUND("Not found", "Referenced model, version, run or test does not exist"),
    CONFLICT("Conflict", "Resource is owned by another in-flight operation"),
    DATABASE_ERROR("Database error", "Lifecycle store operation failed"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    VALIDATION_ERROR("Validation error", "Input validation failure"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof DatasetException, DATA_ERROR);
        MATCHERS.put(t -> t instanceof TrainingException, TRAINING_BACKEND_ERROR);
        MATCHERS.put(t -> t instanceof RegistryException, REGISTRY_ERROR);
        MATCHERS.put(ErrorCategory::isDatabaseError, DATABASE_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    /** Category reported for an operation that returned a failure instead of throwing. */
    public static ErrorCategory of(FailureKind kind) {
        if (kind == null) {
            return UNKNOWN;
        }
        switch (kind) {
            case DATA_ERROR:
                return DATA_ERROR;
            case BACKEND_ERROR:
                return TRAINING_BACKEND_ERROR;
            case INVARIANT_VIOLATION:
                return LIFECYCLE_RULE_VIOLATION;
            case NOT_FOUND:
                return NOT_FOUND;
            case CONFLICT:
                return CONFLICT;
            default:
                return UNKNOWN;
        }
    }

    // --- Matcher helpers ---

    private static boolean isDatabaseError(Throwable t) {
        return t instanceof SQLException
                || t instanceof org.springframework.dao.DataAccessException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || (t.getMessage() != null && t.getMessage().toLowerCase().contains("timed out"));
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || (t instanceof java.io.IOException && !(t instanceof java.io.FileNotFoundException));
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof org.springframework.web.bind.MethodArgumentNotValidException
                || t instanceof jakarta.validation.ConstraintViolationException
                || t instanceof org.springframework.http.converter.HttpMessageNotReadableException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    @Override
    public String toString() {
        return name();
    }
}
