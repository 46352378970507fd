package com.di.modelnova.lifecycle.pipeline;

import java.util.Map;

/**
 * Aborts the current pipeline stage. The message becomes the run's error.
 */
class StageFailedException extends Exception {

    private final transient Map<String, Object> details;

    StageFailedException(String message) {
        this(message, Map.of(), null);
    }

    StageFailedException(String message, Map<String, Object> details) {
        this(message, details, null);
    }

    StageFailedException(String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.details = details != null ? details : Map.of();
    }

    Map<String, Object> getDetails() {
        return details;
    }
}
