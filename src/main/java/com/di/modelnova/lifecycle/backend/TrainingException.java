package com.di.modelnova.lifecycle.backend;

/**
 * The training backend rejected the request, failed, or could not be reached.
 */
public class TrainingException extends Exception {

    public TrainingException(String message) {
        super(message);
    }

    public TrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
