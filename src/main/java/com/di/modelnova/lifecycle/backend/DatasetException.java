package com.di.modelnova.lifecycle.backend;

/**
 * Training data is missing, unreadable or malformed.
 */
public class DatasetException extends Exception {

    public DatasetException(String message) {
        super(message);
    }

    public DatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
