package com.di.modelnova.lifecycle.backend;

/**
 * The model registry could not be read or written.
 */
public class RegistryException extends RuntimeException {

    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
