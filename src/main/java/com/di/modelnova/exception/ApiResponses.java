package com.di.modelnova.exception;

import com.di.modelnova.aspect.ErrorCategory;
import com.di.modelnova.lifecycle.FailureKind;
import com.di.modelnova.lifecycle.OperationResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps {@link OperationResult} to HTTP: success to 200 (or the given status), failures by {@link FailureKind}.
 */
public final class ApiResponses {

    private ApiResponses() {
    }

    public static ResponseEntity<?> of(OperationResult<?> result) {
        return of(result, HttpStatus.OK);
    }

    public static ResponseEntity<?> of(OperationResult<?> result, HttpStatus successStatus) {
        if (result.isSuccess()) {
            return ResponseEntity.status(successStatus).body(result.getValue());
        }
        HttpStatus status = statusFor(result.getFailureKind());
        return ResponseEntity.status(status).body(GlobalExceptionHandler.buildErrorResponse(
                ErrorCategory.of(result.getFailureKind()), result.getMessage(), status));
    }

    public static HttpStatus statusFor(FailureKind kind) {
        if (kind == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        switch (kind) {
            case DATA_ERROR:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case BACKEND_ERROR:
                return HttpStatus.BAD_GATEWAY;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case INVARIANT_VIOLATION:
            case CONFLICT:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
