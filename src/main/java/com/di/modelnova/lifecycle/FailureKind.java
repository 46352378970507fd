package com.di.modelnova.lifecycle;

/**
 * Why a lifecycle operation did not succeed. Callers branch on the kind, never on the message.
 */
public enum FailureKind {
    /** Dataset missing, malformed or too small. Not retried automatically. */
    DATA_ERROR,
    /** Training backend or model registry failed or timed out. The cause is kept in the message. */
    BACKEND_ERROR,
    /** The request would break a lifecycle rule (illegal transition, second production version, stopped test). */
    INVARIANT_VIOLATION,
    NOT_FOUND,
    /** Another operation already owns the resource, e.g. a run in flight for the same family. */
    CONFLICT
}
