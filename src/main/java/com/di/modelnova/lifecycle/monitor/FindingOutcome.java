package com.di.modelnova.lifecycle.monitor;

/**
 * Result of one evaluation. Only DETECTED counts as a positive finding; the last two are never treated as
 * "no drift".
 */
public enum FindingOutcome {
    DETECTED,
    NOT_DETECTED,
    /** Fewer recent predictions (or labelled predictions) than the configured minimum. */
    INSUFFICIENT_DATA,
    /** No baseline to compare with: model unknown to the registry, or no baseline statistics / metrics. */
    UNKNOWN
}
