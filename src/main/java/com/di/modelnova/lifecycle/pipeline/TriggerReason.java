package com.di.modelnova.lifecycle.pipeline;

public enum TriggerReason {
    SCHEDULED,
    DRIFT_DETECTED,
    DECAY_DETECTED,
    MANUAL
}
