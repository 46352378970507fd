package com.di.modelnova.lifecycle.monitor;

public enum FindingType {
    DATA_DRIFT,
    MODEL_DECAY
}
