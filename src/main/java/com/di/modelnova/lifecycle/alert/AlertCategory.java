package com.di.modelnova.lifecycle.alert;

public enum AlertCategory {
    DATA_DRIFT,
    MODEL_DECAY,
    /** Traffic arrived from serving segments not seen before (device, site, population group). */
    SEGMENT_CHANGE,
    AB_TRAFFIC_IMBALANCE,
    PIPELINE_FAILURE
}
