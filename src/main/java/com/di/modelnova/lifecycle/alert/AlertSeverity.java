package com.di.modelnova.lifecycle.alert;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
