package com.di.modelnova.lifecycle.abtest;

public enum AbTestStatus {
    ACTIVE,
    /** Counters are frozen. */
    COMPLETED
}
