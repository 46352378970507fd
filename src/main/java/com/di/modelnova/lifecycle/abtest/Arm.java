package com.di.modelnova.lifecycle.abtest;

public enum Arm {
    CONTROL,
    TREATMENT;

    public Arm other() {
        return this == CONTROL ? TREATMENT : CONTROL;
    }
}
