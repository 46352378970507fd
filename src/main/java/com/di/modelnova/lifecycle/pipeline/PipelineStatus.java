package com.di.modelnova.lifecycle.pipeline;

import java.util.EnumSet;
import java.util.Set;

public enum PipelineStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(PipelineStatus next) {
        return allowedNext().contains(next);
    }

    private Set<PipelineStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(RUNNING, CANCELLED);
            case RUNNING:
                return EnumSet.of(SUCCESS, FAILED, CANCELLED);
            default:
                return EnumSet.noneOf(PipelineStatus.class);
        }
    }
}
