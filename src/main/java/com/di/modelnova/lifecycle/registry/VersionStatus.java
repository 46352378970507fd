package com.di.modelnova.lifecycle.registry;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a {@link ModelVersion}. Transitions outside {@link #canTransitionTo} are rejected.
 */
public enum VersionStatus {
    DEVELOPMENT,
    STAGING,
    PRODUCTION,
    ARCHIVED,
    ROLLED_BACK;

    public boolean canTransitionTo(VersionStatus next) {
        return allowedNext().contains(next);
    }

    private Set<VersionStatus> allowedNext() {
        switch (this) {
            case DEVELOPMENT:
                return EnumSet.of(STAGING, PRODUCTION, ARCHIVED);
            case STAGING:
                return EnumSet.of(PRODUCTION, ARCHIVED);
            case PRODUCTION:
                return EnumSet.of(ARCHIVED, ROLLED_BACK);
            case ARCHIVED:
            case ROLLED_BACK:
                return EnumSet.of(PRODUCTION);
            default:
                return EnumSet.noneOf(VersionStatus.class);
        }
    }
}
