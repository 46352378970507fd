package com.di.modelnova.lifecycle.monitor;

import java.util.List;
import java.util.Optional;

public interface FindingStore {

    void save(MonitoringFinding finding);

    Optional<MonitoringFinding> findLatest(String modelId, FindingType type);

    /** Newest first; a null type matches both. */
    List<MonitoringFinding> find(String modelId, FindingType type, int limit);
}
