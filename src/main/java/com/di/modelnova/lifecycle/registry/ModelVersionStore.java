package com.di.modelnova.lifecycle.registry;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for {@link ModelVersion}. Callers serialise writes per model id; stores need not.
 */
public interface ModelVersionStore {

    void save(ModelVersion version);

    /** Persists a new status and deployment time for an existing version. */
    void updateStatus(String versionId, VersionStatus status, java.time.Instant deployedAt);

    Optional<ModelVersion> findByVersionId(String versionId);

    /** All versions of the model, oldest first. */
    List<ModelVersion> findByModelId(String modelId);

    List<ModelVersion> findByStatus(VersionStatus status);
}
