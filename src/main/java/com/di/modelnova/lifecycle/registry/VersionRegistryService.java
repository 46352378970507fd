package com.di.modelnova.lifecycle.registry;

import com.di.modelnova.lifecycle.FailureKind;
import com.di.modelnova.lifecycle.OperationResult;
import com.di.modelnova.lifecycle.backend.ModelInfo;
import com.di.modelnova.lifecycle.backend.ModelRegistryClient;
import com.di.modelnova.lifecycle.backend.RegistryException;
import com.di.modelnova.util.LifecycleMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Owns every {@link ModelVersion} status change: create, stage, promote, archive, roll back.
 * <p>
 * All mutations of one model id run under that model's lock from {@link ModelLocks}, so at most one version
 * of a model is ever PRODUCTION. Promotions call the model registry first; if it fails nothing local changes.
 */
@Slf4j
@Service
public class VersionRegistryService {

    private final ModelVersionStore store;
    private final ModelRegistryClient registryClient;
    private final ModelLocks locks;
    private final LifecycleMetrics metrics;
    private final Clock clock;

    @Autowired
    public VersionRegistryService(ModelVersionStore store, ModelRegistryClient registryClient,
                                  ModelLocks locks, LifecycleMetrics metrics) {
        this(store, registryClient, locks, metrics, Clock.systemUTC());
    }

    public VersionRegistryService(ModelVersionStore store, ModelRegistryClient registryClient,
                                  ModelLocks locks, LifecycleMetrics metrics, Clock clock) {
        this.store = store;
        this.registryClient = registryClient;
        this.locks = locks;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Registers a new DEVELOPMENT version and its {@link ModelInfo} in the model registry.
     */
    public OperationResult<ModelVersion> createVersion(NewVersionRequest request) {
        if (request == null || isBlank(request.getModelId())) {
            return OperationResult.failure(FailureKind.DATA_ERROR, "modelId is required");
        }
        if (isBlank(request.getArtifactLocation())) {
            return OperationResult.failure(FailureKind.DATA_ERROR, "artifactLocation is required");
        }
        String modelId = request.getModelId().trim();
        return locks.withLock(modelId, () -> {
            List<ModelVersion> existing = store.findByModelId(modelId);
            SemanticVersion number;
            if (request.getVersionNumber() == null || request.getVersionNumber().isBlank()) {
                number = existing.stream()
                        .map(ModelVersion::semanticVersion)
                        .max(Comparator.naturalOrder())
                        .map(SemanticVersion::nextPatch)
                        .orElse(SemanticVersion.INITIAL);
            } else {
                try {
                    number = SemanticVersion.parse(request.getVersionNumber());
                } catch (IllegalArgumentException e) {
                    return OperationResult.failure(FailureKind.DATA_ERROR, e.getMessage());
                }
            }
            String versionNumber = number.toString();
            if (existing.stream().anyMatch(v -> v.getVersionNumber().equals(versionNumber))) {
                return OperationResult.failure(FailureKind.CONFLICT,
                        "Version " + versionNumber + " already exists for " + modelId);
            }
            if (request.getParentVersion() != null && store.findByVersionId(request.getParentVersion()).isEmpty()) {
                return OperationResult.notFound("Parent version not found: " + request.getParentVersion());
            }

            Instant now = clock.instant();
            ModelVersion version = ModelVersion.builder()
                    .versionId(ModelVersion.versionIdOf(modelId, versionNumber))
                    .modelId(modelId)
                    .versionNumber(versionNumber)
                    .artifactLocation(request.getArtifactLocation())
                    .metrics(request.getMetrics() != null ? Map.copyOf(request.getMetrics()) : Map.of())
                    .trainedAt(now)
                    .status(VersionStatus.DEVELOPMENT)
                    .parentVersion(request.getParentVersion())
                    .changelog(request.getChangelog())
                    .build();
            try {
                registryClient.put(ModelInfo.builder()
                        .modelId(version.getVersionId())
                        .family(modelId)
                        .artifactLocation(version.getArtifactLocation())
                        .metrics(version.getMetrics())
                        .featureNames(request.getFeatureNames())
                        .baselineStatistics(request.getBaselineStatistics())
                        .trainedAt(now)
                        .production(false)
                        .build());
            } catch (RegistryException e) {
                log.warn("[REGISTRY] Could not register {} in model registry: {}", version.getVersionId(), e.getMessage());
                return OperationResult.failure(FailureKind.BACKEND_ERROR,
                        "Model registry rejected " + version.getVersionId() + ": " + e.getMessage());
            }
            store.save(version);
            log.info("[REGISTRY] Created version {} (parent={})", version.getVersionId(), version.getParentVersion());
            return OperationResult.ok(version);
        });
    }

    public OperationResult<ModelVersion> promoteToStaging(String versionId) {
        Optional<ModelVersion> found = store.findByVersionId(versionId);
        if (found.isEmpty()) {
            return OperationResult.notFound("Version not found: " + versionId);
        }
        return locks.withLock(found.get().getModelId(), () -> {
            ModelVersion version = store.findByVersionId(versionId).orElseThrow();
            if (version.getStatus() == VersionStatus.STAGING) {
                return OperationResult.ok(version);
            }
            if (version.getStatus() != VersionStatus.DEVELOPMENT) {
                metrics.recordVersionTransition("stage", false);
                return OperationResult.invariant("Only DEVELOPMENT versions can be staged; " + versionId
                        + " is " + version.getStatus());
            }
            store.updateStatus(versionId, VersionStatus.STAGING, null);
            metrics.recordVersionTransition("stage", true);
            log.info("[REGISTRY] {} promoted to STAGING", versionId);
            return OperationResult.ok(store.findByVersionId(versionId).orElseThrow());
        });
    }

    /**
     * Makes the version PRODUCTION and archives the previous production version of the same model.
     * Promoting the current production version again is a no-op success.
     */
    public OperationResult<ModelVersion> promoteToProduction(String versionId) {
        Optional<ModelVersion> found = store.findByVersionId(versionId);
        if (found.isEmpty()) {
            return OperationResult.notFound("Version not found: " + versionId);
        }
        return locks.withLock(found.get().getModelId(), () -> {
            ModelVersion target = store.findByVersionId(versionId).orElseThrow();
            if (target.getStatus() == VersionStatus.PRODUCTION) {
                return OperationResult.ok(target);
            }
            if (!target.getStatus().canTransitionTo(VersionStatus.PRODUCTION)) {
                metrics.recordVersionTransition("promote", false);
                return OperationResult.invariant("Cannot promote " + versionId + " from " + target.getStatus());
            }
            return switchProduction(target, VersionStatus.ARCHIVED, "promote");
        });
    }

    /**
     * Archives a version that is not serving. Archiving the production version is refused; promote or roll back
     * another version instead.
     */
    public OperationResult<ModelVersion> archive(String versionId) {
        Optional<ModelVersion> found = store.findByVersionId(versionId);
        if (found.isEmpty()) {
            return OperationResult.notFound("Version not found: " + versionId);
        }
        return locks.withLock(found.get().getModelId(), () -> {
            ModelVersion version = store.findByVersionId(versionId).orElseThrow();
            if (version.getStatus() == VersionStatus.ARCHIVED) {
                return OperationResult.ok(version);
            }
            if (version.getStatus() == VersionStatus.PRODUCTION
                    || !version.getStatus().canTransitionTo(VersionStatus.ARCHIVED)) {
                metrics.recordVersionTransition("archive", false);
                return OperationResult.invariant("Cannot archive " + versionId + " while " + version.getStatus());
            }
            store.updateStatus(versionId, VersionStatus.ARCHIVED, null);
            metrics.recordVersionTransition("archive", true);
            log.info("[REGISTRY] {} archived", versionId);
            return OperationResult.ok(store.findByVersionId(versionId).orElseThrow());
        });
    }

    /**
     * Restores a previously deployed version to PRODUCTION; the current production version becomes ROLLED_BACK.
     * Rolling back to the current production version is a no-op success.
     */
    public OperationResult<ModelVersion> rollbackToVersion(String versionId) {
        Optional<ModelVersion> found = store.findByVersionId(versionId);
        if (found.isEmpty()) {
            return OperationResult.notFound("Version not found: " + versionId);
        }
        return locks.withLock(found.get().getModelId(), () -> rollbackLocked(versionId));
    }

    /**
     * Rolls back to the most recently deployed ARCHIVED version numbered below the current production one.
     * Fails when the model has no production version or nothing older to return to; never rolls forward.
     */
    public OperationResult<ModelVersion> rollbackToPrevious(String modelId) {
        if (isBlank(modelId)) {
            return OperationResult.failure(FailureKind.DATA_ERROR, "modelId is required");
        }
        return locks.withLock(modelId, () -> {
            Optional<ModelVersion> current = findProduction(modelId);
            if (current.isEmpty()) {
                metrics.recordVersionTransition("rollback", false);
                return OperationResult.<ModelVersion>invariant("No production version for " + modelId);
            }
            SemanticVersion currentVersion = current.get().semanticVersion();
            Optional<ModelVersion> previous = store.findByModelId(modelId).stream()
                    .filter(v -> v.getStatus() == VersionStatus.ARCHIVED && v.getDeployedAt() != null)
                    .filter(v -> v.semanticVersion().compareTo(currentVersion) < 0)
                    .max(Comparator.comparing(ModelVersion::getDeployedAt)
                            .thenComparing(ModelVersion::semanticVersion));
            if (previous.isEmpty()) {
                metrics.recordVersionTransition("rollback", false);
                return OperationResult.<ModelVersion>invariant("No previous version to roll back to for " + modelId
                        + " (current " + current.get().getVersionId() + ")");
            }
            return rollbackLocked(previous.get().getVersionId());
        });
    }

    private OperationResult<ModelVersion> rollbackLocked(String versionId) {
        ModelVersion target = store.findByVersionId(versionId).orElseThrow();
        if (target.getStatus() == VersionStatus.PRODUCTION) {
            return OperationResult.ok(target);
        }
        if (target.getDeployedAt() == null) {
            metrics.recordVersionTransition("rollback", false);
            return OperationResult.invariant(versionId + " was never deployed; promote it instead");
        }
        if (!target.getStatus().canTransitionTo(VersionStatus.PRODUCTION)) {
            metrics.recordVersionTransition("rollback", false);
            return OperationResult.invariant("Cannot roll back to " + versionId + " from " + target.getStatus());
        }
        return switchProduction(target, VersionStatus.ROLLED_BACK, "rollback");
    }

    /** Caller holds the model lock. */
    private OperationResult<ModelVersion> switchProduction(ModelVersion target, VersionStatus previousBecomes,
                                                           String action) {
        Optional<ModelVersion> current = findProduction(target.getModelId());
        try {
            registryClient.setProduction(target.getVersionId());
        } catch (RegistryException e) {
            metrics.recordVersionTransition(action, false);
            log.warn("[REGISTRY] {} of {} aborted, registry failed: {}", action, target.getVersionId(), e.getMessage());
            return OperationResult.failure(FailureKind.BACKEND_ERROR,
                    "Model registry failed during " + action + " of " + target.getVersionId() + ": " + e.getMessage());
        }
        current.ifPresent(c -> store.updateStatus(c.getVersionId(), previousBecomes, null));
        store.updateStatus(target.getVersionId(), VersionStatus.PRODUCTION, clock.instant());
        metrics.recordVersionTransition(action, true);
        log.info("[REGISTRY] {}: {} is now PRODUCTION (previous {} -> {})", action, target.getVersionId(),
                current.map(ModelVersion::getVersionId).orElse("none"), previousBecomes);
        return OperationResult.ok(store.findByVersionId(target.getVersionId()).orElseThrow());
    }

    public Optional<ModelVersion> getVersion(String versionId) {
        return store.findByVersionId(versionId);
    }

    /** All versions of the model, oldest first. */
    public List<ModelVersion> getVersions(String modelId) {
        return store.findByModelId(modelId);
    }

    public Optional<ModelVersion> getCurrentProduction(String modelId) {
        return findProduction(modelId);
    }

    public List<ModelVersion> listProductionVersions() {
        return store.findByStatus(VersionStatus.PRODUCTION);
    }

    /** Versions newest first, for audit views. */
    public List<ModelVersion> getVersionHistory(String modelId) {
        return store.findByModelId(modelId).stream()
                .sorted(Comparator.comparing(ModelVersion::semanticVersion).reversed())
                .collect(Collectors.toList());
    }

    private Optional<ModelVersion> findProduction(String modelId) {
        return store.findByModelId(modelId).stream()
                .filter(v -> v.getStatus() == VersionStatus.PRODUCTION)
                .findFirst();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
