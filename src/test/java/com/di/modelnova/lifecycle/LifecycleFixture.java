package com.di.modelnova.lifecycle;

import com.di.modelnova.config.LifecycleProperties;
import com.di.modelnova.lifecycle.abtest.AbTestManager;
import com.di.modelnova.lifecycle.abtest.InMemoryAbTestStore;
import com.di.modelnova.lifecycle.alert.AlertService;
import com.di.modelnova.lifecycle.alert.InMemoryAlertStore;
import com.di.modelnova.lifecycle.backend.FeatureBaseline;
import com.di.modelnova.lifecycle.backend.InMemoryModelRegistryClient;
import com.di.modelnova.lifecycle.backend.InMemoryPredictionLogStore;
import com.di.modelnova.lifecycle.monitor.DriftDecayMonitor;
import com.di.modelnova.lifecycle.monitor.InMemoryFindingStore;
import com.di.modelnova.lifecycle.monitor.RecentPredictionBuffer;
import com.di.modelnova.lifecycle.registry.InMemoryModelVersionStore;
import com.di.modelnova.lifecycle.registry.ModelLocks;
import com.di.modelnova.lifecycle.registry.ModelVersion;
import com.di.modelnova.lifecycle.registry.NewVersionRequest;
import com.di.modelnova.lifecycle.registry.VersionRegistryService;
import com.di.modelnova.util.LifecycleMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.Map;

/**
 * In-memory wiring of the lifecycle components shared by the unit tests. Every store is process-local and the
 * baseline sampler uses a fixed seed.
 */
public class LifecycleFixture {

    public final LifecycleProperties props;
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final LifecycleMetrics metrics = new LifecycleMetrics(meterRegistry);
    public final InMemoryModelRegistryClient registryClient;
    public final InMemoryModelVersionStore versionStore = new InMemoryModelVersionStore();
    public final ModelLocks locks = new ModelLocks();
    public final VersionRegistryService versionRegistry;
    public final InMemoryAlertStore alertStore = new InMemoryAlertStore();
    public final AlertService alertService;
    public final InMemoryPredictionLogStore predictionLog = new InMemoryPredictionLogStore(10_000);
    public final InMemoryFindingStore findingStore = new InMemoryFindingStore();
    public final DriftDecayMonitor monitor;
    public final InMemoryAbTestStore abTestStore = new InMemoryAbTestStore();
    public final AbTestManager abTestManager;

    public LifecycleFixture() {
        this(defaultProperties(), new InMemoryModelRegistryClient());
    }

    public LifecycleFixture(LifecycleProperties props, InMemoryModelRegistryClient registryClient) {
        this.props = props;
        this.registryClient = registryClient;
        this.versionRegistry = new VersionRegistryService(versionStore, registryClient, locks, metrics);
        this.alertService = new AlertService(alertStore, metrics);
        this.monitor = new DriftDecayMonitor(props, new RecentPredictionBuffer(props), predictionLog, registryClient,
                findingStore, alertService, metrics);
        this.abTestManager = new AbTestManager(abTestStore, versionRegistry, monitor, locks, props, metrics);
    }

    public static LifecycleProperties defaultProperties() {
        LifecycleProperties props = new LifecycleProperties();
        props.getMonitor().setRandomSeed(42L);
        return props;
    }

    /** Creates a DEVELOPMENT version of {@code family} with the given accuracy and an age baseline of 60 +/- 10. */
    public ModelVersion createVersion(String family, String versionNumber, double accuracy) {
        return versionRegistry.createVersion(NewVersionRequest.builder()
                .modelId(family)
                .versionNumber(versionNumber)
                .artifactLocation("models/" + family + "/" + versionNumber + "/model.pkl")
                .metrics(Map.of("accuracy", accuracy, "f1_score", accuracy))
                .featureNames(List.of("age"))
                .baselineStatistics(Map.of("age", FeatureBaseline.builder().mean(60.0).std(10.0).build()))
                .build()).orElseThrow();
    }

    public ModelVersion createProduction(String family, String versionNumber, double accuracy) {
        ModelVersion created = createVersion(family, versionNumber, accuracy);
        return versionRegistry.promoteToProduction(created.getVersionId()).orElseThrow();
    }
}
