package com.di.modelnova.lifecycle.registry;

import com.di.modelnova.exception.ApiResponses;
import com.di.modelnova.lifecycle.backend.FeatureBaseline;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for model versions: list, create, stage, promote, archive and roll back.
 */
@RestController
@RequestMapping("/api/lifecycle/versions")
@RequiredArgsConstructor
public class VersionRegistryController {

    private final VersionRegistryService versionRegistry;

    @GetMapping(value = "/models/{modelId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ModelVersion>> history(@PathVariable String modelId) {
        return ResponseEntity.ok(versionRegistry.getVersionHistory(modelId));
    }

    @GetMapping(value = "/models/{modelId}/production", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ModelVersion> production(@PathVariable String modelId) {
        return versionRegistry.getCurrentProduction(modelId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/production", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ModelVersion>> allProduction() {
        return ResponseEntity.ok(versionRegistry.listProductionVersions());
    }

    @GetMapping(value = "/{versionId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ModelVersion> version(@PathVariable String versionId) {
        return versionRegistry.getVersion(versionId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> create(@Valid @RequestBody CreateVersionRequest request) {
        return ApiResponses.of(versionRegistry.createVersion(NewVersionRequest.builder()
                .modelId(request.getModelId())
                .artifactLocation(request.getArtifactLocation())
                .metrics(request.getMetrics())
                .versionNumber(request.getVersionNumber())
                .parentVersion(request.getParentVersion())
                .changelog(request.getChangelog())
                .featureNames(request.getFeatureNames())
                .baselineStatistics(request.getBaselineStatistics())
                .build()), HttpStatus.CREATED);
    }

    @PostMapping(value = "/{versionId}/stage", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> stage(@PathVariable String versionId) {
        return ApiResponses.of(versionRegistry.promoteToStaging(versionId));
    }

    @PostMapping(value = "/{versionId}/promote", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> promote(@PathVariable String versionId) {
        return ApiResponses.of(versionRegistry.promoteToProduction(versionId));
    }

    @PostMapping(value = "/{versionId}/archive", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> archive(@PathVariable String versionId) {
        return ApiResponses.of(versionRegistry.archive(versionId));
    }

    @PostMapping(value = "/{versionId}/rollback", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> rollbackTo(@PathVariable String versionId) {
        return ApiResponses.of(versionRegistry.rollbackToVersion(versionId));
    }

    @PostMapping(value = "/models/{modelId}/rollback", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> rollbackToPrevious(@PathVariable String modelId) {
        return ApiResponses.of(versionRegistry.rollbackToPrevious(modelId));
    }

    @Data
    public static class CreateVersionRequest {
        @NotBlank
        private String modelId;
        @NotBlank
        private String artifactLocation;
        private Map<String, Double> metrics;
        private String versionNumber;
        private String parentVersion;
        private String changelog;
        private List<String> featureNames;
        private Map<String, FeatureBaseline> baselineStatistics;
    }
}
