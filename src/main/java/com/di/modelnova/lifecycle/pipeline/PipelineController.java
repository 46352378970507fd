package com.di.modelnova.lifecycle.pipeline;

import com.di.modelnova.exception.ApiResponses;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Submit, poll, list and cancel pipeline runs. Submission is asynchronous and answers 202 with the PENDING run.
 */
@RestController
@RequestMapping("/api/lifecycle/pipelines")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineOrchestrator orchestrator;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> submit(@Valid @RequestBody SubmitRunRequest request) {
        return ApiResponses.of(orchestrator.submitPipeline(request.getModelFamily(),
                request.getTriggerReason() != null ? request.getTriggerReason() : TriggerReason.MANUAL,
                request.getHyperparameters() != null ? request.getHyperparameters() : Map.of()), HttpStatus.ACCEPTED);
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<PipelineRun>> list(@RequestParam(required = false) String modelFamily,
                                                  @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(orchestrator.listRuns(modelFamily, limit));
    }

    @GetMapping(value = "/{runId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PipelineRun> get(@PathVariable String runId) {
        return orchestrator.getRun(runId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping(value = "/{runId}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> cancel(@PathVariable String runId) {
        return ApiResponses.of(orchestrator.cancel(runId));
    }

    @Data
    public static class SubmitRunRequest {
        @NotBlank
        private String modelFamily;
        private TriggerReason triggerReason;
        private Map<String, Object> hyperparameters;
    }
}
