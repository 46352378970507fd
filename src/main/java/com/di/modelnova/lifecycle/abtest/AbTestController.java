package com.di.modelnova.lifecycle.abtest;

import com.di.modelnova.exception.ApiResponses;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
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

@RestController
@RequestMapping("/api/lifecycle/ab-tests")
@RequiredArgsConstructor
public class AbTestController {

    private final AbTestManager abTestManager;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> create(@Valid @RequestBody CreateTestRequest request) {
        return ApiResponses.of(abTestManager.createTest(request.getLabel(), request.getControlVersionId(),
                request.getTreatmentVersionId(), request.getTrafficFraction(), request.getMetric()), HttpStatus.CREATED);
    }

    /** Active tests, or the most recent ones of any status with {@code all=true}. */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<AbTest>> list(@RequestParam(defaultValue = "false") boolean all,
                                             @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(all ? abTestManager.listTests(limit) : abTestManager.listActiveTests());
    }

    @GetMapping(value = "/{testId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> results(@PathVariable String testId) {
        return ApiResponses.of(abTestManager.getResults(testId));
    }

    @PostMapping(value = "/{testId}/select", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> select(@PathVariable String testId,
                                    @RequestParam(required = false) String caller) {
        return ApiResponses.of(abTestManager.selectArm(testId, caller));
    }

    @PostMapping(value = "/{testId}/outcomes", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> outcome(@PathVariable String testId, @Valid @RequestBody OutcomeRequest request) {
        return ApiResponses.of(abTestManager.recordOutcome(testId, request.getArm(), request.getPrediction(),
                request.getGroundTruth(), request.getMetrics()));
    }

    @PostMapping(value = "/{testId}/stop", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> stop(@PathVariable String testId, @RequestParam(required = false) Arm winner) {
        return ApiResponses.of(abTestManager.stopTest(testId, winner));
    }

    @Data
    public static class CreateTestRequest {
        private String label;
        @NotBlank
        private String controlVersionId;
        @NotBlank
        private String treatmentVersionId;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double trafficFraction = 0.1;
        private String metric;
    }

    @Data
    public static class OutcomeRequest {
        @NotNull
        private Arm arm;
        @NotNull
        private Double prediction;
        private Double groundTruth;
        private Map<String, Double> metrics;
    }
}
