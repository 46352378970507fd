package com.di.modelnova.lifecycle.retrain;

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

@RestController
@RequestMapping("/api/lifecycle/retraining")
@RequiredArgsConstructor
public class RetrainController {

    private final RetrainTriggerEngine engine;

    @PostMapping(value = "/check/{modelId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> check(@PathVariable String modelId) {
        return ApiResponses.of(engine.checkAndMaybeRetrain(modelId));
    }

    @PostMapping(value = "/manual", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> manual(@Valid @RequestBody ManualRetrainRequest request) {
        return ApiResponses.of(engine.triggerManual(request.getModelFamily()), HttpStatus.ACCEPTED);
    }

    @GetMapping(value = "/history", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<RetrainingRecord>> history(@RequestParam(required = false) String modelFamily,
                                                          @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(engine.getHistory(modelFamily, limit));
    }

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RetrainStats> stats() {
        return ResponseEntity.ok(engine.getStats());
    }

    @Data
    public static class ManualRetrainRequest {
        @NotBlank
        private String modelFamily;
    }
}
