package com.di.modelnova.lifecycle.alert;

import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/lifecycle/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertService alertService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<Alert>> list(@RequestParam(required = false) String modelId,
                                            @RequestParam(required = false) AlertSeverity severity,
                                            @RequestParam(required = false) Boolean resolved,
                                            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(alertService.getAlerts(modelId, severity, resolved, limit));
    }

    @GetMapping(value = "/{alertId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Alert> get(@PathVariable String alertId) {
        return alertService.getAlert(alertId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping(value = "/{alertId}/resolve", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Alert> resolve(@PathVariable String alertId) {
        return alertService.resolve(alertId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
