package com.phillippitts.providerrouter.presentation.controller;

import com.phillippitts.providerrouter.domain.FeatureConfig;
import com.phillippitts.providerrouter.domain.FeatureConfigUpdate;
import com.phillippitts.providerrouter.domain.SystemStatus;
import com.phillippitts.providerrouter.service.routing.RoutingEngine;
import com.phillippitts.providerrouter.util.LogSanitizer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Thin admin surface over {@link RoutingEngine}. Contains no routing logic of its own.
 */
@RestController
@RequestMapping("/api/routing")
class RoutingController {

    private static final Logger LOG = LogManager.getLogger(RoutingController.class);

    private final RoutingEngine engine;

    RoutingController(RoutingEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/features/{feature}/provider")
    ResponseEntity<SelectionResponse> selectProvider(@PathVariable String feature) {
        String providerId = engine.selectProvider(feature);
        return ResponseEntity.ok(new SelectionResponse(feature, providerId));
    }

    @PostMapping("/outcomes")
    ResponseEntity<Void> reportOutcome(@Valid @RequestBody OutcomeRequest request) {
        engine.report(request.providerId(), request.success(), request.latencyMs());
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/features/{feature}")
    ResponseEntity<FeatureConfig> getFeature(@PathVariable String feature) {
        return ResponseEntity.ok(engine.getFeatureConfig(feature));
    }

    @PatchMapping("/features/{feature}")
    ResponseEntity<FeatureConfig> updateFeature(@PathVariable String feature,
                                                @Valid @RequestBody FeatureUpdateRequest request) {
        FeatureConfig updated = engine.updateFeatureConfig(feature, request.toUpdate());
        LOG.info("Feature {} reconfigured via API", LogSanitizer.sanitize(feature, 64));
        return ResponseEntity.ok(updated);
    }

    @PutMapping("/providers/{providerId}/active")
    ResponseEntity<Void> setActive(@PathVariable String providerId, @RequestParam boolean active) {
        engine.setProviderActive(providerId, active);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/status")
    ResponseEntity<SystemStatus> status() {
        return ResponseEntity.ok(engine.getSystemStatus());
    }

    record SelectionResponse(String feature, String providerId) {}

    record OutcomeRequest(
            @NotBlank String providerId,
            @NotNull Boolean success,
            @PositiveOrZero Double latencyMs
    ) {}

    record FeatureUpdateRequest(
            String primaryProviderId,
            List<String> fallbackProviderIds,
            @PositiveOrZero Integer maxRetries,
            @PositiveOrZero Double costCeiling,
            Boolean clearCostCeiling
    ) {
        FeatureConfigUpdate toUpdate() {
            return new FeatureConfigUpdate(primaryProviderId, fallbackProviderIds, maxRetries, costCeiling,
                    Boolean.TRUE.equals(clearCostCeiling));
        }
    }
}
