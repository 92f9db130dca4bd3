package com.sensor.anomaly.controller;

import com.sensor.anomaly.engine.profile.HistoricalProfiler;
import com.sensor.anomaly.model.ProfileState;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/profile")
@Tag(name = "Profile", description = "Running per-feature statistics")
public class ProfileController {

    private final HistoricalProfiler profiler;

    public ProfileController(HistoricalProfiler profiler) {
        this.profiler = profiler;
    }

    @GetMapping
    @Operation(summary = "Get profile snapshot",
               description = "Count, mean, variance, min, max and quantile estimates for every feature")
    public ResponseEntity<ProfileState> getProfile() {
        return ResponseEntity.ok(profiler.snapshot());
    }

    @PostMapping("/reset")
    @Operation(summary = "Reset feature statistics",
               description = "Clears the named features, or every feature when none are given")
    public ResponseEntity<Map<String, Object>> reset(
            @Parameter(description = "Features to reset", example = "sensor_value")
            @RequestParam(required = false) List<String> features) {
        List<String> cleared = profiler.reset(features == null ? List.of() : features);
        return ResponseEntity.ok(Map.of("reset", cleared));
    }
}
