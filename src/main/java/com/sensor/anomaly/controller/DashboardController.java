package com.sensor.anomaly.controller;

import com.sensor.anomaly.service.DashboardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Dashboard", description = "Data feed for the monitoring dashboard")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping("/api/dashboard-data")
    @Operation(summary = "Get dashboard data",
               description = "Record counters and the latest anomalies, newest first")
    public ResponseEntity<DashboardService.DashboardData> getDashboardData() {
        return ResponseEntity.ok(dashboardService.getDashboardData());
    }
}
