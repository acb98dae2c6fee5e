package com.eduhub.data.api;

import com.eduhub.data.reporting.ReportingModels;
import com.eduhub.data.reporting.StatsReportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/reports")
public class ReportController {
    private final StatsReportService statsReportService;

    public ReportController(StatsReportService statsReportService) {
        this.statsReportService = statsReportService;
    }

    @GetMapping("/enrollment-stats")
    public ResponseEntity<ReportingModels.EnrollmentStatsResponse> enrollmentStats() {
        return ResponseEntity.ok(new ReportingModels.EnrollmentStatsResponse(statsReportService.computeEnrollmentStats()));
    }
}
