package com.ontheform.features.dashboard.api;

import com.ontheform.features.dashboard.api.dto.ActiveFormDto;
import com.ontheform.features.dashboard.api.dto.DashboardStatsDto;
import com.ontheform.features.dashboard.api.dto.RecentSubmissionDto;
import com.ontheform.features.dashboard.application.DashboardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/dashboard")
@RequiredArgsConstructor
@Tag(name = "Dashboard", description = "Statistics for the signed-in admin's forms")
@SecurityRequirement(name = "basicAuth")
public class DashboardController {

    private final DashboardService dashboardService;

    @Operation(summary = "Form and submission totals")
    @GetMapping("/stats")
    public ResponseEntity<DashboardStatsDto> getStats(Authentication authentication) {
        return ResponseEntity.ok(dashboardService.getStats(authentication.getName()));
    }

    @Operation(summary = "Latest submissions across the admin's forms")
    @GetMapping("/recent-submissions")
    public ResponseEntity<List<RecentSubmissionDto>> getRecentSubmissions(
            @Parameter(description = "Maximum number of rows, 1 to 50")
            @RequestParam(defaultValue = "5") int limit,
            Authentication authentication
    ) {
        return ResponseEntity.ok(dashboardService.getRecentSubmissions(authentication.getName(), limit));
    }

    @Operation(summary = "Active forms, most recently updated first")
    @GetMapping("/active-forms")
    public ResponseEntity<List<ActiveFormDto>> getActiveForms(
            @Parameter(description = "Maximum number of rows, 1 to 50")
            @RequestParam(defaultValue = "10") int limit,
            Authentication authentication
    ) {
        return ResponseEntity.ok(dashboardService.getActiveForms(authentication.getName(), limit));
    }
}
