package com.ontheform.features.dashboard.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Headline numbers for the signed-in admin's forms")
public record DashboardStatsDto(
        long totalForms,
        long totalSubmissions,
        @Schema(description = "Submissions per form, rounded to the nearest integer")
        long averageSubmissions,
        @Schema(description = "Submissions received in the last 7 days")
        long recentSubmissions
) {
}
