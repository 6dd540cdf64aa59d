package com.ontheform.features.dashboard.application;

import com.ontheform.features.dashboard.api.dto.ActiveFormDto;
import com.ontheform.features.dashboard.api.dto.DashboardStatsDto;
import com.ontheform.features.dashboard.api.dto.RecentSubmissionDto;

import java.util.List;

/**
 * Figures shown on the admin landing page, always scoped to forms the caller created.
 */
public interface DashboardService {

    DashboardStatsDto getStats(String username);

    List<RecentSubmissionDto> getRecentSubmissions(String username, int limit);

    List<ActiveFormDto> getActiveForms(String username, int limit);
}
