package com.ontheform.features.dashboard.application.impl;

import com.ontheform.features.dashboard.api.dto.ActiveFormDto;
import com.ontheform.features.dashboard.api.dto.DashboardStatsDto;
import com.ontheform.features.dashboard.api.dto.RecentSubmissionDto;
import com.ontheform.features.dashboard.application.DashboardService;
import com.ontheform.features.form.domain.repository.FormRepository;
import com.ontheform.features.submission.domain.repository.FormSubmissionRepository;
import com.ontheform.features.user.domain.model.User;
import com.ontheform.shared.security.AccessPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class DashboardServiceImpl implements DashboardService {

    static final Duration RECENT_WINDOW = Duration.ofDays(7);
    static final int MAX_LIMIT = 50;

    private final FormRepository formRepository;
    private final FormSubmissionRepository submissionRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Override
    public DashboardStatsDto getStats(String username) {
        User user = accessPolicy.requireUser(username);
        long totalForms = formRepository.countByOwner(user.getId());
        long totalSubmissions = submissionRepository.countByOwner(user.getId());
        long average = totalForms > 0 ? Math.round((double) totalSubmissions / totalForms) : 0;
        long recent = submissionRepository.countByOwnerSince(user.getId(), Instant.now(clock).minus(RECENT_WINDOW));
        return new DashboardStatsDto(totalForms, totalSubmissions, average, recent);
    }

    @Override
    public List<RecentSubmissionDto> getRecentSubmissions(String username, int limit) {
        User user = accessPolicy.requireUser(username);
        return submissionRepository.findRecentByOwner(user.getId(), PageRequest.of(0, clamp(limit))).stream()
                .map(submission -> new RecentSubmissionDto(
                        submission.getId(),
                        submission.getFormId(),
                        submission.getForm().getTitle(),
                        submission.getSubmittedAt(),
                        submission.getSubmitterEmail(),
                        submission.getResponses()))
                .toList();
    }

    @Override
    public List<ActiveFormDto> getActiveForms(String username, int limit) {
        User user = accessPolicy.requireUser(username);
        return formRepository.findActiveByOwner(user.getId(), PageRequest.of(0, clamp(limit))).stream()
                .map(form -> new ActiveFormDto(
                        form.getId(),
                        form.getTitle(),
                        form.getDescription(),
                        form.getFields().size(),
                        form.getSubmissionCount(),
                        form.getCreatedAt(),
                        form.getUpdatedAt()))
                .toList();
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }
}
