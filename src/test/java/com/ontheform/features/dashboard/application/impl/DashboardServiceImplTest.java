package com.ontheform.features.dashboard.application.impl;

import com.ontheform.BaseUnitTest;
import com.ontheform.features.dashboard.api.dto.DashboardStatsDto;
import com.ontheform.features.form.domain.repository.FormRepository;
import com.ontheform.features.submission.domain.repository.FormSubmissionRepository;
import com.ontheform.features.user.domain.model.User;
import com.ontheform.features.user.domain.model.UserRole;
import com.ontheform.shared.security.AccessPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("DashboardServiceImpl")
class DashboardServiceImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2024-01-08T12:00:00Z");

    @Mock
    private FormRepository formRepository;
    @Mock
    private FormSubmissionRepository submissionRepository;
    @Mock
    private AccessPolicy accessPolicy;

    private DashboardServiceImpl service;
    private User user;

    @BeforeEach
    void setUp() {
        service = new DashboardServiceImpl(formRepository, submissionRepository, accessPolicy,
                Clock.fixed(NOW, ZoneOffset.UTC));
        user = new User();
        user.setId(UUID.randomUUID());
        user.setRole(UserRole.SUPER_ADMIN);
        when(accessPolicy.requireUser("admin@example.com")).thenReturn(user);
    }

    @Test
    @DisplayName("stats: scoped to the caller's forms, average rounded, 7-day window")
    void stats_scopedAndRounded() {
        when(formRepository.countByOwner(user.getId())).thenReturn(3L);
        when(submissionRepository.countByOwner(user.getId())).thenReturn(8L);
        when(submissionRepository.countByOwnerSince(user.getId(), Instant.parse("2024-01-01T12:00:00Z"))).thenReturn(2L);

        DashboardStatsDto stats = service.getStats("admin@example.com");

        assertThat(stats).isEqualTo(new DashboardStatsDto(3, 8, 3, 2));
    }

    @Test
    @DisplayName("stats: no forms means an average of zero")
    void stats_noForms_zeroAverage() {
        when(formRepository.countByOwner(user.getId())).thenReturn(0L);
        when(submissionRepository.countByOwner(user.getId())).thenReturn(0L);

        assertThat(service.getStats("admin@example.com").averageSubmissions()).isZero();
    }

    @Test
    @DisplayName("limits are clamped to 1..50")
    void limits_clamped() {
        when(submissionRepository.findRecentByOwner(user.getId(), PageRequest.of(0, 50))).thenReturn(List.of());
        when(formRepository.findActiveByOwner(user.getId(), PageRequest.of(0, 1))).thenReturn(List.of());

        assertThat(service.getRecentSubmissions("admin@example.com", 500)).isEmpty();
        assertThat(service.getActiveForms("admin@example.com", 0)).isEmpty();
        verify(submissionRepository).findRecentByOwner(user.getId(), PageRequest.of(0, 50));
    }
}
