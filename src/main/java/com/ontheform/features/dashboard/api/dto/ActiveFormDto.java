package com.ontheform.features.dashboard.api.dto;

import java.time.Instant;
import java.util.UUID;

public record ActiveFormDto(
        UUID id,
        String title,
        String description,
        int fieldCount,
        int submissionCount,
        Instant createdAt,
        Instant updatedAt
) {
}
