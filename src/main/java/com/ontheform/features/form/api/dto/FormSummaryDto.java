package com.ontheform.features.form.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(description = "Row of the admin form list")
public record FormSummaryDto(
        UUID id,
        String title,
        String description,
        boolean active,
        boolean displayed,
        int submissionCount,
        int fieldCount,
        Instant createdAt,
        Instant updatedAt
) {
}
