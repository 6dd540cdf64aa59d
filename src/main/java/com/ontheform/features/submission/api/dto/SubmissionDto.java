package com.ontheform.features.submission.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Schema(description = "Stored submission as seen by administrators")
public record SubmissionDto(
        UUID id,
        UUID formId,
        String formTitle,
        Map<String, Object> responses,
        String submitterEmail,
        Instant submittedAt,
        Instant updatedAt
) {
}
