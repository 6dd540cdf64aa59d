package com.ontheform.features.dashboard.api.dto;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record RecentSubmissionDto(
        UUID id,
        UUID formId,
        String formTitle,
        Instant submittedAt,
        String submitterEmail,
        Map<String, Object> responses
) {
}
