package com.ontheform.features.submission.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

@Schema(description = "Replacement answers; validated against the form like a new submission")
public record UpdateSubmissionRequest(
        @NotNull(message = "Responses must be an object")
        Map<String, Object> responses
) {
}
