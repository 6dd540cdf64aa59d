package com.ontheform.features.submission.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.Map;
import java.util.UUID;

@Schema(description = "Public form submission")
public record SubmitFormRequest(
        @Schema(description = "Form being answered")
        @NotNull(message = "Valid form ID is required")
        UUID formId,

        @Schema(description = "Answers keyed by field id: string, number, string array or file metadata object",
                example = "{\"name\": \"Ada\", \"email\": \"ada@example.com\"}")
        @NotNull(message = "Responses must be an object")
        Map<String, Object> responses
) {
}
