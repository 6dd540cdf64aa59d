package com.ontheform.features.form.api.dto;

import com.ontheform.features.form.domain.model.FormField;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

@Schema(description = "Payload for creating a form")
public record CreateFormRequest(
        @Schema(description = "Form title", example = "Event Registration", maxLength = 255)
        @NotBlank(message = "Title is required")
        @Size(max = 255, message = "Title must be at most 255 characters")
        String title,

        @Schema(description = "Optional description shown above the fields", maxLength = 1000)
        @Size(max = 1000, message = "Description must be at most 1000 characters")
        String description,

        @Schema(description = "Ordered field definitions")
        @NotEmpty(message = "At least one field is required")
        List<@Valid FormField> fields,

        @Schema(description = "Banner image URL (relative to the backend or absolute)", maxLength = 1024)
        @Size(max = 1024, message = "Banner URL must be at most 1024 characters")
        String bannerUrl,

        @Schema(description = "Consent checkbox configuration")
        @Valid
        TermsDto terms
) {
}
