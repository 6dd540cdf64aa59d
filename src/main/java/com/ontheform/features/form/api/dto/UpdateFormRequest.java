package com.ontheform.features.form.api.dto;

import com.ontheform.features.form.domain.model.FormField;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

@Schema(description = "Replaces the content of a form; omitted optional values are cleared")
public record UpdateFormRequest(
        @NotBlank(message = "Title is required")
        @Size(max = 255, message = "Title must be at most 255 characters")
        String title,

        @Size(max = 1000, message = "Description must be at most 1000 characters")
        String description,

        @NotEmpty(message = "At least one field is required")
        List<@Valid FormField> fields,

        @Size(max = 1024, message = "Banner URL must be at most 1024 characters")
        String bannerUrl,

        @Schema(description = "Active flag; left unchanged when omitted")
        Boolean active,

        @Valid
        TermsDto terms
) {
}
