package com.ontheform.features.form.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(description = "Consent checkbox configuration")
public record TermsDto(
        @Schema(description = "Render the consent checkbox")
        boolean showTermsCheckbox,

        @Schema(description = "Main consent text", maxLength = 2000)
        @Size(max = 2000, message = "Terms text must be at most 2000 characters")
        String termsText,

        @Schema(description = "Secondary consent text", maxLength = 2000)
        @Size(max = 2000, message = "Terms secondary text must be at most 2000 characters")
        String termsSecondaryText,

        @Schema(description = "Link to the full terms", maxLength = 1024)
        @Size(max = 1024, message = "Terms link URL must be at most 1024 characters")
        String termsLinkUrl,

        @Schema(description = "Text of the terms link", maxLength = 255)
        @Size(max = 255, message = "Terms link text must be at most 255 characters")
        String termsLinkText
) {
}
