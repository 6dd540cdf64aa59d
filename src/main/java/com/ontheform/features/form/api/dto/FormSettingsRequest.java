package com.ontheform.features.form.api.dto;

import com.ontheform.features.form.domain.model.UniqueConstraintType;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Submission behaviour settings; null values leave the current setting unchanged")
public record FormSettingsRequest(
        @Schema(description = "Duplicate policy", example = "field")
        UniqueConstraintType uniqueConstraintType,

        @Schema(description = "Field id checked when the policy is 'field'", example = "email")
        String uniqueConstraintField,

        @Schema(description = "Return a QR code for each submission")
        Boolean showQrCode,

        @Schema(description = "Email the submitter a confirmation")
        Boolean sendEmailNotification
) {
}
