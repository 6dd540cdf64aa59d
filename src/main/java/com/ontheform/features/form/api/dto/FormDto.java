package com.ontheform.features.form.api.dto;

import com.ontheform.features.form.domain.model.FormField;
import com.ontheform.features.form.domain.model.UniqueConstraintType;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(description = "Form as seen by administrators")
public record FormDto(
        UUID id,
        String title,
        String description,
        List<FormField> fields,
        boolean active,
        boolean displayed,
        @Schema(description = "Number of stored submissions")
        int submissionCount,
        UniqueConstraintType uniqueConstraintType,
        String uniqueConstraintField,
        String bannerUrl,
        boolean showQrCode,
        boolean sendEmailNotification,
        TermsDto terms,
        UUID createdBy,
        Instant createdAt,
        Instant updatedAt
) {
}
