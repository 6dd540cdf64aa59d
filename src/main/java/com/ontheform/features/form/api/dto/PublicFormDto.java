package com.ontheform.features.form.api.dto;

import com.ontheform.features.form.domain.model.FormField;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(description = "What the public renderer needs to display an active form")
public record PublicFormDto(
        UUID id,
        String title,
        String description,
        List<FormField> fields,
        String bannerUrl,
        TermsDto terms
) {
}
