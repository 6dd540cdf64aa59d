package com.ontheform.features.submission.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(description = "Result of a successful submission, including side-effect outcomes")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmitFormResponse(
        String message,
        Receipt submission,

        @Schema(description = "PNG data URL of the submission QR code, when the form shows one")
        String qrCode,

        @Schema(description = "Whether the confirmation email was sent, when the form sends one")
        Boolean emailSent,

        @Schema(description = "Present when the confirmation email could not be sent")
        String emailError
) {

    public static final String SUCCESS_MESSAGE = "Form submitted successfully";

    public record Receipt(UUID id, UUID formId, Instant submittedAt) {
    }
}
