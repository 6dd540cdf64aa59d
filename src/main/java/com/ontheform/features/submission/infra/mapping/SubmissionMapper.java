package com.ontheform.features.submission.infra.mapping;

import com.ontheform.features.submission.api.dto.SubmissionDto;
import com.ontheform.features.submission.api.dto.SubmitFormResponse;
import com.ontheform.features.submission.application.sideeffect.SideEffectReport;
import com.ontheform.features.submission.domain.model.FormSubmission;
import org.springframework.stereotype.Component;

@Component
public class SubmissionMapper {

    /**
     * Reads the form title, so the form association must be loaded.
     */
    public SubmissionDto toDto(FormSubmission submission) {
        return new SubmissionDto(
                submission.getId(),
                submission.getFormId(),
                submission.getForm() != null ? submission.getForm().getTitle() : null,
                submission.getResponses(),
                submission.getSubmitterEmail(),
                submission.getSubmittedAt(),
                submission.getUpdatedAt()
        );
    }

    public SubmitFormResponse toSubmitResponse(FormSubmission submission, SideEffectReport report) {
        return new SubmitFormResponse(
                SubmitFormResponse.SUCCESS_MESSAGE,
                new SubmitFormResponse.Receipt(submission.getId(), submission.getFormId(), submission.getSubmittedAt()),
                report.qrCode(),
                report.emailSent(),
                report.emailError()
        );
    }
}
