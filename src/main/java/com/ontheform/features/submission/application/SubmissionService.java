package com.ontheform.features.submission.application;

import com.ontheform.features.submission.api.dto.SubmissionDto;
import com.ontheform.features.submission.api.dto.SubmitFormRequest;
import com.ontheform.features.submission.api.dto.SubmitFormResponse;
import com.ontheform.features.submission.api.dto.UpdateSubmissionRequest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.LocalDate;
import java.util.UUID;

public interface SubmissionService {

    /**
     * Public submission pipeline: validate, check uniqueness, store, then run side effects.
     */
    SubmitFormResponse submit(SubmitFormRequest request, SubmissionContext context);

    Page<SubmissionDto> listSubmissions(String username, UUID formId, String search,
                                        LocalDate startDate, LocalDate endDate, Pageable pageable);

    SubmissionDto getSubmission(String username, UUID submissionId);

    SubmissionDto updateSubmission(String username, UUID submissionId, UpdateSubmissionRequest request);

    void deleteSubmission(String username, UUID submissionId);
}
