package com.ontheform.features.submission.application.impl;

import com.ontheform.features.form.domain.model.Form;
import com.ontheform.features.form.domain.repository.FormRepository;
import com.ontheform.features.submission.api.dto.SubmissionDto;
import com.ontheform.features.submission.api.dto.SubmitFormRequest;
import com.ontheform.features.submission.api.dto.SubmitFormResponse;
import com.ontheform.features.submission.api.dto.UpdateSubmissionRequest;
import com.ontheform.features.submission.application.SubmissionContext;
import com.ontheform.features.submission.application.SubmissionService;
import com.ontheform.features.submission.application.SubmissionWriter;
import com.ontheform.features.submission.application.SubmitterEmailExtractor;
import com.ontheform.features.submission.application.UniquenessConstraintChecker;
import com.ontheform.features.submission.application.UniquenessKeys;
import com.ontheform.features.submission.application.sideeffect.SideEffectOrchestrator;
import com.ontheform.features.submission.application.sideeffect.SideEffectReport;
import com.ontheform.features.submission.application.validation.ResponseValidator;
import com.ontheform.features.submission.application.validation.ValidationResult;
import com.ontheform.features.submission.domain.model.FormSubmission;
import com.ontheform.features.submission.domain.repository.FormSubmissionRepository;
import com.ontheform.features.submission.domain.repository.FormSubmissionSpecifications;
import com.ontheform.features.submission.infra.mapping.SubmissionMapper;
import com.ontheform.features.user.domain.model.User;
import com.ontheform.shared.exception.DuplicateSubmissionException;
import com.ontheform.shared.exception.ErrorCodes;
import com.ontheform.shared.exception.ResourceNotFoundException;
import com.ontheform.shared.exception.SubmissionValidationException;
import com.ontheform.shared.exception.ValidationException;
import com.ontheform.shared.security.AccessPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * In the public pipeline only the write step runs in a transaction; side effects run after
 * the submission and its counter update have committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionServiceImpl implements SubmissionService {

    private final FormRepository formRepository;
    private final FormSubmissionRepository submissionRepository;
    private final ResponseValidator responseValidator;
    private final UniquenessConstraintChecker uniquenessChecker;
    private final SubmitterEmailExtractor emailExtractor;
    private final SubmissionWriter submissionWriter;
    private final SideEffectOrchestrator sideEffectOrchestrator;
    private final SubmissionMapper submissionMapper;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Override
    public SubmitFormResponse submit(SubmitFormRequest request, SubmissionContext context) {
        Form form = formRepository.findByIdAndActiveTrue(request.formId())
                .orElseThrow(() -> new ResourceNotFoundException("Form not found or inactive", ErrorCodes.FORM_NOT_FOUND));

        ValidationResult validation = responseValidator.validate(form.getFields(), request.responses());
        if (!validation.isValid()) {
            log.debug("Submission for form {} rejected with {} validation errors", form.getId(), validation.errors().size());
            throw new SubmissionValidationException(validation.errors());
        }

        String uniquenessKey = uniquenessChecker.checkUnique(form, context, validation.values());
        String submitterEmail = emailExtractor.extract(form.getFields(), validation.values());

        FormSubmission saved = submissionWriter.write(form, request.responses(), submitterEmail, uniquenessKey, context);
        SideEffectReport report = sideEffectOrchestrator.afterWrite(form, saved);
        return submissionMapper.toSubmitResponse(saved, report);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<SubmissionDto> listSubmissions(String username, UUID formId, String search,
                                               LocalDate startDate, LocalDate endDate, Pageable pageable) {
        User user = accessPolicy.requireUser(username);
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new ValidationException("endDate must not be before startDate");
        }
        Instant from = startDate != null ? startDate.atStartOfDay(clock.getZone()).toInstant() : null;
        Instant to = endDate != null ? endDate.plusDays(1).atStartOfDay(clock.getZone()).toInstant() : null;

        return submissionRepository.findAll(
                FormSubmissionSpecifications.build(accessPolicy.ownerScope(user), formId, search, from, to),
                pageable
        ).map(submissionMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public SubmissionDto getSubmission(String username, UUID submissionId) {
        return submissionMapper.toDto(loadOwnedSubmission(username, submissionId));
    }

    @Override
    @Transactional
    public SubmissionDto updateSubmission(String username, UUID submissionId, UpdateSubmissionRequest request) {
        FormSubmission submission = loadOwnedSubmission(username, submissionId);
        Form form = submission.getForm();

        ValidationResult validation = responseValidator.validate(form.getFields(), request.responses());
        if (!validation.isValid()) {
            throw new SubmissionValidationException(validation.errors());
        }

        String key = UniquenessKeys.derive(form, submission.getSubmitterIp(), validation.values());
        String previousKey = UniquenessKeys.derive(form, submission.getSubmitterIp(),
                responseValidator.validate(form.getFields(), submission.getResponses()).values());
        if (Objects.equals(key, previousKey)) {
            // constrained value untouched, historical duplicates keep their NULL key
            key = submission.getUniquenessKey();
        } else if (key != null && submissionRepository.existsByForm_IdAndUniquenessKey(form.getId(), key)) {
            throw new DuplicateSubmissionException(UniquenessConstraintChecker.duplicateMessage(form.getUniqueConstraintType()));
        }

        String submitterEmail = emailExtractor.extract(form.getFields(), validation.values());
        if (!Objects.equals(submitterEmail, submission.getSubmitterEmail())) {
            log.info("Submission {} submitter email changed by edit", submissionId);
        }

        submission.setResponses(SubmissionWriter.retainSchemaFields(form, request.responses()));
        submission.setSubmitterEmail(submitterEmail);
        submission.setUniquenessKey(key);
        FormSubmission saved = submissionRepository.saveAndFlush(submission);
        log.info("Submission {} updated by {}", submissionId, username);
        return submissionMapper.toDto(saved);
    }

    @Override
    @Transactional
    public void deleteSubmission(String username, UUID submissionId) {
        FormSubmission submission = loadOwnedSubmission(username, submissionId);
        UUID formId = submission.getFormId();

        submissionRepository.delete(submission);
        submissionRepository.flush();
        formRepository.decrementSubmissionCount(formId);
        log.info("Submission {} deleted from form {} by {}", submissionId, formId, username);
    }

    private FormSubmission loadOwnedSubmission(String username, UUID submissionId) {
        User user = accessPolicy.requireUser(username);
        FormSubmission submission = submissionRepository.findWithFormById(submissionId)
                .orElseThrow(() -> new ResourceNotFoundException("Submission " + submissionId + " not found",
                        ErrorCodes.SUBMISSION_NOT_FOUND));
        accessPolicy.requireOwnerOrSuperAdmin(user, submission.getForm().getOwnerId());
        return submission;
    }
}
