package com.ontheform.features.submission.application;

import com.ontheform.features.form.domain.model.Form;
import com.ontheform.features.form.domain.model.FormField;
import com.ontheform.features.form.domain.repository.FormRepository;
import com.ontheform.features.submission.domain.model.FormSubmission;
import com.ontheform.features.submission.domain.repository.FormSubmissionRepository;
import com.ontheform.shared.exception.DuplicateSubmissionException;
import com.ontheform.shared.exception.ErrorCodes;
import com.ontheform.shared.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Persists an accepted submission and bumps the form's counter in one transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubmissionWriter {

    static final String UNIQUENESS_INDEX = "uk_form_submissions_uniqueness_key";

    private final FormSubmissionRepository submissionRepository;
    private final FormRepository formRepository;

    /**
     * Callers must have validated the responses and run the uniqueness check first.
     *
     * @throws DuplicateSubmissionException when a concurrent submission took the same uniqueness key
     * @throws ResourceNotFoundException    when the form disappeared before the counter update
     */
    @Transactional
    public FormSubmission write(Form form, Map<String, Object> responses, String submitterEmail,
                                String uniquenessKey, SubmissionContext context) {
        FormSubmission submission = new FormSubmission();
        submission.setForm(form);
        submission.setResponses(retainSchemaFields(form, responses));
        submission.setSubmitterEmail(submitterEmail);
        submission.setSubmitterIp(context.clientIp());
        submission.setUserAgent(context.userAgent());
        submission.setUniquenessKey(uniquenessKey);

        FormSubmission saved;
        try {
            saved = submissionRepository.saveAndFlush(submission);
        } catch (DataIntegrityViolationException e) {
            if (uniquenessKey != null && isUniquenessViolation(e)) {
                log.info("Concurrent duplicate submission rejected for form {}", form.getId());
                throw new DuplicateSubmissionException(
                        UniquenessConstraintChecker.duplicateMessage(form.getUniqueConstraintType()), e);
            }
            throw e;
        }

        if (formRepository.incrementSubmissionCount(form.getId()) != 1) {
            throw new ResourceNotFoundException("Form " + form.getId() + " not found", ErrorCodes.FORM_NOT_FOUND);
        }

        log.info("Submission {} stored for form {}", saved.getId(), form.getId());
        return saved;
    }

    /**
     * Only answers to declared fields are stored, in declared order.
     */
    public static Map<String, Object> retainSchemaFields(Form form, Map<String, Object> responses) {
        Map<String, Object> retained = new LinkedHashMap<>();
        if (responses == null) {
            return retained;
        }
        for (FormField field : form.getFields()) {
            if (responses.containsKey(field.id())) {
                retained.put(field.id(), responses.get(field.id()));
            }
        }
        return retained;
    }

    private static boolean isUniquenessViolation(DataIntegrityViolationException e) {
        Throwable cause = e;
        while (cause != null) {
            String message = cause.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(UNIQUENESS_INDEX)) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
