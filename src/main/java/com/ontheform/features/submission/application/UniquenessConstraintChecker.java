package com.ontheform.features.submission.application;

import com.ontheform.features.form.domain.model.Form;
import com.ontheform.features.form.domain.model.UniqueConstraintType;
import com.ontheform.features.submission.domain.model.value.FieldValue;
import com.ontheform.features.submission.domain.repository.FormSubmissionRepository;
import com.ontheform.shared.exception.DuplicateSubmissionException;
import com.ontheform.shared.exception.ErrorCodes;
import com.ontheform.shared.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Rejects a submission that would duplicate an earlier one under the form's constraint.
 *
 * <p>This is a lookup ahead of the insert. The unique index on
 * {@code (form_id, uniqueness_key)} still decides races between concurrent submitters.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UniquenessConstraintChecker {

    public static final String DUPLICATE_IP_MESSAGE = "You have already submitted this form from this IP address";
    public static final String DUPLICATE_VALUE_MESSAGE = "A submission with this value already exists";
    public static final String CLIENT_IP_UNKNOWN_MESSAGE = "Unable to determine client IP address";

    private final FormSubmissionRepository submissionRepository;

    /**
     * @param values typed values produced by the response validator
     * @return the uniqueness key the new submission must be stored with, {@code null} for none
     * @throws ValidationException when an IP constrained form is submitted without a known client address
     */
    @Transactional(readOnly = true)
    public String checkUnique(Form form, SubmissionContext context, Map<String, FieldValue> values) {
        UniqueConstraintType type = form.getUniqueConstraintType();
        if (type == null || type == UniqueConstraintType.NONE) {
            return null;
        }

        if (type == UniqueConstraintType.FIELD) {
            String fieldId = form.getUniqueConstraintField();
            if (fieldId == null || !values.containsKey(fieldId)) {
                throw new ValidationException("Required unique field is missing", ErrorCodes.UNIQUE_FIELD_REQUIRED);
            }
        }

        String key = UniquenessKeys.derive(form, context.clientIp(), values);
        if (key == null) {
            log.warn("Form {} has an IP constraint but the client address is unknown", form.getId());
            throw new ValidationException(CLIENT_IP_UNKNOWN_MESSAGE, ErrorCodes.CLIENT_IP_UNKNOWN);
        }

        if (submissionRepository.existsByForm_IdAndUniquenessKey(form.getId(), key)) {
            log.info("Duplicate submission rejected for form {} ({} constraint)", form.getId(), type);
            throw new DuplicateSubmissionException(duplicateMessage(type));
        }
        return key;
    }

    public static String duplicateMessage(UniqueConstraintType type) {
        return type == UniqueConstraintType.IP ? DUPLICATE_IP_MESSAGE : DUPLICATE_VALUE_MESSAGE;
    }
}
