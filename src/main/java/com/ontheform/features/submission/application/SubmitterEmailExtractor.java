package com.ontheform.features.submission.application;

import com.ontheform.features.form.domain.model.FieldType;
import com.ontheform.features.form.domain.model.FormField;
import com.ontheform.features.submission.application.validation.ResponseValidator;
import com.ontheform.features.submission.domain.model.value.FieldValue;
import com.ontheform.shared.exception.ErrorCodes;
import com.ontheform.shared.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Picks the confirmation address: the first email field, in declared order, that has a value.
 */
@Component
public class SubmitterEmailExtractor {

    /**
     * @return the trimmed, lower-cased address, or {@code null} when no email field was answered
     * @throws ValidationException with {@code INVALID_EMAIL_FORMAT} when the first answered
     *                             email field does not hold an address
     */
    public String extract(List<FormField> fields, Map<String, FieldValue> values) {
        for (FormField field : fields) {
            if (field.type() != FieldType.EMAIL) {
                continue;
            }
            FieldValue value = values.get(field.id());
            if (value == null) {
                continue;
            }
            String candidate = value.asText();
            if (!ResponseValidator.EMAIL_PATTERN.matcher(candidate).matches()) {
                throw new ValidationException("Invalid email format in field: " + field.label(),
                        ErrorCodes.INVALID_EMAIL_FORMAT);
            }
            return candidate.toLowerCase(Locale.ROOT);
        }
        return null;
    }
}
