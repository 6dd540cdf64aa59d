package com.ontheform.features.form.application;

import com.ontheform.features.form.domain.model.FormField;
import com.ontheform.features.form.domain.model.UniqueConstraintType;
import com.ontheform.shared.exception.ErrorCodes;
import com.ontheform.shared.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural rules for an admin-authored field list and its uniqueness settings.
 */
@Component
public class FormSchemaValidator {

    public void validateFields(List<FormField> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new ValidationException("At least one field is required", ErrorCodes.FIELD_REQUIRED);
        }

        Set<String> seen = new HashSet<>();
        for (FormField field : fields) {
            if (!seen.add(field.id())) {
                throw new ValidationException("Field IDs must be unique", ErrorCodes.DUPLICATE_FIELD_IDS);
            }
            if (field.type().isChoice() && field.optionList().isEmpty()) {
                throw new ValidationException(field.label() + " must define at least one option",
                        ErrorCodes.INVALID_FIELD_SCHEMA);
            }
        }
    }

    public void validateUniqueConstraint(UniqueConstraintType type, String fieldId, List<FormField> fields) {
        if (type != UniqueConstraintType.FIELD) {
            return;
        }
        if (fieldId == null || fieldId.isBlank()) {
            throw new ValidationException("Unique constraint field is required when constraint type is 'field'",
                    ErrorCodes.FIELD_REQUIRED);
        }
        boolean exists = fields != null && fields.stream().anyMatch(field -> fieldId.equals(field.id()));
        if (!exists) {
            throw new ValidationException("Unique constraint field does not exist in form", ErrorCodes.FIELD_NOT_FOUND);
        }
    }
}
