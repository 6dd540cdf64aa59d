package com.ontheform.features.submission.application.validation;

import com.ontheform.features.submission.domain.model.value.FieldValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of checking a response map against a form schema.
 *
 * @param errors human-readable messages in field order, empty when the responses are valid
 * @param values typed values of the fields that carried a well-formed, non-empty answer
 */
public record ValidationResult(List<String> errors, Map<String, FieldValue> values) {

    public ValidationResult {
        errors = List.copyOf(errors);
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public Optional<FieldValue> valueOf(String fieldId) {
        return Optional.ofNullable(values.get(fieldId));
    }
}
