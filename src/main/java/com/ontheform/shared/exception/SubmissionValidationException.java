package com.ontheform.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.List;

/**
 * Carries every validation error found in a submitted response set, in field order.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class SubmissionValidationException extends RuntimeException {

    private final List<String> validationErrors;

    public SubmissionValidationException(List<String> validationErrors) {
        super("Form validation failed");
        this.validationErrors = List.copyOf(validationErrors);
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }
}
