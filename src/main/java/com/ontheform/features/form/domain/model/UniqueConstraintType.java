package com.ontheform.features.form.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which duplicate submissions a form rejects.
 */
public enum UniqueConstraintType {
    /** Unlimited submissions. */
    NONE,
    /** One submission per client IP address. */
    IP,
    /** One submission per value of a designated field. */
    FIELD;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static UniqueConstraintType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return UniqueConstraintType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported unique constraint type: " + value);
        }
    }
}
