package com.ontheform.features.form.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of input kinds a form field can have. Serialized in lower case.
 */
public enum FieldType {
    TEXT,
    EMAIL,
    TEXTAREA,
    SELECT,
    RADIO,
    CHECKBOX,
    NUMBER,
    DATE,
    FILE;

    /**
     * Types whose value must come from {@code options}.
     */
    public boolean isChoice() {
        return this == SELECT || this == RADIO || this == CHECKBOX;
    }

    public boolean isMultiValued() {
        return this == CHECKBOX;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FieldType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        try {
            return FieldType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported field type: " + value);
        }
    }
}
