package com.ontheform.features.form.domain.model;

/**
 * List filter over {@link Form#isActive()}.
 */
public enum FormStatus {
    ACTIVE,
    INACTIVE
}
