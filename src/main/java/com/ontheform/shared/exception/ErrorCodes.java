package com.ontheform.shared.exception;

/**
 * Machine-readable codes exposed as the {@code errorCode} property of problem responses.
 */
public final class ErrorCodes {

    public static final String RESOURCE_NOT_FOUND = "RESOURCE_NOT_FOUND";
    public static final String FORM_NOT_FOUND = "FORM_NOT_FOUND";
    public static final String SUBMISSION_NOT_FOUND = "SUBMISSION_NOT_FOUND";
    public static final String USER_NOT_FOUND = "USER_NOT_FOUND";

    public static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    public static final String FORM_VALIDATION_ERROR = "FORM_VALIDATION_ERROR";
    public static final String UNIQUE_FIELD_REQUIRED = "UNIQUE_FIELD_REQUIRED";
    public static final String INVALID_EMAIL_FORMAT = "INVALID_EMAIL_FORMAT";
    public static final String DUPLICATE_FIELD_IDS = "DUPLICATE_FIELD_IDS";
    public static final String FIELD_REQUIRED = "FIELD_REQUIRED";
    public static final String FIELD_NOT_FOUND = "FIELD_NOT_FOUND";
    public static final String INVALID_FIELD_SCHEMA = "INVALID_FIELD_SCHEMA";

    public static final String DUPLICATE_SUBMISSION = "DUPLICATE_SUBMISSION";
    public static final String CLIENT_IP_UNKNOWN = "CLIENT_IP_UNKNOWN";

    public static final String EMAIL_EXISTS = "EMAIL_EXISTS";
    public static final String NO_UPDATE_FIELDS = "NO_UPDATE_FIELDS";
    public static final String CANNOT_DELETE_SELF = "CANNOT_DELETE_SELF";
    public static final String USER_HAS_FORMS = "USER_HAS_FORMS";
    public static final String INVALID_CURRENT_PASSWORD = "INVALID_CURRENT_PASSWORD";
    public static final String PASSWORD_MISMATCH = "PASSWORD_MISMATCH";

    private ErrorCodes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
