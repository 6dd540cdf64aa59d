package com.ontheform.features.user.domain.model;

public enum UserRole {
    /** Sees and manages every form. */
    SUPER_ADMIN,
    /** Manages only the forms they created. */
    ADMIN;

    public String authority() {
        return "ROLE_" + name();
    }
}
