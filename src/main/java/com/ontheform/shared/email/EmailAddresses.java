package com.ontheform.shared.email;

/**
 * Log-safe rendering of email addresses.
 */
public final class EmailAddresses {

    private EmailAddresses() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String mask(String email) {
        if (email == null || email.isEmpty()) {
            return "***";
        }
        int atIndex = email.indexOf('@');
        if (atIndex <= 1) {
            return "***@" + (atIndex > 0 ? email.substring(atIndex + 1) : "***");
        }
        return email.charAt(0) + "***@" + email.substring(atIndex + 1);
    }
}
