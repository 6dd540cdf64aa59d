package com.ontheform.features.submission.application;

import com.ontheform.features.form.domain.model.Form;
import com.ontheform.features.submission.domain.model.value.FieldValue;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Derives the value stored in {@code form_submissions.uniqueness_key}.
 *
 * <p>IP keys look like {@code ip:203.0.113.7}; field keys look like
 * {@code field:<fieldId>:<sha-256 hex of the canonical value>}, so the key has a bounded
 * length whatever the submitter typed. Field values are compared after trimming.
 */
public final class UniquenessKeys {

    private static final String IP_PREFIX = "ip:";
    private static final String FIELD_PREFIX = "field:";

    private UniquenessKeys() {
    }

    /**
     * @return the key for the form's current constraint, or {@code null} when the form accepts
     * duplicates or the constrained value is missing
     */
    public static String derive(Form form, String clientIp, Map<String, FieldValue> values) {
        switch (form.getUniqueConstraintType()) {
            case IP:
                return clientIp == null || clientIp.isBlank() ? null : forIp(clientIp);
            case FIELD:
                String fieldId = form.getUniqueConstraintField();
                FieldValue value = fieldId != null ? values.get(fieldId) : null;
                return value == null ? null : forField(fieldId, value.asText());
            default:
                return null;
        }
    }

    public static String forIp(String clientIp) {
        return IP_PREFIX + clientIp.trim();
    }

    public static String forField(String fieldId, String value) {
        return FIELD_PREFIX + fieldId + ":" + sha256Hex(value.trim());
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
