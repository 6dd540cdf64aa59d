package com.ontheform.features.submission.application.sideeffect;

/**
 * What the post-submission hooks produced. Absent values mean the hook did not run.
 *
 * @param qrCode     PNG data URL of the submission QR code
 * @param emailSent  whether the confirmation email was accepted by the provider
 * @param emailError submitter-facing message when the email could not be sent
 */
public record SideEffectReport(String qrCode, Boolean emailSent, String emailError) {

    public static SideEffectReport empty() {
        return new SideEffectReport(null, null, null);
    }
}
