package com.ontheform.features.submission.application.sideeffect;

import com.ontheform.features.form.domain.model.Form;
import com.ontheform.features.submission.domain.model.FormSubmission;
import lombok.Getter;

/**
 * State shared by the hooks of one submission. Hooks run sequentially on the request thread,
 * so the mutable fields need no synchronisation.
 */
@Getter
public class SideEffectContext {

    static final String EMAIL_FAILURE_MESSAGE = "Failed to send confirmation email";

    private final Form form;
    private final FormSubmission submission;

    private byte[] qrPng;
    private String qrDataUrl;
    private Boolean emailSent;
    private String emailError;

    public SideEffectContext(Form form, FormSubmission submission) {
        this.form = form;
        this.submission = submission;
    }

    void qrRendered(byte[] png, String dataUrl) {
        this.qrPng = png;
        this.qrDataUrl = dataUrl;
    }

    void emailDelivered() {
        this.emailSent = true;
        this.emailError = null;
    }

    void emailFailed() {
        this.emailSent = false;
        this.emailError = EMAIL_FAILURE_MESSAGE;
    }

    SideEffectReport toReport() {
        return new SideEffectReport(qrDataUrl, emailSent, emailError);
    }
}
