package com.ontheform.shared.email;

import java.util.List;
import java.util.Objects;

/**
 * An HTML email with optional inline attachments referenced from the body as {@code cid:<contentId>}.
 */
public record EmailMessage(
        String to,
        String subject,
        String htmlBody,
        List<EmailAttachment> inlineAttachments
) {

    public EmailMessage {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(htmlBody, "htmlBody");
        inlineAttachments = inlineAttachments == null ? List.of() : List.copyOf(inlineAttachments);
    }

    public boolean hasAttachments() {
        return !inlineAttachments.isEmpty();
    }
}
