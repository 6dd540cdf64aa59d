package com.ontheform.shared.email;

public record EmailAttachment(
        String contentId,
        String filename,
        String contentType,
        byte[] content
) {
}
