package com.ontheform.shared.email.impl;

import com.ontheform.shared.email.EmailAttachment;
import com.ontheform.shared.email.EmailMessage;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;

/**
 * Fills a {@link MimeMessage} from an {@link EmailMessage}; shared by the SMTP and raw SES paths.
 */
final class MimeMessages {

    private MimeMessages() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    static void populate(MimeMessage mime, String from, String fromName, EmailMessage message)
            throws MessagingException, UnsupportedEncodingException {
        MimeMessageHelper helper = new MimeMessageHelper(
                mime,
                message.hasAttachments() ? MimeMessageHelper.MULTIPART_MODE_RELATED : MimeMessageHelper.MULTIPART_MODE_NO,
                StandardCharsets.UTF_8.name()
        );
        if (fromName != null && !fromName.isBlank()) {
            helper.setFrom(from, fromName);
        } else {
            helper.setFrom(from);
        }
        helper.setTo(message.to());
        helper.setSubject(message.subject());
        helper.setText(message.htmlBody(), true);

        // inline parts must be added after the body
        for (EmailAttachment attachment : message.inlineAttachments()) {
            helper.addInline(
                    attachment.contentId(),
                    new ByteArrayResource(attachment.content()),
                    attachment.contentType()
            );
        }
    }
}
