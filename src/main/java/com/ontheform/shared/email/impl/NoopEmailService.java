package com.ontheform.shared.email.impl;

import com.ontheform.shared.email.EmailAddresses;
import com.ontheform.shared.email.EmailDeliveryResult;
import com.ontheform.shared.email.EmailMessage;
import com.ontheform.shared.email.EmailService;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Logs instead of sending. Default provider for local development and tests.
 */
@Slf4j
public class NoopEmailService implements EmailService {

    public NoopEmailService() {
        log.info("NoopEmailService initialized - emails will be logged but not sent");
    }

    @Override
    public EmailDeliveryResult send(EmailMessage message) {
        String messageId = "noop-" + UUID.randomUUID();
        log.info("[NOOP] Would send email to: {} with subject: {} ({} inline attachment(s))",
                EmailAddresses.mask(message.to()), message.subject(), message.inlineAttachments().size());
        return EmailDeliveryResult.delivered(providerName(), messageId);
    }

    @Override
    public String providerName() {
        return "noop";
    }
}
