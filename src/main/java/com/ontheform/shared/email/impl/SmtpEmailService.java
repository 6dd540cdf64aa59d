package com.ontheform.shared.email.impl;

import com.ontheform.shared.email.EmailAddresses;
import com.ontheform.shared.email.EmailDeliveryException;
import com.ontheform.shared.email.EmailDeliveryResult;
import com.ontheform.shared.email.EmailMessage;
import com.ontheform.shared.email.EmailService;
import jakarta.annotation.PostConstruct;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

import java.io.UnsupportedEncodingException;

/**
 * SMTP delivery through Spring's {@link JavaMailSender}. Activated when {@code app.email.provider=smtp}.
 */
@Slf4j
@Service
@Primary
@ConditionalOnProperty(name = "app.email.provider", havingValue = "smtp")
@RequiredArgsConstructor
public class SmtpEmailService implements EmailService {

    private final JavaMailSender mailSender;

    @Value("${app.email.from:${spring.mail.username:}}")
    private String fromEmail;

    @Value("${app.email.from-name:OnTheForm}")
    private String fromName;

    @PostConstruct
    void verifyEmailConfiguration() {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("SMTP email provider active but no sender configured (app.email.from / spring.mail.username)");
        } else {
            log.info("SMTP email service enabled with sender: {}", fromEmail);
        }
    }

    @Override
    public EmailDeliveryResult send(EmailMessage message) {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled - skipping email to: {}", EmailAddresses.mask(message.to()));
            throw new EmailDeliveryException("Email sender is not configured");
        }

        try {
            MimeMessage mime = mailSender.createMimeMessage();
            MimeMessages.populate(mime, fromEmail, fromName, message);
            mailSender.send(mime);

            String messageId = mime.getMessageID();
            log.info("Email sent via SMTP to: {} | MessageId: {}", EmailAddresses.mask(message.to()), messageId);
            return EmailDeliveryResult.delivered(providerName(), messageId);
        } catch (MessagingException | UnsupportedEncodingException | MailException e) {
            log.error("Failed to send email via SMTP to: {}", EmailAddresses.mask(message.to()), e);
            throw new EmailDeliveryException("SMTP delivery failed", e);
        }
    }

    @Override
    public String providerName() {
        return "smtp";
    }
}
