package com.ontheform.shared.email.impl;

import com.ontheform.shared.email.EmailAddresses;
import com.ontheform.shared.email.EmailDeliveryException;
import com.ontheform.shared.email.EmailDeliveryResult;
import com.ontheform.shared.email.EmailMessage;
import com.ontheform.shared.email.EmailService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.model.Body;
import software.amazon.awssdk.services.sesv2.model.Content;
import software.amazon.awssdk.services.sesv2.model.Destination;
import software.amazon.awssdk.services.sesv2.model.EmailContent;
import software.amazon.awssdk.services.sesv2.model.Message;
import software.amazon.awssdk.services.sesv2.model.RawMessage;
import software.amazon.awssdk.services.sesv2.model.SendEmailRequest;
import software.amazon.awssdk.services.sesv2.model.SendEmailResponse;
import software.amazon.awssdk.services.sesv2.model.SesV2Exception;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.Properties;

/**
 * AWS SES delivery over the SESv2 HTTPS API.
 *
 * <p>Messages without inline attachments go out as SES "simple" content. Messages carrying inline
 * images (the QR code) are rendered to a MIME document and sent as raw content.
 *
 * <p>Credentials come from {@code AwsSesConfig}; the sender must be a verified SES identity.
 */
@Slf4j
public class AwsSesEmailService implements EmailService {

    private static final String CHARSET = "UTF-8";

    private final SesV2Client sesClient;
    private final MeterRegistry meterRegistry;

    @Value("${app.email.from:noreply@example.com}")
    private String fromEmail;

    @Value("${app.email.from-name:OnTheForm}")
    private String fromName;

    @Value("${app.email.ses.configuration-set:#{null}}")
    private String configurationSetName;

    public AwsSesEmailService(SesV2Client sesClient, MeterRegistry meterRegistry) {
        this.sesClient = sesClient;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void initialize() {
        if (fromEmail == null || fromEmail.isBlank() || fromEmail.equals("noreply@example.com")) {
            log.warn("AWS SES Email Service: app.email.from is not configured or uses the default placeholder. " +
                    "Ensure it is set to a verified identity in SES.");
        } else {
            log.info("AWS SES Email Service initialized with sender: {}", fromEmail);
        }
    }

    @Override
    public EmailDeliveryResult send(EmailMessage message) {
        String maskedTo = EmailAddresses.mask(message.to());
        try {
            SendEmailRequest request = message.hasAttachments()
                    ? buildRawRequest(message)
                    : buildSimpleRequest(message);

            SendEmailResponse response = sesClient.sendEmail(request);
            log.info("Email sent to: {} | SES MessageId: {}", maskedTo, response.messageId());
            recordSuccess();
            return EmailDeliveryResult.delivered(providerName(), response.messageId());
        } catch (SesV2Exception e) {
            handleSesException(maskedTo, e);
            throw new EmailDeliveryException("SES rejected the message (status " + e.statusCode() + ")", e);
        } catch (EmailDeliveryException e) {
            recordFailure("mime");
            throw e;
        } catch (Exception e) {
            log.error("Unexpected error sending email to: {}", maskedTo, e);
            recordFailure("unexpected");
            throw new EmailDeliveryException("SES delivery failed", e);
        }
    }

    @Override
    public String providerName() {
        return "ses";
    }

    SendEmailRequest buildSimpleRequest(EmailMessage message) {
        EmailContent content = EmailContent.builder()
                .simple(Message.builder()
                        .subject(Content.builder().data(message.subject()).charset(CHARSET).build())
                        .body(Body.builder()
                                .html(Content.builder().data(message.htmlBody()).charset(CHARSET).build())
                                .build())
                        .build())
                .build();
        return baseRequest(message).content(content).build();
    }

    SendEmailRequest buildRawRequest(EmailMessage message) {
        RawMessage raw = RawMessage.builder()
                .data(SdkBytes.fromByteArray(renderMime(message)))
                .build();
        return baseRequest(message)
                .content(EmailContent.builder().raw(raw).build())
                .build();
    }

    private SendEmailRequest.Builder baseRequest(EmailMessage message) {
        SendEmailRequest.Builder builder = SendEmailRequest.builder()
                .fromEmailAddress(fromEmail)
                .destination(Destination.builder().toAddresses(message.to()).build());

        // configuration set must already exist in SES or the call fails
        if (configurationSetName != null && !configurationSetName.isBlank()) {
            builder.configurationSetName(configurationSetName);
        }
        return builder;
    }

    private byte[] renderMime(EmailMessage message) {
        try {
            MimeMessage mime = new MimeMessage(Session.getInstance(new Properties()));
            MimeMessages.populate(mime, fromEmail, fromName, message);
            mime.saveChanges();
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            mime.writeTo(out);
            return out.toByteArray();
        } catch (MessagingException | IOException e) {
            throw new EmailDeliveryException("Failed to render MIME message", e);
        }
    }

    /**
     * 4xx are logged as warnings (bad recipient, suppressed address, throttling); 5xx as errors.
     * Recipient addresses are always masked.
     */
    private void handleSesException(String maskedTo, SesV2Exception e) {
        String awsMessage = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
        if (e.statusCode() >= 400 && e.statusCode() < 500) {
            log.warn("Failed to send email to: {} | SES Error: {} (status: {})", maskedTo, awsMessage, e.statusCode());
            recordFailure("client-" + e.statusCode());
        } else if (e.statusCode() >= 500) {
            log.error("SES service error sending email to: {} | Error: {} (status: {})", maskedTo, awsMessage, e.statusCode());
            recordFailure("server-" + e.statusCode());
        } else {
            log.error("Failed to send email to: {} | SES Error: {}", maskedTo, awsMessage, e);
            recordFailure("unknown");
        }
    }

    private void recordSuccess() {
        if (meterRegistry != null) {
            meterRegistry.counter("email.sent", "provider", providerName()).increment();
        }
    }

    private void recordFailure(String reason) {
        if (meterRegistry != null) {
            meterRegistry.counter("email.failed", "provider", providerName(),
                    "reason", reason.toLowerCase(Locale.ENGLISH)).increment();
        }
    }
}
