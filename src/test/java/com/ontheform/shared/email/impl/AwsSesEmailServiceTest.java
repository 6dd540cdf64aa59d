package com.ontheform.shared.email.impl;

import com.ontheform.shared.email.EmailAttachment;
import com.ontheform.shared.email.EmailDeliveryException;
import com.ontheform.shared.email.EmailDeliveryResult;
import com.ontheform.shared.email.EmailMessage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.model.SendEmailRequest;
import software.amazon.awssdk.services.sesv2.model.SendEmailResponse;
import software.amazon.awssdk.services.sesv2.model.SesV2Exception;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AwsSesEmailService")
class AwsSesEmailServiceTest {

    @Mock
    private SesV2Client sesClient;

    private SimpleMeterRegistry meterRegistry;
    private AwsSesEmailService emailService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        emailService = new AwsSesEmailService(sesClient, meterRegistry);
        ReflectionTestUtils.setField(emailService, "fromEmail", "forms@example.com");
        ReflectionTestUtils.setField(emailService, "fromName", "OnTheForm");
        ReflectionTestUtils.setField(emailService, "configurationSetName", "tracking");
        emailService.initialize();
    }

    @Test
    @DisplayName("message without attachments goes out as simple content")
    void simpleContent() {
        when(sesClient.sendEmail(any(SendEmailRequest.class)))
                .thenReturn(SendEmailResponse.builder().messageId("ses-1").build());

        EmailDeliveryResult result = emailService.send(
                new EmailMessage("ada@example.com", "Hello", "<p>Hi</p>", List.of()));

        assertThat(result).isEqualTo(EmailDeliveryResult.delivered("ses", "ses-1"));
        ArgumentCaptor<SendEmailRequest> captor = ArgumentCaptor.forClass(SendEmailRequest.class);
        verify(sesClient).sendEmail(captor.capture());
        SendEmailRequest request = captor.getValue();
        assertThat(request.fromEmailAddress()).isEqualTo("forms@example.com");
        assertThat(request.destination().toAddresses()).containsExactly("ada@example.com");
        assertThat(request.configurationSetName()).isEqualTo("tracking");
        assertThat(request.content().simple().subject().data()).isEqualTo("Hello");
        assertThat(request.content().simple().body().html().data()).isEqualTo("<p>Hi</p>");
        assertThat(meterRegistry.counter("email.sent", "provider", "ses").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("inline QR image switches to a raw MIME message")
    void inlineAttachment_rawContent() {
        when(sesClient.sendEmail(any(SendEmailRequest.class)))
                .thenReturn(SendEmailResponse.builder().messageId("ses-2").build());

        emailService.send(new EmailMessage("ada@example.com", "Hello", "<img src=\"cid:submission-qr\"/>",
                List.of(new EmailAttachment("submission-qr", "qr.png", "image/png", new byte[]{1, 2, 3}))));

        ArgumentCaptor<SendEmailRequest> captor = ArgumentCaptor.forClass(SendEmailRequest.class);
        verify(sesClient).sendEmail(captor.capture());
        assertThat(captor.getValue().content().simple()).isNull();
        String mime = captor.getValue().content().raw().data().asString(StandardCharsets.UTF_8);
        assertThat(mime).contains("Content-ID: <submission-qr>").contains("multipart/related");
    }

    @Test
    @DisplayName("SES rejection becomes a delivery exception and is counted")
    void rejection_counted() {
        SesV2Exception rejected = (SesV2Exception) SesV2Exception.builder()
                .statusCode(400)
                .awsErrorDetails(AwsErrorDetails.builder().errorMessage("Email address is not verified").build())
                .message("Email address is not verified")
                .build();
        when(sesClient.sendEmail(any(SendEmailRequest.class))).thenThrow(rejected);

        assertThatThrownBy(() -> emailService.send(new EmailMessage("ada@example.com", "Hello", "<p>Hi</p>", null)))
                .isInstanceOf(EmailDeliveryException.class)
                .hasCause(rejected);
        assertThat(meterRegistry.counter("email.failed", "provider", "ses", "reason", "client-400").count())
                .isEqualTo(1.0);
    }
}
