package com.ontheform.shared.email.impl;

import com.ontheform.shared.email.EmailAttachment;
import com.ontheform.shared.email.EmailDeliveryException;
import com.ontheform.shared.email.EmailDeliveryResult;
import com.ontheform.shared.email.EmailMessage;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SmtpEmailService")
class SmtpEmailServiceTest {

    @Mock
    private JavaMailSender mailSender;

    private SmtpEmailService emailService;

    @BeforeEach
    void setUp() {
        emailService = new SmtpEmailService(mailSender);
        ReflectionTestUtils.setField(emailService, "fromEmail", "forms@example.com");
        ReflectionTestUtils.setField(emailService, "fromName", "OnTheForm");
    }

    @Test
    @DisplayName("sends an HTML message with the inline QR part")
    void send_htmlWithInlinePart() throws Exception {
        when(mailSender.createMimeMessage()).thenReturn(new MimeMessage(Session.getInstance(new Properties())));

        EmailDeliveryResult result = emailService.send(new EmailMessage("ada@example.com", "Hello",
                "<img src=\"cid:submission-qr\"/>",
                List.of(new EmailAttachment("submission-qr", "qr.png", "image/png", new byte[]{1, 2}))));

        assertThat(result.provider()).isEqualTo("smtp");
        ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender).send(captor.capture());
        MimeMessage sent = captor.getValue();
        assertThat(sent.getSubject()).isEqualTo("Hello");
        assertThat(sent.getAllRecipients()).extracting(Object::toString).containsExactly("ada@example.com");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        sent.saveChanges();
        sent.writeTo(out);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Content-ID: <submission-qr>");
    }

    @Test
    @DisplayName("unconfigured sender: refuses to send")
    void unconfigured_refuses() {
        ReflectionTestUtils.setField(emailService, "fromEmail", "");

        assertThatThrownBy(() -> emailService.send(new EmailMessage("ada@example.com", "Hello", "<p/>", null)))
                .isInstanceOf(EmailDeliveryException.class);
        verify(mailSender, never()).send(any(MimeMessage.class));
    }

    @Test
    @DisplayName("transport failure becomes a delivery exception")
    void transportFailure_wrapped() {
        when(mailSender.createMimeMessage()).thenReturn(new MimeMessage(Session.getInstance(new Properties())));
        doThrow(new MailSendException("connection refused")).when(mailSender).send(any(MimeMessage.class));

        assertThatThrownBy(() -> emailService.send(new EmailMessage("ada@example.com", "Hello", "<p/>", null)))
                .isInstanceOf(EmailDeliveryException.class)
                .hasMessage("SMTP delivery failed");
    }
}
