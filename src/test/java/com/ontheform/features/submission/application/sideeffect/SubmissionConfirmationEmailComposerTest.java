package com.ontheform.features.submission.application.sideeffect;

import com.ontheform.shared.email.EmailMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SubmissionConfirmationEmailComposer")
class SubmissionConfirmationEmailComposerTest {

    private final SubmissionConfirmationEmailComposer composer =
            new SubmissionConfirmationEmailComposer("https://forms.example.com/");

    @Test
    @DisplayName("escapes the title and omits banner and QR sections when absent")
    void plainMessage() {
        EmailMessage message = composer.compose("ada@example.com", "Q&A <Night>", null, UUID.randomUUID(), null);

        assertThat(message.subject()).isEqualTo("Form Submission Confirmation - Q&A <Night>");
        assertThat(message.htmlBody())
                .contains("Q&amp;A &lt;Night&gt;")
                .doesNotContain("{formTitle}", "{bannerSection}", "{qrSection}", "cid:submission-qr", "Form Banner");
        assertThat(message.hasAttachments()).isFalse();
    }

    @Test
    @DisplayName("relative banner URLs are resolved against the backend URL")
    void relativeBanner_resolved() {
        EmailMessage message = composer.compose("ada@example.com", "Open Day", "/uploads/banner.png",
                UUID.randomUUID(), null);

        assertThat(message.htmlBody()).contains("src=\"https://forms.example.com/uploads/banner.png\"");
    }

    @Test
    @DisplayName("absolute banner URLs are kept")
    void absoluteBanner_kept() {
        assertThat(composer.absoluteUrl("https://cdn.example.com/b.png")).isEqualTo("https://cdn.example.com/b.png");
        assertThat(composer.absoluteUrl("uploads/b.png")).isEqualTo("https://forms.example.com/uploads/b.png");
    }

    @Test
    @DisplayName("QR image is attached inline and referenced by content id")
    void qrAttachedInline() {
        UUID id = UUID.randomUUID();

        EmailMessage message = composer.compose("ada@example.com", "Open Day", null, id, new byte[]{1});

        assertThat(message.htmlBody()).contains("cid:submission-qr");
        assertThat(message.inlineAttachments()).singleElement().satisfies(attachment -> {
            assertThat(attachment.contentId()).isEqualTo("submission-qr");
            assertThat(attachment.filename()).isEqualTo("qr-" + id + ".png");
            assertThat(attachment.contentType()).isEqualTo("image/png");
        });
    }
}
