package com.ontheform.features.submission.application.sideeffect;

import com.ontheform.shared.email.EmailAttachment;
import com.ontheform.shared.email.EmailMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Builds the HTML confirmation sent to a submitter from {@code email/submission-confirmation.html}.
 */
@Component
@Slf4j
public class SubmissionConfirmationEmailComposer {

    static final String TEMPLATE_PATH = "email/submission-confirmation.html";
    static final String QR_CONTENT_ID = "submission-qr";
    static final String SUBJECT_PREFIX = "Form Submission Confirmation - ";

    private final String backendBaseUrl;
    private volatile String template;

    public SubmissionConfirmationEmailComposer(@Value("${app.backend.base-url:http://localhost:8080}") String backendBaseUrl) {
        this.backendBaseUrl = stripTrailingSlash(backendBaseUrl);
    }

    /**
     * @param qrPng QR image to embed inline, or {@code null} to omit the QR section
     */
    public EmailMessage compose(String recipient, String formTitle, String bannerUrl, UUID submissionId, byte[] qrPng) {
        String title = HtmlUtils.htmlEscape(formTitle);
        String html = loadTemplate()
                .replace("{formTitle}", title)
                .replace("{bannerSection}", bannerSection(bannerUrl))
                .replace("{qrSection}", qrPng != null ? qrSection(title) : "");

        List<EmailAttachment> attachments = qrPng != null
                ? List.of(new EmailAttachment(QR_CONTENT_ID, "qr-" + submissionId + ".png", "image/png", qrPng))
                : List.of();
        return new EmailMessage(recipient, SUBJECT_PREFIX + formTitle, html, attachments);
    }

    String absoluteUrl(String url) {
        if (url.startsWith("http://") || url.startsWith("https://")) {
            return url;
        }
        return backendBaseUrl + (url.startsWith("/") ? url : "/" + url);
    }

    private String bannerSection(String bannerUrl) {
        if (bannerUrl == null || bannerUrl.isBlank()) {
            return "";
        }
        return """
                <div style="text-align: center; margin-bottom: 20px;">
                  <img src="%s" alt="Form Banner" style="max-width: 100%%; height: auto; border-radius: 8px;" />
                </div>
                """.formatted(HtmlUtils.htmlEscape(absoluteUrl(bannerUrl.trim())));
    }

    private String qrSection(String escapedTitle) {
        return """
                <div style="text-align: center; margin: 20px 0;">
                  <h3 style="color: #374151; margin-bottom: 10px;">%s</h3>
                  <div style="background-color: #ffffff; padding: 20px; border-radius: 8px; border: 1px solid #e5e7eb; display: inline-block;">
                    <img src="cid:%s" alt="Submission QR Code" style="display: block; margin: 0 auto; max-width: 200px; height: auto;" />
                  </div>
                  <p style="color: #6b7280; font-size: 14px; margin-top: 15px;">Show this QR code to identify your submission</p>
                </div>
                """.formatted(escapedTitle, QR_CONTENT_ID);
    }

    private String loadTemplate() {
        String cached = template;
        if (cached == null) {
            try (InputStream in = new ClassPathResource(TEMPLATE_PATH).getInputStream()) {
                cached = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                template = cached;
            } catch (IOException e) {
                log.error("Failed to load email template: {}", TEMPLATE_PATH, e);
                throw new UncheckedIOException(e);
            }
        }
        return cached;
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
