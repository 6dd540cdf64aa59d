package com.ontheform.features.form.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Optional consent checkbox rendered above the submit button.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TermsSettings {

    @Column(name = "show_terms_checkbox", nullable = false)
    private boolean showTermsCheckbox;

    @Column(name = "terms_text", columnDefinition = "TEXT")
    private String termsText;

    @Column(name = "terms_secondary_text", columnDefinition = "TEXT")
    private String termsSecondaryText;

    @Column(name = "terms_link_url", length = 1024)
    private String termsLinkUrl;

    @Column(name = "terms_link_text", length = 255)
    private String termsLinkText;

    public TermsSettings copy() {
        return new TermsSettings(showTermsCheckbox, termsText, termsSecondaryText, termsLinkUrl, termsLinkText);
    }
}
