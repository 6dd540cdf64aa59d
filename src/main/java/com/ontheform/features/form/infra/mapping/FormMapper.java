package com.ontheform.features.form.infra.mapping;

import com.ontheform.features.form.api.dto.CreateFormRequest;
import com.ontheform.features.form.api.dto.FormDto;
import com.ontheform.features.form.api.dto.FormSummaryDto;
import com.ontheform.features.form.api.dto.PublicFormDto;
import com.ontheform.features.form.api.dto.TermsDto;
import com.ontheform.features.form.api.dto.UpdateFormRequest;
import com.ontheform.features.form.domain.model.Form;
import com.ontheform.features.form.domain.model.TermsSettings;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class FormMapper {

    public Form toEntity(CreateFormRequest request) {
        Form form = new Form();
        form.setTitle(request.title().trim());
        form.setDescription(trimToNull(request.description()));
        form.setFields(new ArrayList<>(request.fields()));
        form.setBannerUrl(trimToNull(request.bannerUrl()));
        form.setTerms(toTerms(request.terms()));
        form.setActive(true);
        return form;
    }

    public void applyUpdates(Form form, UpdateFormRequest request) {
        form.setTitle(request.title().trim());
        form.setDescription(trimToNull(request.description()));
        form.setFields(new ArrayList<>(request.fields()));
        form.setBannerUrl(trimToNull(request.bannerUrl()));
        form.setTerms(toTerms(request.terms()));
        if (request.active() != null) {
            form.setActive(request.active());
        }
    }

    public FormDto toDto(Form form) {
        return new FormDto(
                form.getId(),
                form.getTitle(),
                form.getDescription(),
                List.copyOf(form.getFields()),
                form.isActive(),
                form.isDisplayed(),
                form.getSubmissionCount(),
                form.getUniqueConstraintType(),
                form.getUniqueConstraintField(),
                form.getBannerUrl(),
                form.isShowQrCode(),
                form.isSendEmailNotification(),
                toTermsDto(form.getTerms()),
                form.getOwnerId(),
                form.getCreatedAt(),
                form.getUpdatedAt()
        );
    }

    public FormSummaryDto toSummary(Form form) {
        return new FormSummaryDto(
                form.getId(),
                form.getTitle(),
                form.getDescription(),
                form.isActive(),
                form.isDisplayed(),
                form.getSubmissionCount(),
                form.getFields().size(),
                form.getCreatedAt(),
                form.getUpdatedAt()
        );
    }

    public PublicFormDto toPublicDto(Form form) {
        return new PublicFormDto(
                form.getId(),
                form.getTitle(),
                form.getDescription(),
                List.copyOf(form.getFields()),
                form.getBannerUrl(),
                toTermsDto(form.getTerms())
        );
    }

    private TermsSettings toTerms(TermsDto dto) {
        if (dto == null) {
            return new TermsSettings();
        }
        return new TermsSettings(
                dto.showTermsCheckbox(),
                trimToNull(dto.termsText()),
                trimToNull(dto.termsSecondaryText()),
                trimToNull(dto.termsLinkUrl()),
                trimToNull(dto.termsLinkText())
        );
    }

    private TermsDto toTermsDto(TermsSettings terms) {
        if (terms == null) {
            return new TermsDto(false, null, null, null, null);
        }
        return new TermsDto(
                terms.isShowTermsCheckbox(),
                terms.getTermsText(),
                terms.getTermsSecondaryText(),
                terms.getTermsLinkUrl(),
                terms.getTermsLinkText()
        );
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
