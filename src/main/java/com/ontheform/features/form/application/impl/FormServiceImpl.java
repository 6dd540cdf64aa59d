package com.ontheform.features.form.application.impl;

import com.ontheform.features.form.api.dto.CreateFormRequest;
import com.ontheform.features.form.api.dto.FormDto;
import com.ontheform.features.form.api.dto.FormSettingsRequest;
import com.ontheform.features.form.api.dto.FormSummaryDto;
import com.ontheform.features.form.api.dto.PublicFormDto;
import com.ontheform.features.form.api.dto.UpdateFormRequest;
import com.ontheform.features.form.application.FormSchemaValidator;
import com.ontheform.features.form.application.FormService;
import com.ontheform.features.form.domain.event.UniqueConstraintChangedEvent;
import com.ontheform.features.form.domain.model.Form;
import com.ontheform.features.form.domain.model.FormField;
import com.ontheform.features.form.domain.model.FormStatus;
import com.ontheform.features.form.domain.model.UniqueConstraintType;
import com.ontheform.features.form.domain.repository.FormRepository;
import com.ontheform.features.form.infra.mapping.FormMapper;
import com.ontheform.features.user.domain.model.User;
import com.ontheform.shared.exception.ErrorCodes;
import com.ontheform.shared.exception.ResourceNotFoundException;
import com.ontheform.shared.security.AccessPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class FormServiceImpl implements FormService {

    private static final String COPY_SUFFIX = " (Copy)";

    private final FormRepository formRepository;
    private final FormMapper formMapper;
    private final FormSchemaValidator formSchemaValidator;
    private final AccessPolicy accessPolicy;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional(readOnly = true)
    public Page<FormSummaryDto> listForms(String username, String search, FormStatus status, Pageable pageable) {
        User user = accessPolicy.requireUser(username);
        Boolean active = status == null ? null : status == FormStatus.ACTIVE;
        String term = search == null || search.isBlank() ? null : search.trim();
        return formRepository.findAllByFilters(accessPolicy.ownerScope(user), active, term, pageable)
                .map(formMapper::toSummary);
    }

    @Override
    @Transactional(readOnly = true)
    public FormDto getForm(String username, UUID formId) {
        return formMapper.toDto(loadOwnedForm(username, formId));
    }

    @Override
    public FormDto createForm(String username, CreateFormRequest request) {
        User user = accessPolicy.requireUser(username);
        formSchemaValidator.validateFields(request.fields());

        Form form = formMapper.toEntity(request);
        form.setCreatedBy(user);
        Form saved = formRepository.save(form);
        log.info("Form {} created by user {}", saved.getId(), user.getId());
        return formMapper.toDto(saved);
    }

    @Override
    public FormDto updateForm(String username, UUID formId, UpdateFormRequest request) {
        Form form = loadOwnedForm(username, formId);
        formSchemaValidator.validateFields(request.fields());
        formSchemaValidator.validateUniqueConstraint(
                form.getUniqueConstraintType(), form.getUniqueConstraintField(), request.fields());

        boolean rekey = constrainedFieldChanged(form, request.fields());
        formMapper.applyUpdates(form, request);
        Form saved = formRepository.saveAndFlush(form);
        if (rekey) {
            log.info("Form {} unique field {} redefined, re-keying submissions", formId, form.getUniqueConstraintField());
            eventPublisher.publishEvent(new UniqueConstraintChangedEvent(formId));
        }
        return formMapper.toDto(saved);
    }

    /**
     * Stored keys depend on how the constrained field parses its answers, so a change to its
     * type or accepted values invalidates them.
     */
    static boolean constrainedFieldChanged(Form form, List<FormField> newFields) {
        if (form.getUniqueConstraintType() != UniqueConstraintType.FIELD) {
            return false;
        }
        String fieldId = form.getUniqueConstraintField();
        Optional<FormField> before = form.findField(fieldId);
        Optional<FormField> after = newFields.stream().filter(field -> field.id().equals(fieldId)).findFirst();
        if (before.isEmpty() || after.isEmpty()) {
            return before.isPresent() != after.isPresent();
        }
        FormField old = before.get();
        FormField updated = after.get();
        return old.type() != updated.type()
                || !old.optionList().equals(updated.optionList())
                || old.allowOther() != updated.allowOther()
                || !Objects.equals(old.accept(), updated.accept())
                || !Objects.equals(old.maxFileSize(), updated.maxFileSize());
    }

    @Override
    public FormDto updateSettings(String username, UUID formId, FormSettingsRequest request) {
        Form form = loadOwnedForm(username, formId);

        UniqueConstraintType type = request.uniqueConstraintType() != null
                ? request.uniqueConstraintType()
                : form.getUniqueConstraintType();
        String field = type == UniqueConstraintType.FIELD
                ? (request.uniqueConstraintField() != null ? request.uniqueConstraintField().trim() : form.getUniqueConstraintField())
                : null;
        formSchemaValidator.validateUniqueConstraint(type, field, form.getFields());

        boolean constraintChanged = type != form.getUniqueConstraintType()
                || !Objects.equals(field, form.getUniqueConstraintField());

        form.setUniqueConstraintType(type);
        form.setUniqueConstraintField(field);
        if (request.showQrCode() != null) {
            form.setShowQrCode(request.showQrCode());
        }
        if (request.sendEmailNotification() != null) {
            form.setSendEmailNotification(request.sendEmailNotification());
        }

        Form saved = formRepository.saveAndFlush(form);
        if (constraintChanged) {
            log.info("Form {} unique constraint changed to {} ({})", formId, type, field);
            eventPublisher.publishEvent(new UniqueConstraintChangedEvent(formId));
        }
        return formMapper.toDto(saved);
    }

    @Override
    public FormDto toggleActive(String username, UUID formId) {
        Form form = loadOwnedForm(username, formId);
        form.setActive(!form.isActive());
        return formMapper.toDto(formRepository.save(form));
    }

    @Override
    public FormDto duplicateForm(String username, UUID formId) {
        Form source = loadOwnedForm(username, formId);
        User user = accessPolicy.requireUser(username);

        Form copy = new Form();
        copy.setTitle(source.getTitle() + COPY_SUFFIX);
        copy.setDescription(source.getDescription());
        copy.setFields(new ArrayList<>(source.getFields()));
        copy.setBannerUrl(source.getBannerUrl());
        copy.setTerms(source.getTerms() != null ? source.getTerms().copy() : null);
        copy.setUniqueConstraintType(source.getUniqueConstraintType());
        copy.setUniqueConstraintField(source.getUniqueConstraintField());
        copy.setShowQrCode(source.isShowQrCode());
        copy.setSendEmailNotification(source.isSendEmailNotification());
        copy.setActive(false);
        copy.setCreatedBy(user);

        Form saved = formRepository.save(copy);
        log.info("Form {} duplicated as {}", formId, saved.getId());
        return formMapper.toDto(saved);
    }

    @Override
    public FormDto setDisplayed(String username, UUID formId) {
        loadOwnedForm(username, formId);
        formRepository.clearDisplayed();

        // clearDisplayed detached everything, reload
        Form form = requireForm(formId);
        form.setDisplayed(true);
        return formMapper.toDto(formRepository.saveAndFlush(form));
    }

    @Override
    public FormDto clearDisplayed(String username, UUID formId) {
        Form form = loadOwnedForm(username, formId);
        form.setDisplayed(false);
        return formMapper.toDto(formRepository.save(form));
    }

    @Override
    public void deleteForm(String username, UUID formId) {
        Form form = loadOwnedForm(username, formId);
        // submissions go with the form through ON DELETE CASCADE
        formRepository.delete(form);
        log.info("Form {} deleted", formId);
    }

    @Override
    @Transactional(readOnly = true)
    public PublicFormDto getPublicForm(UUID formId) {
        Form form = formRepository.findByIdAndActiveTrue(formId)
                .orElseThrow(() -> formNotFound(formId));
        return formMapper.toPublicDto(form);
    }

    @Override
    @Transactional(readOnly = true)
    public PublicFormDto getDisplayedForm() {
        Form form = formRepository.findDisplayedActive()
                .orElseThrow(() -> new ResourceNotFoundException("No form is currently displayed", ErrorCodes.FORM_NOT_FOUND));
        return formMapper.toPublicDto(form);
    }

    private Form loadOwnedForm(String username, UUID formId) {
        User user = accessPolicy.requireUser(username);
        Form form = requireForm(formId);
        accessPolicy.requireOwnerOrSuperAdmin(user, form.getOwnerId());
        return form;
    }

    private Form requireForm(UUID formId) {
        return formRepository.findById(formId).orElseThrow(() -> formNotFound(formId));
    }

    private ResourceNotFoundException formNotFound(UUID formId) {
        return new ResourceNotFoundException("Form " + formId + " not found", ErrorCodes.FORM_NOT_FOUND);
    }
}
