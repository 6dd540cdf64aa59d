package com.ontheform.features.form.application;

import com.ontheform.features.form.api.dto.CreateFormRequest;
import com.ontheform.features.form.api.dto.FormDto;
import com.ontheform.features.form.api.dto.FormSettingsRequest;
import com.ontheform.features.form.api.dto.FormSummaryDto;
import com.ontheform.features.form.api.dto.PublicFormDto;
import com.ontheform.features.form.api.dto.UpdateFormRequest;
import com.ontheform.features.form.domain.model.FormStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.UUID;

public interface FormService {

    Page<FormSummaryDto> listForms(String username, String search, FormStatus status, Pageable pageable);

    FormDto getForm(String username, UUID formId);

    FormDto createForm(String username, CreateFormRequest request);

    FormDto updateForm(String username, UUID formId, UpdateFormRequest request);

    FormDto updateSettings(String username, UUID formId, FormSettingsRequest request);

    FormDto toggleActive(String username, UUID formId);

    FormDto duplicateForm(String username, UUID formId);

    FormDto setDisplayed(String username, UUID formId);

    FormDto clearDisplayed(String username, UUID formId);

    void deleteForm(String username, UUID formId);

    PublicFormDto getPublicForm(UUID formId);

    PublicFormDto getDisplayedForm();
}
