package com.ontheform.features.submission.application;

import com.ontheform.BaseUnitTest;
import com.ontheform.features.form.domain.model.FieldType;
import com.ontheform.features.form.domain.model.Form;
import com.ontheform.features.form.domain.model.FormField;
import com.ontheform.features.form.domain.model.UniqueConstraintType;
import com.ontheform.features.form.domain.repository.FormRepository;
import com.ontheform.features.submission.domain.model.FormSubmission;
import com.ontheform.features.submission.domain.repository.FormSubmissionRepository;
import com.ontheform.shared.exception.DuplicateSubmissionException;
import com.ontheform.shared.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLIntegrityConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("SubmissionWriter")
class SubmissionWriterTest extends BaseUnitTest {

    @Mock
    private FormSubmissionRepository submissionRepository;

    @Mock
    private FormRepository formRepository;

    @InjectMocks
    private SubmissionWriter writer;

    private Form form;
    private final SubmissionContext context = new SubmissionContext("192.0.2.10", "Mozilla/5.0");

    @BeforeEach
    void setUp() {
        form = new Form();
        form.setId(UUID.randomUUID());
        form.setFields(List.of(
                FormField.of("name", FieldType.TEXT, "Name", true),
                FormField.of("email", FieldType.EMAIL, "Email", false)));
    }

    @Test
    @DisplayName("stores the submission with request metadata and bumps the counter")
    void write_storesAndIncrements() {
        when(submissionRepository.saveAndFlush(any(FormSubmission.class))).thenAnswer(inv -> inv.getArgument(0));
        when(formRepository.incrementSubmissionCount(form.getId())).thenReturn(1);

        Map<String, Object> responses = new LinkedHashMap<>();
        responses.put("email", "ada@example.com");
        responses.put("name", "Ada");
        responses.put("injected", "dropped");

        FormSubmission saved = writer.write(form, responses, "ada@example.com", "ip:192.0.2.10", context);

        assertThat(saved.getForm()).isSameAs(form);
        assertThat(saved.getResponses()).containsExactly(Map.entry("name", "Ada"), Map.entry("email", "ada@example.com"));
        assertThat(saved.getSubmitterEmail()).isEqualTo("ada@example.com");
        assertThat(saved.getSubmitterIp()).isEqualTo("192.0.2.10");
        assertThat(saved.getUserAgent()).isEqualTo("Mozilla/5.0");
        assertThat(saved.getUniquenessKey()).isEqualTo("ip:192.0.2.10");
        verify(formRepository).incrementSubmissionCount(form.getId());
    }

    @Test
    @DisplayName("unique index violation on insert becomes a duplicate submission")
    void write_uniqueIndexViolation_duplicate() {
        form.setUniqueConstraintType(UniqueConstraintType.IP);
        DataIntegrityViolationException violation = new DataIntegrityViolationException("could not execute statement",
                new SQLIntegrityConstraintViolationException(
                        "Duplicate entry for key 'form_submissions.uk_form_submissions_uniqueness_key'"));
        when(submissionRepository.saveAndFlush(any(FormSubmission.class))).thenThrow(violation);

        assertThatThrownBy(() -> writer.write(form, Map.of("name", "Ada"), null, "ip:192.0.2.10", context))
                .isInstanceOf(DuplicateSubmissionException.class)
                .hasMessage("You have already submitted this form from this IP address");
        verify(formRepository, never()).incrementSubmissionCount(any());
    }

    @Test
    @DisplayName("other integrity violations propagate unchanged")
    void write_otherViolation_propagates() {
        DataIntegrityViolationException violation = new DataIntegrityViolationException("fk_form_submissions_form");
        when(submissionRepository.saveAndFlush(any(FormSubmission.class))).thenThrow(violation);

        assertThatThrownBy(() -> writer.write(form, Map.of("name", "Ada"), null, null, context))
                .isSameAs(violation);
    }

    @Test
    @DisplayName("form gone before the counter update: not found")
    void write_formGone_notFound() {
        when(submissionRepository.saveAndFlush(any(FormSubmission.class))).thenAnswer(inv -> inv.getArgument(0));
        when(formRepository.incrementSubmissionCount(form.getId())).thenReturn(0);

        assertThatThrownBy(() -> writer.write(form, Map.of("name", "Ada"), null, null, context))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("long user agents are truncated")
    void userAgent_truncated() {
        when(submissionRepository.saveAndFlush(any(FormSubmission.class))).thenAnswer(inv -> inv.getArgument(0));
        when(formRepository.incrementSubmissionCount(form.getId())).thenReturn(1);

        writer.write(form, Map.of("name", "Ada"), null, null, new SubmissionContext("192.0.2.10", "x".repeat(600)));

        ArgumentCaptor<FormSubmission> captor = ArgumentCaptor.forClass(FormSubmission.class);
        verify(submissionRepository).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getUserAgent()).hasSize(512);
    }
}
