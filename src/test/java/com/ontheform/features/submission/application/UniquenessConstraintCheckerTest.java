package com.ontheform.features.submission.application;

import com.ontheform.BaseUnitTest;
import com.ontheform.features.form.domain.model.Form;
import com.ontheform.features.form.domain.model.UniqueConstraintType;
import com.ontheform.features.submission.domain.model.value.FieldValue;
import com.ontheform.features.submission.domain.model.value.FieldValue.TextValue;
import com.ontheform.features.submission.domain.repository.FormSubmissionRepository;
import com.ontheform.shared.exception.DuplicateSubmissionException;
import com.ontheform.shared.exception.ErrorCodes;
import com.ontheform.shared.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("UniquenessConstraintChecker")
class UniquenessConstraintCheckerTest extends BaseUnitTest {

    @Mock
    private FormSubmissionRepository submissionRepository;

    @InjectMocks
    private UniquenessConstraintChecker checker;

    private Form form;
    private final SubmissionContext context = new SubmissionContext("198.51.100.4", "JUnit");

    @BeforeEach
    void setUp() {
        form = new Form();
        form.setId(UUID.randomUUID());
    }

    @Test
    @DisplayName("NONE: no lookup, no key")
    void none_noLookup() {
        form.setUniqueConstraintType(UniqueConstraintType.NONE);

        assertThat(checker.checkUnique(form, context, Map.of())).isNull();
        verifyNoInteractions(submissionRepository);
    }

    @Test
    @DisplayName("IP: first submission from an address passes and returns its key")
    void ip_firstSubmission_returnsKey() {
        form.setUniqueConstraintType(UniqueConstraintType.IP);
        when(submissionRepository.existsByForm_IdAndUniquenessKey(form.getId(), "ip:198.51.100.4")).thenReturn(false);

        assertThat(checker.checkUnique(form, context, Map.of())).isEqualTo("ip:198.51.100.4");
    }

    @Test
    @DisplayName("IP: repeat submission from the same address is a duplicate")
    void ip_repeat_duplicate() {
        form.setUniqueConstraintType(UniqueConstraintType.IP);
        when(submissionRepository.existsByForm_IdAndUniquenessKey(form.getId(), "ip:198.51.100.4")).thenReturn(true);

        assertThatThrownBy(() -> checker.checkUnique(form, context, Map.of()))
                .isInstanceOf(DuplicateSubmissionException.class)
                .hasMessage("You have already submitted this form from this IP address");
    }

    @Test
    @DisplayName("IP: unknown client address is rejected instead of skipping the constraint")
    void ip_unknownAddress_rejected() {
        form.setUniqueConstraintType(UniqueConstraintType.IP);

        assertThatThrownBy(() -> checker.checkUnique(form, new SubmissionContext(null, "JUnit"), Map.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Unable to determine client IP address")
                .extracting("errorCode").isEqualTo(ErrorCodes.CLIENT_IP_UNKNOWN);
        verifyNoInteractions(submissionRepository);
    }

    @Test
    @DisplayName("FIELD: constrained field missing is a validation error")
    void field_missing_validationError() {
        form.setUniqueConstraintType(UniqueConstraintType.FIELD);
        form.setUniqueConstraintField("email");

        assertThatThrownBy(() -> checker.checkUnique(form, context, Map.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Required unique field is missing")
                .extracting("errorCode").isEqualTo(ErrorCodes.UNIQUE_FIELD_REQUIRED);
        verifyNoInteractions(submissionRepository);
    }

    @Test
    @DisplayName("FIELD: existing value is a duplicate")
    void field_existingValue_duplicate() {
        form.setUniqueConstraintType(UniqueConstraintType.FIELD);
        form.setUniqueConstraintField("email");
        when(submissionRepository.existsByForm_IdAndUniquenessKey(any(), anyString())).thenReturn(true);

        assertThatThrownBy(() -> checker.checkUnique(form, context,
                Map.<String, FieldValue>of("email", new TextValue("a@b.co"))))
                .isInstanceOf(DuplicateSubmissionException.class)
                .hasMessage("A submission with this value already exists");
    }

    @Test
    @DisplayName("FIELD: looks up the hashed key of the value")
    void field_looksUpHashedKey() {
        form.setUniqueConstraintType(UniqueConstraintType.FIELD);
        form.setUniqueConstraintField("email");
        String expected = UniquenessKeys.forField("email", "a@b.co");
        when(submissionRepository.existsByForm_IdAndUniquenessKey(form.getId(), expected)).thenReturn(false);

        String key = checker.checkUnique(form, context, Map.<String, FieldValue>of("email", new TextValue("a@b.co")));

        assertThat(key).isEqualTo(expected);
        verify(submissionRepository).existsByForm_IdAndUniquenessKey(form.getId(), expected);
    }
}
