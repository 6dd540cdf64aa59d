package com.ontheform.features.submission.domain.model;

import com.ontheform.features.form.domain.model.Form;
import com.ontheform.features.submission.infra.persistence.ResponsesConverter;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
        name = "form_submissions",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_form_submissions_uniqueness_key",
                columnNames = {"form_id", "uniqueness_key"}
        ),
        indexes = {
                @Index(name = "idx_form_submissions_form_submitted", columnList = "form_id, submitted_at"),
                @Index(name = "idx_form_submissions_email", columnList = "submitter_email")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class FormSubmission {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "submission_id")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "form_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Form form;

    @Convert(converter = ResponsesConverter.class)
    @Column(name = "responses", nullable = false, columnDefinition = "TEXT")
    private Map<String, Object> responses = new LinkedHashMap<>();

    /**
     * Read-only view of the raw JSON, used for free-text search.
     */
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @Column(name = "responses", insertable = false, updatable = false, columnDefinition = "TEXT")
    private String responsesJson;

    @Column(name = "submitter_email", length = 255)
    private String submitterEmail;

    @Column(name = "submitter_ip", length = 45)
    private String submitterIp;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    /**
     * Value guarded by the (form_id, uniqueness_key) index; NULL when the form accepts duplicates.
     */
    @Column(name = "uniqueness_key", length = 200)
    private String uniquenessKey;

    @CreationTimestamp
    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public UUID getFormId() {
        return form != null ? form.getId() : null;
    }
}
