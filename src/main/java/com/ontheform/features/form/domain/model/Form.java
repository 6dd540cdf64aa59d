package com.ontheform.features.form.domain.model;

import com.ontheform.features.form.infra.persistence.FormFieldListConverter;
import com.ontheform.features.user.domain.model.User;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Entity
@Table(
        name = "forms",
        uniqueConstraints = @UniqueConstraint(name = "uk_forms_display_slot", columnNames = "display_slot")
)
@Getter
@Setter
@NoArgsConstructor
public class Form {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "form_id")
    private UUID id;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "description", length = 1000)
    private String description;

    @Convert(converter = FormFieldListConverter.class)
    @Column(name = "fields", nullable = false, columnDefinition = "TEXT")
    private List<FormField> fields = new ArrayList<>();

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    /**
     * TRUE for the single displayed form, NULL for every other row, so the unique
     * constraint admits at most one displayed form.
     */
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @Column(name = "display_slot")
    private Boolean displaySlot;

    /**
     * Changed only by the counter queries in {@code FormRepository}, never by entity flushes.
     */
    @Column(name = "submission_count", nullable = false, updatable = false)
    private int submissionCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "unique_constraint_type", nullable = false, length = 16)
    private UniqueConstraintType uniqueConstraintType = UniqueConstraintType.NONE;

    @Column(name = "unique_constraint_field", length = 100)
    private String uniqueConstraintField;

    @Column(name = "banner_url", length = 1024)
    private String bannerUrl;

    @Column(name = "show_qr_code", nullable = false)
    private boolean showQrCode;

    @Column(name = "send_email_notification", nullable = false)
    private boolean sendEmailNotification;

    @Embedded
    private TermsSettings terms = new TermsSettings();

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "created_by")
    private User createdBy;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void applyDefaults() {
        if (uniqueConstraintType == null) {
            uniqueConstraintType = UniqueConstraintType.NONE;
        }
        if (fields == null) {
            fields = new ArrayList<>();
        }
        if (terms == null) {
            terms = new TermsSettings();
        }
    }

    public boolean isDisplayed() {
        return Boolean.TRUE.equals(displaySlot);
    }

    public void setDisplayed(boolean displayed) {
        this.displaySlot = displayed ? Boolean.TRUE : null;
    }

    public Optional<FormField> findField(String fieldId) {
        if (fieldId == null) {
            return Optional.empty();
        }
        return fields.stream().filter(field -> fieldId.equals(field.id())).findFirst();
    }

    public UUID getOwnerId() {
        return createdBy != null ? createdBy.getId() : null;
    }
}
