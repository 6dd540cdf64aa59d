package com.ontheform.features.form.domain.event;

import java.util.UUID;

/**
 * Published inside the settings transaction when a form's duplicate policy changes.
 */
public record UniqueConstraintChangedEvent(UUID formId) {
}
