package com.ontheform.features.form.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * One input of a form, stored inside the form's {@code fields} JSON column in declared order.
 */
@Schema(description = "A single form field definition")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FormField(
        @Schema(description = "Identifier, unique within the form; key of the value in responses", example = "email")
        @NotBlank(message = "Field id is required")
        @Size(max = 100, message = "Field id must be at most 100 characters")
        String id,

        @Schema(description = "Input kind", example = "email")
        @NotNull(message = "Field type is required")
        FieldType type,

        @Schema(description = "Label shown to the submitter and used in error messages", example = "Email Address")
        @NotBlank(message = "Field label is required")
        @Size(max = 255, message = "Field label must be at most 255 characters")
        String label,

        @Schema(description = "Secondary caption shown under the label")
        @Size(max = 255, message = "Secondary label must be at most 255 characters")
        String secondaryLabel,

        @Schema(description = "Input placeholder")
        @Size(max = 255, message = "Placeholder must be at most 255 characters")
        String placeholder,

        @Schema(description = "Whether a value must be provided")
        boolean required,

        @Schema(description = "Allowed values for select, radio and checkbox fields")
        List<@NotBlank(message = "Options must not be blank") String> options,

        @Schema(description = "Accept values outside options (choice fields only)")
        boolean allowOther,

        @Schema(description = "Accepted file types for file fields, e.g. \"image/*,.pdf\"")
        @Size(max = 255, message = "Accept must be at most 255 characters")
        String accept,

        @Schema(description = "Maximum file size in bytes for file fields")
        @Positive(message = "Max file size must be positive")
        Long maxFileSize
) {

    public FormField {
        options = options == null ? null : List.copyOf(options);
    }

    @JsonIgnore
    public List<String> optionList() {
        return options == null ? List.of() : options;
    }

    @JsonIgnore
    public boolean acceptsOtherValues() {
        return allowOther && type != null && type.isChoice();
    }

    public static FormField of(String id, FieldType type, String label, boolean required) {
        return new FormField(id, type, label, null, null, required, null, false, null, null);
    }

    public static FormField choice(String id, FieldType type, String label, boolean required,
                                   List<String> options, boolean allowOther) {
        return new FormField(id, type, label, null, null, required, options, allowOther, null, null);
    }
}
