package com.ontheform.features.submission.domain.model.value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * A response value after it has been checked against its field definition.
 * One variant per family of field types.
 */
public sealed interface FieldValue
        permits FieldValue.TextValue, FieldValue.NumberValue, FieldValue.DateValue,
        FieldValue.ChoiceSetValue, FieldValue.FileValue {

    /**
     * Canonical text form, used for uniqueness keys and exports.
     */
    String asText();

    /** text, email and textarea fields */
    record TextValue(String text) implements FieldValue {
        public TextValue {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String asText() {
            return text.trim();
        }
    }

    record NumberValue(BigDecimal number) implements FieldValue {
        public NumberValue {
            Objects.requireNonNull(number, "number");
        }

        @Override
        public String asText() {
            return number.stripTrailingZeros().toPlainString();
        }
    }

    record DateValue(LocalDate date) implements FieldValue {
        public DateValue {
            Objects.requireNonNull(date, "date");
        }

        @Override
        public String asText() {
            return date.toString();
        }
    }

    /** select, radio (one element) and checkbox fields */
    record ChoiceSetValue(List<String> choices) implements FieldValue {
        public ChoiceSetValue {
            choices = List.copyOf(choices);
        }

        @Override
        public String asText() {
            return String.join(", ", choices);
        }
    }

    /** metadata of a file stored by the upload endpoint */
    record FileValue(String filename, String path, String mimetype, long size) implements FieldValue {
        public FileValue {
            Objects.requireNonNull(filename, "filename");
        }

        @Override
        public String asText() {
            return filename;
        }
    }
}
