package com.ontheform.features.submission.application.validation;

import com.ontheform.features.form.domain.model.FieldType;
import com.ontheform.features.form.domain.model.FormField;
import com.ontheform.features.submission.domain.model.value.FieldValue;
import com.ontheform.features.submission.domain.model.value.FieldValue.ChoiceSetValue;
import com.ontheform.features.submission.domain.model.value.FieldValue.DateValue;
import com.ontheform.features.submission.domain.model.value.FieldValue.FileValue;
import com.ontheform.features.submission.domain.model.value.FieldValue.NumberValue;
import com.ontheform.features.submission.domain.model.value.FieldValue.TextValue;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checks a submitted response map against the field schema of a form.
 *
 * <p>Every field is checked and all problems are reported together. Keys that do not
 * correspond to a field are ignored. The validator performs no I/O, so the same input
 * always yields the same result.
 */
@Component
public class ResponseValidator {

    static final int MAX_NUMBER_DIGITS = 1000;

    public static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    public ValidationResult validate(List<FormField> fields, Map<String, Object> responses) {
        Map<String, Object> answers = responses != null ? responses : Map.of();
        List<String> errors = new ArrayList<>();
        Map<String, FieldValue> values = new LinkedHashMap<>();

        for (FormField field : fields) {
            Object raw = answers.get(field.id());
            if (isBlank(raw)) {
                if (field.required()) {
                    errors.add(field.label() + " is required");
                }
                continue;
            }
            convert(field, raw, errors).ifPresent(value -> values.put(field.id(), value));
        }
        return new ValidationResult(errors, values);
    }

    /**
     * A value counts as absent when it is null, a blank string, an empty list or an empty object.
     */
    public static boolean isBlank(Object raw) {
        if (raw == null) {
            return true;
        }
        if (raw instanceof String text) {
            return text.trim().isEmpty();
        }
        if (raw instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (raw instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }

    private Optional<FieldValue> convert(FormField field, Object raw, List<String> errors) {
        FieldType type = field.type();
        if (type == null) {
            return Optional.empty();
        }
        return switch (type) {
            case TEXT, TEXTAREA -> scalarText(raw)
                    .<FieldValue>map(TextValue::new)
                    .or(() -> reject(errors, field.label() + " has an invalid value"));
            case EMAIL -> validateEmail(field, raw, errors);
            case SELECT, RADIO -> validateSingleChoice(field, raw, errors);
            case CHECKBOX -> validateChoiceSet(field, raw, errors);
            case NUMBER -> validateNumber(field, raw, errors);
            case DATE -> validateDate(field, raw, errors);
            case FILE -> validateFile(field, raw, errors);
        };
    }

    private Optional<FieldValue> validateEmail(FormField field, Object raw, List<String> errors) {
        Optional<String> text = scalarText(raw);
        if (text.isEmpty()) {
            return reject(errors, field.label() + " has an invalid value");
        }
        if (!EMAIL_PATTERN.matcher(text.get().trim()).matches()) {
            return reject(errors, field.label() + " must be a valid email address");
        }
        return Optional.of(new TextValue(text.get()));
    }

    private Optional<FieldValue> validateSingleChoice(FormField field, Object raw, List<String> errors) {
        Optional<String> text = scalarText(raw);
        if (text.isEmpty()) {
            return reject(errors, field.label() + " has an invalid value");
        }
        String choice = text.get();
        if (!field.acceptsOtherValues() && !field.optionList().contains(choice)) {
            return reject(errors, field.label() + " contains an invalid option");
        }
        return Optional.of(new ChoiceSetValue(List.of(choice)));
    }

    private Optional<FieldValue> validateChoiceSet(FormField field, Object raw, List<String> errors) {
        Collection<?> items = raw instanceof Collection<?> collection ? collection : List.of(raw);
        List<String> choices = new ArrayList<>(items.size());
        for (Object item : items) {
            Optional<String> text = scalarText(item);
            if (text.isEmpty()) {
                return reject(errors, field.label() + " has an invalid value");
            }
            choices.add(text.get());
        }

        boolean clean = true;
        if (!field.acceptsOtherValues()) {
            for (String choice : choices) {
                if (!field.optionList().contains(choice)) {
                    errors.add(field.label() + " contains an invalid option: " + choice);
                    clean = false;
                }
            }
        }
        return clean ? Optional.of(new ChoiceSetValue(choices)) : Optional.empty();
    }

    private Optional<FieldValue> validateNumber(FormField field, Object raw, List<String> errors) {
        String text;
        if (raw instanceof Number number) {
            text = number.toString();
        } else if (raw instanceof String string) {
            text = string.trim();
        } else {
            return reject(errors, field.label() + " must be a valid number");
        }
        try {
            BigDecimal value = new BigDecimal(text);
            // bounded so the canonical text form stays small
            if (value.precision() > MAX_NUMBER_DIGITS || Math.abs(value.scale()) > MAX_NUMBER_DIGITS) {
                return reject(errors, field.label() + " must be a valid number");
            }
            return Optional.of(new NumberValue(value));
        } catch (NumberFormatException e) {
            // NaN, infinities and malformed text
            return reject(errors, field.label() + " must be a valid number");
        }
    }

    private Optional<FieldValue> validateDate(FormField field, Object raw, List<String> errors) {
        if (raw instanceof String text) {
            try {
                return Optional.of(new DateValue(LocalDate.parse(text.trim())));
            } catch (DateTimeParseException e) {
                return reject(errors, field.label() + " must be a valid date");
            }
        }
        return reject(errors, field.label() + " must be a valid date");
    }

    private Optional<FieldValue> validateFile(FormField field, Object raw, List<String> errors) {
        if (!(raw instanceof Map<?, ?> map) || !(map.get("filename") instanceof String filename) || filename.isBlank()) {
            return reject(errors, field.label() + " must be an uploaded file");
        }
        String path = map.get("path") instanceof String p ? p : null;
        String mimetype = map.get("mimetype") instanceof String m ? m : null;
        long size = map.get("size") instanceof Number n ? n.longValue() : 0L;

        FileValue file = new FileValue(filename, path, mimetype, size);
        boolean clean = true;
        if (field.maxFileSize() != null && size > field.maxFileSize()) {
            errors.add(field.label() + " exceeds the maximum file size");
            clean = false;
        }
        if (!FileTypeMatcher.accepts(field.accept(), filename, mimetype)) {
            errors.add(field.label() + " has an unsupported file type");
            clean = false;
        }
        return clean ? Optional.of(file) : Optional.empty();
    }

    private static Optional<String> scalarText(Object raw) {
        if (raw instanceof String text) {
            return Optional.of(text);
        }
        if (raw instanceof Number || raw instanceof Boolean) {
            return Optional.of(String.valueOf(raw));
        }
        return Optional.empty();
    }

    private static Optional<FieldValue> reject(List<String> errors, String message) {
        errors.add(message);
        return Optional.empty();
    }

    /**
     * Matches a file against an HTML-style {@code accept} list such as {@code "image/*,.pdf"}.
     */
    static final class FileTypeMatcher {

        private FileTypeMatcher() {
        }

        static boolean accepts(String accept, String filename, String mimetype) {
            if (accept == null || accept.isBlank()) {
                return true;
            }
            String name = filename.toLowerCase(Locale.ROOT);
            String mime = mimetype != null ? mimetype.toLowerCase(Locale.ROOT) : "";
            for (String token : accept.split(",")) {
                String rule = token.trim().toLowerCase(Locale.ROOT);
                if (rule.isEmpty()) {
                    continue;
                }
                if (rule.startsWith(".")) {
                    if (name.endsWith(rule)) {
                        return true;
                    }
                } else if (rule.endsWith("/*")) {
                    if (mime.startsWith(rule.substring(0, rule.length() - 1))) {
                        return true;
                    }
                } else if (rule.equals(mime)) {
                    return true;
                }
            }
            return false;
        }
    }
}
