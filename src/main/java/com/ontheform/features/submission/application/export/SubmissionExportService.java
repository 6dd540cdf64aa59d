package com.ontheform.features.submission.application.export;

import com.ontheform.features.form.domain.model.Form;
import com.ontheform.features.form.domain.model.FormField;
import com.ontheform.features.form.domain.repository.FormRepository;
import com.ontheform.features.submission.domain.model.FormSubmission;
import com.ontheform.features.submission.domain.repository.FormSubmissionRepository;
import com.ontheform.features.user.domain.model.User;
import com.ontheform.shared.exception.ErrorCodes;
import com.ontheform.shared.exception.ResourceNotFoundException;
import com.ontheform.shared.security.AccessPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Renders every submission of a form as an XLSX sheet, newest first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionExportService {

    public static final String XLSX_CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    static final String ANONYMOUS = "Anonymous";

    private static final DateTimeFormatter SUBMITTED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int MIN_COLUMN_CHARS = 10;
    private static final int MAX_COLUMN_CHARS = 50;
    static final int MAX_CELL_CHARS = SpreadsheetVersion.EXCEL2007.getMaxTextLength();
    static final String TRUNCATION_MARK = "... [truncated]";

    private final FormRepository formRepository;
    private final FormSubmissionRepository submissionRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Transactional(readOnly = true)
    public ExportFile exportForm(String username, UUID formId) {
        User user = accessPolicy.requireUser(username);
        Form form = formRepository.findById(formId)
                .orElseThrow(() -> new ResourceNotFoundException("Form not found", ErrorCodes.FORM_NOT_FOUND));
        accessPolicy.requireOwnerOrSuperAdmin(user, form.getOwnerId());

        List<FormSubmission> submissions = submissionRepository.findByForm_IdOrderBySubmittedAtDesc(formId);
        byte[] bytes = render(form.getFields(), submissions);
        log.info("Exported {} submissions of form {} for {}", submissions.size(), formId, username);

        return new ExportFile(
                filename(form.getTitle(), LocalDate.now(clock)),
                XLSX_CONTENT_TYPE,
                () -> new ByteArrayInputStream(bytes),
                bytes.length
        );
    }

    static String filename(String title, LocalDate date) {
        String safeTitle = title == null ? "form" : title.replaceAll("[^a-zA-Z0-9]", "_");
        return safeTitle + "_submissions_" + date + ".xlsx";
    }

    static String cellText(Object value) {
        return fitCell(rawText(value));
    }

    private static String rawText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        if (value instanceof Map<?, ?> file && file.get("filename") != null) {
            return String.valueOf(file.get("filename"));
        }
        return String.valueOf(value);
    }

    /**
     * XLSX cells hold at most 32767 characters; longer answers are cut and marked.
     */
    static String fitCell(String text) {
        if (text.length() <= MAX_CELL_CHARS) {
            return text;
        }
        return text.substring(0, MAX_CELL_CHARS - TRUNCATION_MARK.length()) + TRUNCATION_MARK;
    }

    private byte[] render(List<FormField> fields, List<FormSubmission> submissions) {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Form Submissions");

            List<String> titles = headerTitles(fields);
            int[] widths = new int[titles.size()];

            Row header = sheet.createRow(0);
            CellStyle headerStyle = headerStyle(workbook);
            for (int col = 0; col < titles.size(); col++) {
                header.createCell(col).setCellValue(titles.get(col));
                header.getCell(col).setCellStyle(headerStyle);
                widths[col] = titles.get(col).length();
            }

            int rowIdx = 1;
            for (FormSubmission submission : submissions) {
                List<String> cells = rowValues(submission, fields);
                Row row = sheet.createRow(rowIdx++);
                for (int col = 0; col < cells.size(); col++) {
                    row.createCell(col).setCellValue(cells.get(col));
                    widths[col] = Math.max(widths[col], cells.get(col).length());
                }
            }

            // width from content length, clamped to 10..50 characters
            for (int col = 0; col < widths.length; col++) {
                int chars = Math.max(MIN_COLUMN_CHARS, Math.min(MAX_COLUMN_CHARS, widths[col] + 2));
                sheet.setColumnWidth(col, chars * 256);
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render XLSX export", e);
        }
    }

    private List<String> rowValues(FormSubmission submission, List<FormField> fields) {
        List<String> cells = new ArrayList<>(3 + fields.size());
        cells.add(submission.getId().toString());
        cells.add(submission.getSubmittedAt() != null
                ? SUBMITTED_AT_FORMAT.format(submission.getSubmittedAt().atZone(clock.getZone()))
                : "");
        cells.add(submission.getSubmitterEmail() != null ? submission.getSubmitterEmail() : ANONYMOUS);
        Map<String, Object> responses = submission.getResponses();
        for (FormField field : fields) {
            cells.add(cellText(responses.get(field.id())));
        }
        return cells;
    }

    private static List<String> headerTitles(List<FormField> fields) {
        List<String> titles = new ArrayList<>(List.of("Submission ID", "Submitted At", "Submitter Email"));
        fields.forEach(field -> titles.add(field.label()));
        return titles;
    }

    private static CellStyle headerStyle(Workbook workbook) {
        Font bold = workbook.createFont();
        bold.setBold(true);
        CellStyle style = workbook.createCellStyle();
        style.setFont(bold);
        style.setFillForegroundColor(IndexedColors.PALE_BLUE.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        return style;
    }
}
