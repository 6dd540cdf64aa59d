package com.ontheform.features.submission.api;

import com.ontheform.features.submission.api.dto.SubmissionDto;
import com.ontheform.features.submission.api.dto.SubmitFormRequest;
import com.ontheform.features.submission.api.dto.SubmitFormResponse;
import com.ontheform.features.submission.api.dto.UpdateSubmissionRequest;
import com.ontheform.features.submission.application.SubmissionContext;
import com.ontheform.features.submission.application.SubmissionService;
import com.ontheform.features.submission.application.export.ExportFile;
import com.ontheform.features.submission.application.export.SubmissionExportService;
import com.ontheform.features.submission.config.SubmissionProperties;
import com.ontheform.shared.rate_limit.RateLimitService;
import com.ontheform.shared.util.TrustedProxyUtil;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/submissions")
@RequiredArgsConstructor
@Tag(name = "Submissions", description = "Public form submission and submission administration")
public class SubmissionController {

    private final SubmissionService submissionService;
    private final SubmissionExportService exportService;
    private final RateLimitService rateLimitService;
    private final TrustedProxyUtil trustedProxyUtil;
    private final SubmissionProperties submissionProperties;

    @Operation(
            summary = "Submit a form",
            description = "Public endpoint. Validates the answers, enforces the form's duplicate policy, stores the " +
                    "submission and then generates the QR code and confirmation email when enabled. " +
                    "QR or email failures are reported in the body and never undo the submission."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Submission stored",
                    content = @Content(schema = @Schema(implementation = SubmitFormResponse.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed; see validationErrors",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Form not found or inactive",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Duplicate submission",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Too many submissions from this address",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<SubmitFormResponse> submit(
            HttpServletRequest request,
            @Valid @RequestBody SubmitFormRequest submitRequest
    ) {
        String clientIp = trustedProxyUtil.getClientIp(request);
        rateLimitService.checkRateLimit("form-submit", clientIp, submissionProperties.getRateLimitPerMinute());

        SubmissionContext context = new SubmissionContext(clientIp, request.getHeader(HttpHeaders.USER_AGENT));
        SubmitFormResponse response = submissionService.submit(submitRequest, context);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(
            summary = "List submissions",
            description = "Newest first. Admins see submissions of their own forms, super admins see all."
    )
    @SecurityRequirement(name = "basicAuth")
    @GetMapping
    public ResponseEntity<Page<SubmissionDto>> listSubmissions(
            @Parameter(name = "formId", description = "Restrict to one form", in = ParameterIn.QUERY)
            @RequestParam(required = false) UUID formId,
            @Parameter(name = "search", description = "Case-insensitive match on answers or submitter email", in = ParameterIn.QUERY)
            @RequestParam(required = false) String search,
            @Parameter(name = "startDate", description = "First day included (yyyy-MM-dd)", in = ParameterIn.QUERY)
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @Parameter(name = "endDate", description = "Last day included (yyyy-MM-dd)", in = ParameterIn.QUERY)
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @ParameterObject @PageableDefault(sort = "submittedAt", direction = Sort.Direction.DESC, size = 10) Pageable pageable,
            Authentication authentication
    ) {
        return ResponseEntity.ok(submissionService.listSubmissions(
                authentication.getName(), formId, search, startDate, endDate, pageable));
    }

    @Operation(summary = "Get a submission")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Submission returned",
                    content = @Content(schema = @Schema(implementation = SubmissionDto.class))),
            @ApiResponse(responseCode = "404", description = "Submission not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @SecurityRequirement(name = "basicAuth")
    @GetMapping("/{id}")
    public ResponseEntity<SubmissionDto> getSubmission(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(submissionService.getSubmission(authentication.getName(), id));
    }

    @Operation(summary = "Edit a submission", description = "Answers are validated against the form like a new submission.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Submission updated",
                    content = @Content(schema = @Schema(implementation = SubmissionDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "New value duplicates another submission",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @SecurityRequirement(name = "basicAuth")
    @PutMapping("/{id}")
    public ResponseEntity<SubmissionDto> updateSubmission(
            @PathVariable UUID id,
            @Valid @RequestBody UpdateSubmissionRequest request,
            Authentication authentication
    ) {
        return ResponseEntity.ok(submissionService.updateSubmission(authentication.getName(), id, request));
    }

    @Operation(summary = "Delete a submission", description = "Also decrements the form's submission count.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Submission deleted"),
            @ApiResponse(responseCode = "404", description = "Submission not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @SecurityRequirement(name = "basicAuth")
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteSubmission(@PathVariable UUID id, Authentication authentication) {
        submissionService.deleteSubmission(authentication.getName(), id);
    }

    @Operation(summary = "Export submissions of a form", description = "XLSX workbook, one row per submission.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Workbook returned"),
            @ApiResponse(responseCode = "404", description = "Form not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @SecurityRequirement(name = "basicAuth")
    @GetMapping("/export/form/{formId}")
    public ResponseEntity<Resource> exportSubmissions(@PathVariable UUID formId, Authentication authentication) {
        ExportFile exportFile = exportService.exportForm(authentication.getName(), formId);
        InputStreamResource resource = new InputStreamResource(exportFile.contentSupplier().get());

        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(exportFile.contentType()))
                .contentLength(exportFile.contentLength())
                .cacheControl(CacheControl.noCache())
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + exportFile.filename() + "\"")
                .body(resource);
    }
}
