package com.ontheform.features.submission.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ontheform.features.submission.api.dto.SubmissionDto;
import com.ontheform.features.submission.api.dto.SubmitFormRequest;
import com.ontheform.features.submission.api.dto.SubmitFormResponse;
import com.ontheform.features.submission.application.SubmissionContext;
import com.ontheform.features.submission.application.SubmissionService;
import com.ontheform.features.submission.application.export.ExportFile;
import com.ontheform.features.submission.application.export.SubmissionExportService;
import com.ontheform.features.submission.config.SubmissionProperties;
import com.ontheform.shared.exception.DuplicateSubmissionException;
import com.ontheform.shared.exception.ErrorCodes;
import com.ontheform.shared.exception.RateLimitExceededException;
import com.ontheform.shared.exception.ResourceNotFoundException;
import com.ontheform.shared.exception.SubmissionValidationException;
import com.ontheform.shared.rate_limit.RateLimitService;
import com.ontheform.shared.util.TrustedProxyUtil;
import com.ontheform.testsupport.WebMvcSecurityTestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.io.ByteArrayInputStream;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SubmissionController.class)
@Import(WebMvcSecurityTestConfig.class)
class SubmissionControllerTest {

    private static final String CLIENT_IP = "203.0.113.7";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private SubmissionService submissionService;

    @MockitoBean
    private SubmissionExportService exportService;

    @MockitoBean
    private RateLimitService rateLimitService;

    @MockitoBean
    private TrustedProxyUtil trustedProxyUtil;

    @MockitoBean
    private SubmissionProperties submissionProperties;

    private final UUID formId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        when(trustedProxyUtil.getClientIp(any())).thenReturn(CLIENT_IP);
        when(submissionProperties.getRateLimitPerMinute()).thenReturn(10);
    }

    private String body() throws Exception {
        return objectMapper.writeValueAsString(new SubmitFormRequest(formId, Map.of("name", "Ada")));
    }

    @Test
    @DisplayName("POST /api/v1/submissions is public and returns 201 with side-effect outcomes")
    void submit_anonymous_created() throws Exception {
        UUID submissionId = UUID.randomUUID();
        SubmitFormResponse response = new SubmitFormResponse(
                SubmitFormResponse.SUCCESS_MESSAGE,
                new SubmitFormResponse.Receipt(submissionId, formId, Instant.parse("2024-01-01T10:00:00Z")),
                "data:image/png;base64,AAAA",
                false,
                "Failed to send confirmation email");
        when(submissionService.submit(any(SubmitFormRequest.class), any(SubmissionContext.class))).thenReturn(response);

        mockMvc.perform(post("/api/v1/submissions").with(csrf())
                        .header(HttpHeaders.USER_AGENT, "JUnit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Form submitted successfully"))
                .andExpect(jsonPath("$.submission.id").value(submissionId.toString()))
                .andExpect(jsonPath("$.qrCode").value("data:image/png;base64,AAAA"))
                .andExpect(jsonPath("$.emailSent").value(false))
                .andExpect(jsonPath("$.emailError").value("Failed to send confirmation email"));

        verify(rateLimitService).checkRateLimit("form-submit", CLIENT_IP, 10);
        ArgumentCaptor<SubmissionContext> context = ArgumentCaptor.forClass(SubmissionContext.class);
        verify(submissionService).submit(any(SubmitFormRequest.class), context.capture());
        assertThat(context.getValue()).isEqualTo(new SubmissionContext(CLIENT_IP, "JUnit"));
    }

    @Test
    @DisplayName("POST /api/v1/submissions without formId returns 400 before the pipeline runs")
    void submit_missingFormId_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/submissions").with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"responses\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value(ErrorCodes.VALIDATION_FAILED));

        verifyNoInteractions(submissionService);
    }

    @Test
    @DisplayName("POST /api/v1/submissions lists every validation error")
    void submit_invalidAnswers_validationErrors() throws Exception {
        when(submissionService.submit(any(), any())).thenThrow(new SubmissionValidationException(
                List.of("Full Name is required", "Email Address must be a valid email address")));

        mockMvc.perform(post("/api/v1/submissions").with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value(ErrorCodes.FORM_VALIDATION_ERROR))
                .andExpect(jsonPath("$.validationErrors.length()").value(2))
                .andExpect(jsonPath("$.validationErrors[0]").value("Full Name is required"));
    }

    @Test
    @DisplayName("POST /api/v1/submissions for an inactive form returns 404")
    void submit_inactiveForm_notFound() throws Exception {
        when(submissionService.submit(any(), any()))
                .thenThrow(new ResourceNotFoundException("Form not found or inactive", ErrorCodes.FORM_NOT_FOUND));

        mockMvc.perform(post("/api/v1/submissions").with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Form not found or inactive"))
                .andExpect(jsonPath("$.errorCode").value(ErrorCodes.FORM_NOT_FOUND));
    }

    @Test
    @DisplayName("POST /api/v1/submissions duplicate returns 409")
    void submit_duplicate_conflict() throws Exception {
        when(submissionService.submit(any(), any())).thenThrow(
                new DuplicateSubmissionException("You have already submitted this form from this IP address"));

        mockMvc.perform(post("/api/v1/submissions").with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value(ErrorCodes.DUPLICATE_SUBMISSION))
                .andExpect(jsonPath("$.detail").value("You have already submitted this form from this IP address"));
    }

    @Test
    @DisplayName("POST /api/v1/submissions over the rate limit returns 429 with Retry-After")
    void submit_rateLimited() throws Exception {
        doThrow(new RateLimitExceededException("Too many requests for form-submit", 42))
                .when(rateLimitService).checkRateLimit("form-submit", CLIENT_IP, 10);

        mockMvc.perform(post("/api/v1/submissions").with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body()))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "42"));

        verifyNoInteractions(submissionService);
    }

    @Test
    @DisplayName("GET /api/v1/submissions requires authentication")
    void list_anonymous_unauthorized() throws Exception {
        mockMvc.perform(get("/api/v1/submissions"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(submissionService);
    }

    @Test
    @WithMockUser(username = "owner@example.com", roles = "USER")
    @DisplayName("GET /api/v1/submissions is forbidden without an admin role")
    void list_nonAdmin_forbidden() throws Exception {
        mockMvc.perform(get("/api/v1/submissions"))
                .andExpect(status().isForbidden());
    }

    @Test
    @WithMockUser(username = "owner@example.com", roles = "ADMIN")
    @DisplayName("GET /api/v1/submissions passes filters through to the service")
    void list_admin_filtersPassedThrough() throws Exception {
        SubmissionDto dto = new SubmissionDto(UUID.randomUUID(), formId, "RSVP", Map.of("name", "Ada"),
                "ada@example.com", Instant.parse("2024-01-02T10:00:00Z"), null);
        when(submissionService.listSubmissions(eq("owner@example.com"), eq(formId), eq("ada"),
                eq(LocalDate.of(2024, 1, 1)), isNull(), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(dto)));

        mockMvc.perform(get("/api/v1/submissions")
                        .param("formId", formId.toString())
                        .param("search", "ada")
                        .param("startDate", "2024-01-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].formTitle").value("RSVP"))
                .andExpect(jsonPath("$.content[0].responses.name").value("Ada"));
    }

    @Test
    @WithMockUser(username = "owner@example.com", roles = "ADMIN")
    @DisplayName("DELETE /api/v1/submissions/{id} returns 204")
    void delete_noContent() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(delete("/api/v1/submissions/{id}", id).with(csrf()))
                .andExpect(status().isNoContent());

        verify(submissionService).deleteSubmission("owner@example.com", id);
    }

    @Test
    @WithMockUser(username = "owner@example.com", roles = "ADMIN")
    @DisplayName("GET /api/v1/submissions/export/form/{formId} streams the workbook as an attachment")
    void export_attachment() throws Exception {
        byte[] bytes = {1, 2, 3};
        when(exportService.exportForm("owner@example.com", formId)).thenReturn(new ExportFile(
                "RSVP_submissions_2024-01-02.xlsx",
                SubmissionExportService.XLSX_CONTENT_TYPE,
                () -> new ByteArrayInputStream(bytes),
                bytes.length));

        mockMvc.perform(get("/api/v1/submissions/export/form/{formId}", formId))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_TYPE, SubmissionExportService.XLSX_CONTENT_TYPE))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("filename=\"RSVP_submissions_2024-01-02.xlsx\"")))
                .andExpect(content().bytes(bytes));
    }
}
