package com.ontheform.features.form.api;

import com.ontheform.features.form.api.dto.CreateFormRequest;
import com.ontheform.features.form.api.dto.FormDto;
import com.ontheform.features.form.api.dto.FormSettingsRequest;
import com.ontheform.features.form.api.dto.FormSummaryDto;
import com.ontheform.features.form.api.dto.UpdateFormRequest;
import com.ontheform.features.form.application.FormService;
import com.ontheform.features.form.domain.model.FormStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/forms")
@RequiredArgsConstructor
@Tag(name = "Forms", description = "Form administration for signed-in admins")
@SecurityRequirement(name = "basicAuth")
public class FormController {

    private final FormService formService;

    @Operation(
            summary = "List forms",
            description = "Returns a page of forms. Admins see their own forms, super admins see all of them."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of forms returned")
    })
    @GetMapping
    public ResponseEntity<Page<FormSummaryDto>> listForms(
            @Parameter(name = "search", description = "Case-insensitive match on title or description", in = ParameterIn.QUERY)
            @RequestParam(required = false) String search,
            @Parameter(name = "status", description = "Filter by ACTIVE or INACTIVE", in = ParameterIn.QUERY)
            @RequestParam(required = false) FormStatus status,
            @ParameterObject @PageableDefault(sort = "createdAt", direction = Sort.Direction.DESC, size = 20) Pageable pageable,
            Authentication authentication
    ) {
        return ResponseEntity.ok(formService.listForms(authentication.getName(), search, status, pageable));
    }

    @Operation(summary = "Get a form", description = "Returns the full form definition including settings.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Form returned",
                    content = @Content(schema = @Schema(implementation = FormDto.class))),
            @ApiResponse(responseCode = "404", description = "Form not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{id}")
    public ResponseEntity<FormDto> getForm(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(formService.getForm(authentication.getName(), id));
    }

    @Operation(summary = "Create a form")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Form created",
                    content = @Content(schema = @Schema(implementation = FormDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<FormDto> createForm(
            @Valid @RequestBody CreateFormRequest request,
            Authentication authentication
    ) {
        FormDto created = formService.createForm(authentication.getName(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Update a form", description = "Replaces title, description, fields, banner and terms.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Form updated",
                    content = @Content(schema = @Schema(implementation = FormDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Form not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping("/{id}")
    public ResponseEntity<FormDto> updateForm(
            @PathVariable UUID id,
            @Valid @RequestBody UpdateFormRequest request,
            Authentication authentication
    ) {
        return ResponseEntity.ok(formService.updateForm(authentication.getName(), id, request));
    }

    @Operation(
            summary = "Update submission settings",
            description = "Changes the duplicate policy, QR code and confirmation email toggles. " +
                    "Changing the duplicate policy re-indexes existing submissions."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Settings updated",
                    content = @Content(schema = @Schema(implementation = FormDto.class))),
            @ApiResponse(responseCode = "400", description = "Unique field missing or unknown",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping("/{id}/settings")
    public ResponseEntity<FormDto> updateSettings(
            @PathVariable UUID id,
            @Valid @RequestBody FormSettingsRequest request,
            Authentication authentication
    ) {
        return ResponseEntity.ok(formService.updateSettings(authentication.getName(), id, request));
    }

    @Operation(summary = "Toggle active flag", description = "Inactive forms reject submissions and are hidden publicly.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Form toggled",
                    content = @Content(schema = @Schema(implementation = FormDto.class)))
    })
    @PatchMapping("/{id}/toggle")
    public ResponseEntity<FormDto> toggleActive(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(formService.toggleActive(authentication.getName(), id));
    }

    @Operation(summary = "Duplicate a form", description = "Creates an inactive copy titled '<title> (Copy)'.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Copy created",
                    content = @Content(schema = @Schema(implementation = FormDto.class)))
    })
    @PostMapping("/{id}/duplicate")
    public ResponseEntity<FormDto> duplicateForm(@PathVariable UUID id, Authentication authentication) {
        FormDto copy = formService.duplicateForm(authentication.getName(), id);
        return ResponseEntity.status(HttpStatus.CREATED).body(copy);
    }

    @Operation(summary = "Make this the displayed form", description = "Any previously displayed form is cleared.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Form is now displayed",
                    content = @Content(schema = @Schema(implementation = FormDto.class)))
    })
    @PutMapping("/{id}/displayed")
    public ResponseEntity<FormDto> setDisplayed(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(formService.setDisplayed(authentication.getName(), id));
    }

    @Operation(summary = "Stop displaying this form")
    @DeleteMapping("/{id}/displayed")
    public ResponseEntity<FormDto> clearDisplayed(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(formService.clearDisplayed(authentication.getName(), id));
    }

    @Operation(summary = "Delete a form", description = "Deletes the form and all of its submissions.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Form deleted"),
            @ApiResponse(responseCode = "404", description = "Form not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteForm(@PathVariable UUID id, Authentication authentication) {
        formService.deleteForm(authentication.getName(), id);
    }
}
