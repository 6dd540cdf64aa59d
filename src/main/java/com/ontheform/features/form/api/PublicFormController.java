package com.ontheform.features.form.api;

import com.ontheform.features.form.api.dto.PublicFormDto;
import com.ontheform.features.form.application.FormService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/public/forms")
@RequiredArgsConstructor
@Tag(name = "Public Forms", description = "Anonymous access to active forms")
public class PublicFormController {

    private final FormService formService;

    @Operation(summary = "Get the displayed form", description = "Returns the form currently flagged for display.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Displayed form returned",
                    content = @Content(schema = @Schema(implementation = PublicFormDto.class))),
            @ApiResponse(responseCode = "404", description = "No active form is displayed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/displayed")
    public ResponseEntity<PublicFormDto> getDisplayedForm() {
        return ResponseEntity.ok(formService.getDisplayedForm());
    }

    @Operation(summary = "Get an active form")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Form returned",
                    content = @Content(schema = @Schema(implementation = PublicFormDto.class))),
            @ApiResponse(responseCode = "404", description = "Form not found or inactive",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{id}")
    public ResponseEntity<PublicFormDto> getForm(@PathVariable UUID id) {
        return ResponseEntity.ok(formService.getPublicForm(id));
    }
}
