package com.ontheform.features.form.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ontheform.features.form.api.dto.CreateFormRequest;
import com.ontheform.features.form.api.dto.FormDto;
import com.ontheform.features.form.api.dto.FormSettingsRequest;
import com.ontheform.features.form.application.FormService;
import com.ontheform.features.form.domain.model.FieldType;
import com.ontheform.features.form.domain.model.FormField;
import com.ontheform.features.form.domain.model.UniqueConstraintType;
import com.ontheform.shared.exception.ErrorCodes;
import com.ontheform.shared.exception.ForbiddenException;
import com.ontheform.shared.exception.ValidationException;
import com.ontheform.testsupport.WebMvcSecurityTestConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FormController.class)
@Import(WebMvcSecurityTestConfig.class)
class FormControllerTest {

    private static final String ADMIN = "owner@example.com";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private FormService formService;

    private static FormDto formDto(UUID id, UniqueConstraintType type, String field) {
        return new FormDto(id, "RSVP", null,
                List.of(FormField.of("email", FieldType.EMAIL, "Email Address", true)),
                true, false, 0, type, field, null, false, false, null,
                UUID.randomUUID(), Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("GET /api/v1/forms requires authentication")
    void list_anonymous_unauthorized() throws Exception {
        mockMvc.perform(get("/api/v1/forms"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(formService);
    }

    @Test
    @WithMockUser(username = ADMIN, roles = "ADMIN")
    @DisplayName("POST /api/v1/forms returns 201 with the stored form")
    void create_created() throws Exception {
        UUID id = UUID.randomUUID();
        when(formService.createForm(eq(ADMIN), any(CreateFormRequest.class)))
                .thenReturn(formDto(id, UniqueConstraintType.NONE, null));

        CreateFormRequest request = new CreateFormRequest("RSVP", null,
                List.of(FormField.of("email", FieldType.EMAIL, "Email Address", true)), null, null);

        mockMvc.perform(post("/api/v1/forms").with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(id.toString()))
                .andExpect(jsonPath("$.uniqueConstraintType").value("none"));
    }

    @Test
    @WithMockUser(username = ADMIN, roles = "ADMIN")
    @DisplayName("POST /api/v1/forms without fields returns 400 with field errors")
    void create_noFields_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/forms").with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"RSVP\",\"fields\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors[0].field").value("fields"));

        verifyNoInteractions(formService);
    }

    @Test
    @WithMockUser(username = ADMIN, roles = "ADMIN")
    @DisplayName("PUT /api/v1/forms/{id}/settings accepts lower-case constraint names")
    void settings_updated() throws Exception {
        UUID id = UUID.randomUUID();
        when(formService.updateSettings(ADMIN, id,
                new FormSettingsRequest(UniqueConstraintType.FIELD, "email", null, true)))
                .thenReturn(formDto(id, UniqueConstraintType.FIELD, "email"));

        mockMvc.perform(put("/api/v1/forms/{id}/settings", id).with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"uniqueConstraintType\":\"field\",\"uniqueConstraintField\":\"email\",\"sendEmailNotification\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.uniqueConstraintType").value("field"))
                .andExpect(jsonPath("$.uniqueConstraintField").value("email"));
    }

    @Test
    @WithMockUser(username = ADMIN, roles = "ADMIN")
    @DisplayName("PUT /api/v1/forms/{id}/settings surfaces the service error code")
    void settings_missingField_badRequest() throws Exception {
        UUID id = UUID.randomUUID();
        when(formService.updateSettings(eq(ADMIN), eq(id), any()))
                .thenThrow(new ValidationException("Unique constraint field is required", ErrorCodes.UNIQUE_FIELD_REQUIRED));

        mockMvc.perform(put("/api/v1/forms/{id}/settings", id).with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"uniqueConstraintType\":\"field\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value(ErrorCodes.UNIQUE_FIELD_REQUIRED));
    }

    @Test
    @WithMockUser(username = ADMIN, roles = "ADMIN")
    @DisplayName("GET /api/v1/forms/{id} of another admin's form returns 403")
    void get_notOwner_forbidden() throws Exception {
        UUID id = UUID.randomUUID();
        when(formService.getForm(ADMIN, id)).thenThrow(new ForbiddenException("Access denied"));

        mockMvc.perform(get("/api/v1/forms/{id}", id))
                .andExpect(status().isForbidden());
    }

    @Test
    @WithMockUser(username = ADMIN, roles = "SUPER_ADMIN")
    @DisplayName("DELETE /api/v1/forms/{id} returns 204")
    void delete_noContent() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(delete("/api/v1/forms/{id}", id).with(csrf()))
                .andExpect(status().isNoContent());

        verify(formService).deleteForm(ADMIN, id);
    }
}
