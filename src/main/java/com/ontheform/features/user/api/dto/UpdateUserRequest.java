package com.ontheform.features.user.api.dto;

import com.ontheform.features.user.domain.model.UserRole;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@Schema(description = "Partial update of an admin account; omitted values are left unchanged")
public record UpdateUserRequest(
        @Size(max = 255, message = "Name must be at most 255 characters")
        @Pattern(regexp = ".*\\S.*", message = "Name must not be blank")
        String name,

        @Email(message = "Valid email is required")
        @Size(max = 255, message = "Email must be at most 255 characters")
        String email,

        @Size(min = 6, max = 128, message = "Password must be between 6 and 128 characters")
        String password,

        UserRole role,

        Boolean active
) {

    public boolean isEmpty() {
        return name == null && email == null && password == null && role == null && active == null;
    }
}
