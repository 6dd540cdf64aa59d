package com.ontheform.features.user.api.dto;

import com.ontheform.features.user.domain.model.UserRole;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(description = "Admin account as shown in user management")
public record UserDto(
        UUID id,
        String name,
        String email,
        UserRole role,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {
}
