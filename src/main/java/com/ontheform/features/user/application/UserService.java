package com.ontheform.features.user.application;

import com.ontheform.features.user.api.dto.ChangePasswordRequest;
import com.ontheform.features.user.api.dto.CreateUserRequest;
import com.ontheform.features.user.api.dto.UpdateProfileRequest;
import com.ontheform.features.user.api.dto.UpdateUserRequest;
import com.ontheform.features.user.api.dto.UserDto;
import com.ontheform.features.user.domain.model.UserRole;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.UUID;

/**
 * Account management. Listing and changing other accounts is for super admins; every admin
 * may read and edit their own profile.
 */
public interface UserService {

    Page<UserDto> listUsers(String search, UserRole role, Boolean active, Pageable pageable);

    UserDto getUser(UUID userId);

    UserDto createUser(CreateUserRequest request);

    UserDto updateUser(UUID userId, UpdateUserRequest request);

    void deleteUser(String username, UUID userId);

    UserDto getProfile(String username);

    UserDto updateProfile(String username, UpdateProfileRequest request);

    void changePassword(String username, ChangePasswordRequest request);
}
