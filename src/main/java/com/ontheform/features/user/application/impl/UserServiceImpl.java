package com.ontheform.features.user.application.impl;

import com.ontheform.features.form.domain.repository.FormRepository;
import com.ontheform.features.user.api.dto.ChangePasswordRequest;
import com.ontheform.features.user.api.dto.CreateUserRequest;
import com.ontheform.features.user.api.dto.UpdateProfileRequest;
import com.ontheform.features.user.api.dto.UpdateUserRequest;
import com.ontheform.features.user.api.dto.UserDto;
import com.ontheform.features.user.application.UserService;
import com.ontheform.features.user.domain.model.User;
import com.ontheform.features.user.domain.model.UserRole;
import com.ontheform.features.user.domain.repository.UserRepository;
import com.ontheform.features.user.infra.mapping.UserMapper;
import com.ontheform.shared.email.EmailAddresses;
import com.ontheform.shared.exception.ErrorCodes;
import com.ontheform.shared.exception.ResourceNotFoundException;
import com.ontheform.shared.exception.ValidationException;
import com.ontheform.shared.security.AccessPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.UUID;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class UserServiceImpl implements UserService {

    private final UserRepository userRepository;
    private final FormRepository formRepository;
    private final UserMapper userMapper;
    private final PasswordEncoder passwordEncoder;
    private final AccessPolicy accessPolicy;

    @Override
    @Transactional(readOnly = true)
    public Page<UserDto> listUsers(String search, UserRole role, Boolean active, Pageable pageable) {
        String term = search == null || search.isBlank() ? null : search.trim();
        return userRepository.findAllByFilters(term, role, active, pageable).map(userMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public UserDto getUser(UUID userId) {
        return userMapper.toDto(requireUser(userId));
    }

    @Override
    public UserDto createUser(CreateUserRequest request) {
        String email = normalizeEmail(request.email());
        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw emailExists();
        }

        User user = new User();
        user.setName(request.name().trim());
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setRole(request.role() != null ? request.role() : UserRole.ADMIN);
        user.setActive(request.active() == null || request.active());

        User saved = userRepository.save(user);
        log.info("Created {} account {} ({})", saved.getRole(), saved.getId(), EmailAddresses.mask(email));
        return userMapper.toDto(saved);
    }

    @Override
    public UserDto updateUser(UUID userId, UpdateUserRequest request) {
        if (request.isEmpty()) {
            throw new ValidationException("No fields to update", ErrorCodes.NO_UPDATE_FIELDS);
        }
        User user = requireUser(userId);
        applyAccountChanges(user, request.name(), request.email(), request.password());
        if (request.role() != null) {
            user.setRole(request.role());
        }
        if (request.active() != null) {
            user.setActive(request.active());
        }
        return userMapper.toDto(userRepository.save(user));
    }

    @Override
    public void deleteUser(String username, UUID userId) {
        User current = accessPolicy.requireUser(username);
        if (current.getId().equals(userId)) {
            throw new ValidationException("Cannot delete your own account", ErrorCodes.CANNOT_DELETE_SELF);
        }
        User user = requireUser(userId);
        if (formRepository.existsByCreatedBy_Id(userId)) {
            throw new ValidationException(
                    "Cannot delete user with existing forms. Please transfer or delete forms first.",
                    ErrorCodes.USER_HAS_FORMS);
        }
        userRepository.delete(user);
        log.info("User {} deleted account {}", current.getId(), userId);
    }

    @Override
    @Transactional(readOnly = true)
    public UserDto getProfile(String username) {
        return userMapper.toDto(accessPolicy.requireUser(username));
    }

    @Override
    public UserDto updateProfile(String username, UpdateProfileRequest request) {
        if (request.isEmpty()) {
            throw new ValidationException("No fields to update", ErrorCodes.NO_UPDATE_FIELDS);
        }
        User user = accessPolicy.requireUser(username);
        applyAccountChanges(user, request.name(), request.email(), request.password());
        return userMapper.toDto(userRepository.save(user));
    }

    @Override
    public void changePassword(String username, ChangePasswordRequest request) {
        if (!request.newPassword().equals(request.confirmPassword())) {
            throw new ValidationException("Password confirmation does not match", ErrorCodes.PASSWORD_MISMATCH);
        }
        User user = accessPolicy.requireUser(username);
        if (!passwordEncoder.matches(request.currentPassword(), user.getPasswordHash())) {
            throw new ValidationException("Current password is incorrect", ErrorCodes.INVALID_CURRENT_PASSWORD);
        }
        user.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        userRepository.save(user);
        log.info("Password changed for user {}", user.getId());
    }

    private void applyAccountChanges(User user, String name, String email, String password) {
        if (name != null) {
            user.setName(name.trim());
        }
        if (email != null) {
            String normalized = normalizeEmail(email);
            if (!normalized.equalsIgnoreCase(user.getEmail())
                    && userRepository.existsByEmailIgnoreCaseAndIdNot(normalized, user.getId())) {
                throw emailExists();
            }
            user.setEmail(normalized);
        }
        if (password != null) {
            user.setPasswordHash(passwordEncoder.encode(password));
        }
    }

    private User requireUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found", ErrorCodes.USER_NOT_FOUND));
    }

    private static ValidationException emailExists() {
        return new ValidationException("Email already exists", ErrorCodes.EMAIL_EXISTS);
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
