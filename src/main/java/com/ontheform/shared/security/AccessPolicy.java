package com.ontheform.shared.security;

import com.ontheform.features.user.domain.model.User;
import com.ontheform.features.user.domain.repository.UserRepository;
import com.ontheform.shared.exception.ForbiddenException;
import lombok.RequiredArgsConstructor;
import org.springframework.security.authentication.InsufficientAuthenticationException;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Resource-level rules for the admin API: super admins see every form,
 * admins only the forms they created.
 */
@Component
@RequiredArgsConstructor
public class AccessPolicy {

    private final UserRepository userRepository;

    public User requireUser(String username) {
        if (username == null || username.isBlank()) {
            throw new InsufficientAuthenticationException("Authentication is required");
        }
        return userRepository.findByEmailIgnoreCase(username)
                .orElseThrow(() -> new InsufficientAuthenticationException("Unknown principal"));
    }

    public boolean isOwner(User user, UUID ownerId) {
        return user != null && ownerId != null && ownerId.equals(user.getId());
    }

    public void requireOwnerOrSuperAdmin(User user, UUID ownerId) {
        if (user != null && (user.isSuperAdmin() || isOwner(user, ownerId))) {
            return;
        }
        throw new ForbiddenException("Access denied");
    }

    /**
     * Owner filter for list queries; {@code null} means unrestricted.
     */
    public UUID ownerScope(User user) {
        return user.isSuperAdmin() ? null : user.getId();
    }
}
