package com.ontheform.shared.config;

import com.ontheform.features.user.config.BootstrapAdminProperties;
import com.ontheform.features.user.domain.model.User;
import com.ontheform.features.user.domain.model.UserRole;
import com.ontheform.features.user.domain.repository.UserRepository;
import com.ontheform.shared.email.EmailAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the first super admin so a fresh installation can log in.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {

    private final BootstrapAdminProperties bootstrapAdminProperties;
    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Override
    @Transactional
    public void run(String... args) {
        if (!bootstrapAdminProperties.isEnabled()) {
            log.debug("Bootstrap admin disabled");
            return;
        }

        String email = bootstrapAdminProperties.getEmail();
        String password = bootstrapAdminProperties.getPassword();
        if (email == null || email.isBlank() || password == null || password.isBlank()) {
            log.warn("Bootstrap admin enabled but app.bootstrap-admin.email/password are not set; skipping");
            return;
        }

        if (userRepository.existsByEmailIgnoreCase(email)) {
            log.debug("Bootstrap admin {} already present", EmailAddresses.mask(email));
            return;
        }

        User admin = new User();
        admin.setName(bootstrapAdminProperties.getName());
        admin.setEmail(email.trim().toLowerCase());
        admin.setPasswordHash(passwordEncoder.encode(password));
        admin.setRole(UserRole.SUPER_ADMIN);
        userRepository.save(admin);
        log.info("Created bootstrap super admin {}", EmailAddresses.mask(email));
    }
}
