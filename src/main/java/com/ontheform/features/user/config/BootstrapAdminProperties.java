package com.ontheform.features.user.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.bootstrap-admin")
public class BootstrapAdminProperties {

    /**
     * Create the initial super admin on startup when no account with this email exists.
     */
    private boolean enabled = false;

    private String name = "Super Admin";

    private String email;

    /**
     * Plain text; hashed with BCrypt before it is stored.
     */
    private String password;
}
