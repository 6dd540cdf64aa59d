package com.ontheform.features.submission.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.submission")
public class SubmissionProperties {

    /**
     * Public submissions accepted per client IP per minute; 0 disables the limit.
     */
    @Min(0)
    private int rateLimitPerMinute = 10;

    /**
     * How long a submission request waits for the confirmation email to be handed to the provider.
     */
    @Min(100)
    private long emailTimeoutMs = 10_000;
}
