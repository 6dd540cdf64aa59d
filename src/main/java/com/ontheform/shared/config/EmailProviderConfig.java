package com.ontheform.shared.config;

import com.ontheform.shared.email.EmailService;
import com.ontheform.shared.email.impl.AwsSesEmailService;
import com.ontheform.shared.email.impl.NoopEmailService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import software.amazon.awssdk.services.sesv2.SesV2Client;

/**
 * Selects the {@link EmailService} implementation from {@code app.email.provider}:
 * {@code ses}, {@code smtp} or {@code noop} (default).
 *
 * <p>The SMTP provider is the {@code @Service}-annotated {@code SmtpEmailService} and needs no bean here.
 */
@Slf4j
@Configuration
public class EmailProviderConfig {

    @Bean
    @Primary
    @ConditionalOnProperty(name = "app.email.provider", havingValue = "ses")
    public EmailService awsSesEmailService(SesV2Client sesV2Client,
                                           ObjectProvider<MeterRegistry> meterRegistryProvider) {
        log.info("Activating AWS SES email service as primary provider");
        return new AwsSesEmailService(sesV2Client, meterRegistryProvider.getIfAvailable());
    }

    @Bean
    @Primary
    @ConditionalOnProperty(name = "app.email.provider", havingValue = "noop", matchIfMissing = true)
    public EmailService noopEmailService() {
        log.info("Activating No-op email service (emails will be logged but not sent)");
        return new NoopEmailService();
    }
}
