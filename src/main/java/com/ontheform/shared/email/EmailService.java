package com.ontheform.shared.email;

/**
 * Outbound email capability. The active provider is selected by {@code app.email.provider}.
 */
public interface EmailService {

    /**
     * Sends one HTML message.
     *
     * @return the provider's delivery receipt
     * @throws EmailDeliveryException when the provider rejects or fails to accept the message
     */
    EmailDeliveryResult send(EmailMessage message);

    /**
     * Short provider name used in logs and metrics.
     */
    String providerName();
}
