package com.ontheform.shared.email;

public record EmailDeliveryResult(
        boolean success,
        String messageId,
        String provider
) {

    public static EmailDeliveryResult delivered(String provider, String messageId) {
        return new EmailDeliveryResult(true, messageId, provider);
    }
}
