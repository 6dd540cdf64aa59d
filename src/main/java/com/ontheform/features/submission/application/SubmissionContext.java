package com.ontheform.features.submission.application;

/**
 * Request metadata captured with a public submission.
 */
public record SubmissionContext(String clientIp, String userAgent) {

    private static final int MAX_USER_AGENT = 512;

    public SubmissionContext {
        if (userAgent != null && userAgent.length() > MAX_USER_AGENT) {
            userAgent = userAgent.substring(0, MAX_USER_AGENT);
        }
    }
}
