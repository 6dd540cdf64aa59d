package com.ontheform;

import com.ontheform.features.submission.application.SubmissionService;
import com.ontheform.shared.email.EmailService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;

class OnTheFormApplicationTest extends BaseIntegrationTest {

    @Autowired
    private SubmissionService submissionService;

    @Autowired
    private EmailService emailService;

    @Test
    void contextLoads() {
        assertThat(submissionService).isNotNull();
        assertThat(emailService.providerName()).isEqualTo("noop");
    }
}
