package com.ontheform.features.submission.application.sideeffect;

import com.ontheform.features.form.domain.model.Form;
import com.ontheform.features.submission.config.SubmissionProperties;
import com.ontheform.features.submission.domain.model.FormSubmission;
import com.ontheform.shared.config.AsyncConfig;
import com.ontheform.shared.email.EmailAddresses;
import com.ontheform.shared.email.EmailDeliveryResult;
import com.ontheform.shared.email.EmailMessage;
import com.ontheform.shared.email.EmailService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends the submitter a confirmation email for forms with {@code sendEmailNotification}.
 *
 * <p>Delivery runs on the notification executor and the request waits at most
 * {@code app.submission.email-timeout-ms} for the provider to accept the message. On timeout the
 * sending thread is interrupted; a message the provider already accepted may still arrive.
 */
@Component
@Order(20)
@Slf4j
public class EmailNotificationSideEffect implements SubmissionSideEffect {

    private final EmailService emailService;
    private final SubmissionConfirmationEmailComposer composer;
    private final TaskExecutor executor;
    private final SubmissionProperties properties;

    public EmailNotificationSideEffect(EmailService emailService,
                                       SubmissionConfirmationEmailComposer composer,
                                       @Qualifier(AsyncConfig.NOTIFICATION_EXECUTOR) TaskExecutor executor,
                                       SubmissionProperties properties) {
        this.emailService = emailService;
        this.composer = composer;
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "confirmation-email";
    }

    @Override
    public boolean appliesTo(SideEffectContext context) {
        String recipient = context.getSubmission().getSubmitterEmail();
        return context.getForm().isSendEmailNotification() && recipient != null && !recipient.isBlank();
    }

    @Override
    public void apply(SideEffectContext context) throws Exception {
        Form form = context.getForm();
        FormSubmission submission = context.getSubmission();
        EmailMessage message = composer.compose(
                submission.getSubmitterEmail(),
                form.getTitle(),
                form.getBannerUrl(),
                submission.getId(),
                context.getQrPng()
        );

        FutureTask<EmailDeliveryResult> delivery = new FutureTask<>(() -> emailService.send(message));
        executor.execute(delivery);
        try {
            EmailDeliveryResult result = delivery.get(properties.getEmailTimeoutMs(), TimeUnit.MILLISECONDS);
            log.info("Confirmation for submission {} sent to {} via {} (id {})", submission.getId(),
                    EmailAddresses.mask(submission.getSubmitterEmail()), result.provider(), result.messageId());
            context.emailDelivered();
        } catch (TimeoutException e) {
            delivery.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw e.getCause() instanceof Exception cause ? cause : e;
        }
    }

    @Override
    public void onFailure(SideEffectContext context, Exception failure) {
        context.emailFailed();
    }
}
