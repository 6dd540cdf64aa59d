package com.ontheform.features.submission.application.sideeffect;

import com.ontheform.features.form.domain.model.Form;
import com.ontheform.features.submission.domain.model.FormSubmission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs the post-submission hooks once the submission is committed and folds their outcome into
 * a {@link SideEffectReport}. A hook failure is logged and reported, never rethrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SideEffectOrchestrator {

    private final List<SubmissionSideEffect> sideEffects;

    public SideEffectReport afterWrite(Form form, FormSubmission submission) {
        SideEffectContext context = new SideEffectContext(form, submission);
        for (SubmissionSideEffect sideEffect : sideEffects) {
            if (!sideEffect.appliesTo(context)) {
                continue;
            }
            try {
                sideEffect.apply(context);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Side effect '{}' interrupted for submission {}", sideEffect.name(), submission.getId());
                sideEffect.onFailure(context, e);
            } catch (Exception e) {
                log.error("Side effect '{}' failed for submission {}", sideEffect.name(), submission.getId(), e);
                sideEffect.onFailure(context, e);
            }
        }
        return context.toReport();
    }
}
