package com.ontheform.features.submission.application;

import com.ontheform.features.form.domain.event.UniqueConstraintChangedEvent;
import com.ontheform.features.form.domain.model.Form;
import com.ontheform.features.form.domain.repository.FormRepository;
import com.ontheform.features.submission.application.validation.ResponseValidator;
import com.ontheform.features.submission.domain.model.FormSubmission;
import com.ontheform.features.submission.domain.repository.FormSubmissionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Re-derives the uniqueness keys of a form's stored submissions after its constraint changed.
 * Runs inside the settings update transaction, so both commit or roll back together.
 *
 * <p>The oldest submission of each key keeps it; later ones that already collide under the new
 * constraint get no key and are logged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UniquenessKeyReindexer {

    private final FormRepository formRepository;
    private final FormSubmissionRepository submissionRepository;
    private final ResponseValidator responseValidator;

    @EventListener
    @Transactional
    public void onUniqueConstraintChanged(UniqueConstraintChangedEvent event) {
        Form form = formRepository.findById(event.formId()).orElse(null);
        if (form == null) {
            return;
        }

        submissionRepository.clearUniquenessKeys(form.getId());
        List<FormSubmission> submissions = submissionRepository.findByForm_IdOrderBySubmittedAtAscIdAsc(form.getId());

        Set<String> seen = new HashSet<>();
        int keyed = 0;
        int collisions = 0;
        for (FormSubmission submission : submissions) {
            String key = UniquenessKeys.derive(form, submission.getSubmitterIp(),
                    responseValidator.validate(form.getFields(), submission.getResponses()).values());
            if (key == null) {
                submission.setUniquenessKey(null);
                continue;
            }
            if (seen.add(key)) {
                submission.setUniquenessKey(key);
                keyed++;
            } else {
                submission.setUniquenessKey(null);
                collisions++;
                log.warn("Submission {} of form {} duplicates an earlier submission under the new constraint",
                        submission.getId(), form.getId());
            }
        }
        submissionRepository.flush();

        log.info("Re-keyed {} submissions of form {} ({} keyed, {} historical duplicates)",
                submissions.size(), form.getId(), keyed, collisions);
    }
}
