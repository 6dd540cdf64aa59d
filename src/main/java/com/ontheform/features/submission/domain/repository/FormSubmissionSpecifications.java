package com.ontheform.features.submission.domain.repository;

import com.ontheform.features.submission.domain.model.FormSubmission;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

public final class FormSubmissionSpecifications {

    private FormSubmissionSpecifications() {
    }

    /**
     * @param ownerId restricts to forms created by this user; {@code null} means every form
     * @param from    inclusive lower bound on {@code submittedAt}
     * @param to      exclusive upper bound on {@code submittedAt}
     */
    public static Specification<FormSubmission> build(UUID ownerId, UUID formId, String search,
                                                      Instant from, Instant to) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (ownerId != null) {
                predicates.add(cb.equal(root.get("form").get("createdBy").get("id"), ownerId));
            }
            if (formId != null) {
                predicates.add(cb.equal(root.get("form").get("id"), formId));
            }
            if (search != null && !search.isBlank()) {
                String pattern = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("responsesJson")), pattern),
                        cb.like(cb.lower(root.get("submitterEmail")), pattern)
                ));
            }
            if (from != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("submittedAt"), from));
            }
            if (to != null) {
                predicates.add(cb.lessThan(root.get("submittedAt"), to));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
