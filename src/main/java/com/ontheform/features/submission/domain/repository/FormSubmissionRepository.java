package com.ontheform.features.submission.domain.repository;

import com.ontheform.features.submission.domain.model.FormSubmission;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FormSubmissionRepository extends JpaRepository<FormSubmission, UUID>,
        JpaSpecificationExecutor<FormSubmission> {

    boolean existsByForm_IdAndUniquenessKey(UUID formId, String uniquenessKey);

    long countByForm_Id(UUID formId);

    @EntityGraph(attributePaths = "form")
    Optional<FormSubmission> findWithFormById(UUID id);

    @Override
    @EntityGraph(attributePaths = "form")
    Page<FormSubmission> findAll(Specification<FormSubmission> spec, Pageable pageable);

    List<FormSubmission> findByForm_IdOrderBySubmittedAtDesc(UUID formId);

    List<FormSubmission> findByForm_IdOrderBySubmittedAtAscIdAsc(UUID formId);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE FormSubmission s SET s.uniquenessKey = NULL WHERE s.form.id = :formId")
    int clearUniquenessKeys(@Param("formId") UUID formId);

    @Query("""
            SELECT COUNT(s)
            FROM FormSubmission s
            WHERE (:ownerId IS NULL OR s.form.createdBy.id = :ownerId)
              AND s.submittedAt >= :since
            """)
    long countByOwnerSince(@Param("ownerId") UUID ownerId, @Param("since") Instant since);

    @Query("""
            SELECT COUNT(s)
            FROM FormSubmission s
            WHERE (:ownerId IS NULL OR s.form.createdBy.id = :ownerId)
            """)
    long countByOwner(@Param("ownerId") UUID ownerId);

    @Query("""
            SELECT s
            FROM FormSubmission s
            JOIN FETCH s.form f
            WHERE (:ownerId IS NULL OR f.createdBy.id = :ownerId)
            ORDER BY s.submittedAt DESC
            """)
    List<FormSubmission> findRecentByOwner(@Param("ownerId") UUID ownerId, Pageable pageable);
}
