package com.ontheform.features.form.domain.repository;

import com.ontheform.features.form.domain.model.Form;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FormRepository extends JpaRepository<Form, UUID> {

    @Query("""
            SELECT f
            FROM Form f
            WHERE (:ownerId IS NULL OR f.createdBy.id = :ownerId)
              AND (:active IS NULL OR f.active = :active)
              AND (:search IS NULL
                   OR LOWER(f.title) LIKE LOWER(CONCAT('%', :search, '%'))
                   OR LOWER(f.description) LIKE LOWER(CONCAT('%', :search, '%')))
            """)
    Page<Form> findAllByFilters(
            @Param("ownerId") UUID ownerId,
            @Param("active") Boolean active,
            @Param("search") String search,
            Pageable pageable
    );

    Optional<Form> findByIdAndActiveTrue(UUID id);

    boolean existsByCreatedBy_Id(UUID ownerId);

    @Query("SELECT f FROM Form f WHERE f.displaySlot = true AND f.active = true")
    Optional<Form> findDisplayedActive();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Form f SET f.displaySlot = NULL WHERE f.displaySlot = true")
    int clearDisplayed();

    /**
     * Atomic counter bump executed in the caller's transaction.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Form f SET f.submissionCount = f.submissionCount + 1 WHERE f.id = :formId")
    int incrementSubmissionCount(@Param("formId") UUID formId);

    @Modifying(flushAutomatically = true)
    @Query("""
            UPDATE Form f
            SET f.submissionCount = CASE WHEN f.submissionCount > 0 THEN f.submissionCount - 1 ELSE 0 END
            WHERE f.id = :formId
            """)
    int decrementSubmissionCount(@Param("formId") UUID formId);

    @Query("SELECT f.submissionCount FROM Form f WHERE f.id = :formId")
    Optional<Integer> findSubmissionCount(@Param("formId") UUID formId);

    @Query("SELECT COUNT(f) FROM Form f WHERE (:ownerId IS NULL OR f.createdBy.id = :ownerId)")
    long countByOwner(@Param("ownerId") UUID ownerId);

    @Query("""
            SELECT f
            FROM Form f
            WHERE f.active = true
              AND (:ownerId IS NULL OR f.createdBy.id = :ownerId)
            ORDER BY f.updatedAt DESC
            """)
    List<Form> findActiveByOwner(@Param("ownerId") UUID ownerId, Pageable pageable);
}
