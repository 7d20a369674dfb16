package com.example.org_membershipservice.repository;

import com.example.org_membershipservice.entity.OrgUnit;
import com.example.org_membershipservice.entity.OrgUnitType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for OrgUnit entity.
 *
 * IMPORTANT: every mutation of a unit's memberships or invites starts with
 * findByIdForUpdate() so concurrent requests on the same unit are serialized.
 */
@Repository
public interface OrgUnitRepository extends JpaRepository<OrgUnit, UUID> {

    /**
     * Load a unit with a row lock held until the transaction ends.
     * CRITICAL: use this before re-validating coordinator counts or pending invites.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM OrgUnit u WHERE u.id = :id")
    Optional<OrgUnit> findByIdForUpdate(@Param("id") UUID id);

    Optional<OrgUnit> findByIdAndActiveTrue(UUID id);

    /**
     * Whether an active root of the given type exists.
     * Enforces: at most one active COUNCIL without a parent.
     */
    boolean existsByTypeAndParentIdIsNullAndActiveTrue(OrgUnitType type);

    boolean existsBySlug(String slug);

    boolean existsByParentIdAndActiveTrue(UUID parentId);

    /**
     * Whole active forest in one query; the tree is assembled in memory.
     */
    List<OrgUnit> findAllByActiveTrue();
}
