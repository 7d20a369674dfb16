package com.example.org_membershipservice.repository;

import com.example.org_membershipservice.entity.MembershipStatus;
import com.example.org_membershipservice.entity.OrgMembership;
import com.example.org_membershipservice.entity.OrgRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for OrgMembership entity.
 * Removed memberships stay in the table; pass MembershipStatus.ACTIVE to read the live subset.
 */
@Repository
public interface OrgMembershipRepository extends JpaRepository<OrgMembership, UUID> {

    Optional<OrgMembership> findByOrgUnitIdAndUserIdAndStatus(UUID orgUnitId,
                                                              UUID userId,
                                                              MembershipStatus status);

    boolean existsByOrgUnitIdAndUserIdAndStatus(UUID orgUnitId, UUID userId, MembershipStatus status);

    boolean existsByOrgUnitIdAndUserIdAndRoleAndStatus(UUID orgUnitId,
                                                       UUID userId,
                                                       OrgRole role,
                                                       MembershipStatus status);

    /**
     * Count members of a unit with the given role.
     * Used by the last-coordinator guard; call it while holding the unit lock.
     */
    long countByOrgUnitIdAndRoleAndStatus(UUID orgUnitId, OrgRole role, MembershipStatus status);

    long countByOrgUnitIdAndStatus(UUID orgUnitId, MembershipStatus status);

    /**
     * Members of a unit, coordinators first, then by seniority.
     */
    List<OrgMembership> findAllByOrgUnitIdAndStatusOrderByRoleAscJoinedAtAsc(UUID orgUnitId,
                                                                             MembershipStatus status);

    List<OrgMembership> findAllByUserIdAndStatus(UUID userId, MembershipStatus status);

    @Query("SELECT m.userId FROM OrgMembership m " +
           "WHERE m.orgUnitId = :orgUnitId AND m.status = :status")
    List<UUID> findUserIdsByOrgUnitIdAndStatus(@Param("orgUnitId") UUID orgUnitId,
                                               @Param("status") MembershipStatus status);

    /**
     * Batch count memberships for many units.
     * Replaces N queries with 1 when the tree is rendered.
     */
    @Query("SELECT m.orgUnitId as orgUnitId, COUNT(m) as memberCount " +
           "FROM OrgMembership m " +
           "WHERE m.orgUnitId IN :unitIds AND m.status = :status " +
           "GROUP BY m.orgUnitId")
    List<UnitMemberCount> countMembersByUnitIds(@Param("unitIds") Collection<UUID> unitIds,
                                                @Param("status") MembershipStatus status);

    /**
     * Projection for countMembersByUnitIds().
     */
    interface UnitMemberCount {
        UUID getOrgUnitId();
        Long getMemberCount();
    }
}
