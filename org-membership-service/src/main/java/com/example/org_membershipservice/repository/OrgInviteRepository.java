package com.example.org_membershipservice.repository;

import com.example.org_membershipservice.entity.InviteStatus;
import com.example.org_membershipservice.entity.OrgInvite;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for OrgInvite entity.
 */
@Repository
public interface OrgInviteRepository extends JpaRepository<OrgInvite, UUID> {

    /**
     * Load an invite with a row lock, so two responses to one invite cannot both succeed.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM OrgInvite i WHERE i.id = :id")
    Optional<OrgInvite> findByIdForUpdate(@Param("id") UUID id);

    /**
     * The pending invite for a (unit, invitee) pair, expired or not.
     * At most one exists thanks to the partial unique index.
     */
    Optional<OrgInvite> findByOrgUnitIdAndInvitedUserIdAndStatus(UUID orgUnitId,
                                                                 UUID invitedUserId,
                                                                 InviteStatus status);

    List<OrgInvite> findAllByOrgUnitIdAndStatusAndExpiresAtAfterOrderByCreatedAtDesc(UUID orgUnitId,
                                                                                     InviteStatus status,
                                                                                     Instant now);

    List<OrgInvite> findAllByInvitedUserIdAndStatusAndExpiresAtAfterOrderByCreatedAtDesc(UUID invitedUserId,
                                                                                         InviteStatus status,
                                                                                         Instant now);

    List<OrgInvite> findAllByInvitedUserIdAndStatus(UUID invitedUserId, InviteStatus status);

    List<OrgInvite> findAllByOrgUnitIdAndStatus(UUID orgUnitId, InviteStatus status);

    @Query("SELECT i.invitedUserId FROM OrgInvite i " +
           "WHERE i.orgUnitId = :orgUnitId AND i.status = :status AND i.expiresAt > :now")
    List<UUID> findOpenInviteeIds(@Param("orgUnitId") UUID orgUnitId,
                                  @Param("status") InviteStatus status,
                                  @Param("now") Instant now);
}
