package com.example.org_membershipservice.service.impl;

import com.example.org_membershipservice.config.OrgProperties;
import com.example.org_membershipservice.dto.request.SendInviteRequest;
import com.example.org_membershipservice.dto.response.InviteResponse;
import com.example.org_membershipservice.dto.response.UserSummaryResponse;
import com.example.org_membershipservice.entity.InviteStatus;
import com.example.org_membershipservice.entity.MembershipStatus;
import com.example.org_membershipservice.entity.OrgInvite;
import com.example.org_membershipservice.entity.OrgMembership;
import com.example.org_membershipservice.entity.OrgRole;
import com.example.org_membershipservice.entity.OrgUnit;
import com.example.org_membershipservice.entity.User;
import com.example.org_membershipservice.entity.UserStatus;
import com.example.org_membershipservice.event.AuditAction;
import com.example.org_membershipservice.event.OrgAuditRecorder;
import com.example.org_membershipservice.exception.ConflictException;
import com.example.org_membershipservice.exception.ForbiddenException;
import com.example.org_membershipservice.exception.InviteExpiredException;
import com.example.org_membershipservice.exception.ResourceNotFoundException;
import com.example.org_membershipservice.repository.OrgInviteRepository;
import com.example.org_membershipservice.repository.OrgMembershipRepository;
import com.example.org_membershipservice.repository.OrgUnitRepository;
import com.example.org_membershipservice.repository.UserRepository;
import com.example.org_membershipservice.security.CurrentActor;
import com.example.org_membershipservice.service.OrgInviteService;
import com.example.org_membershipservice.service.PermissionResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Implementation of OrgInviteService.
 * Business Rules:
 * - only coordinators (or admins) invite, and only users who are not members yet
 * - one PENDING invite per (unit, invitee), enforced by a partial unique index
 * - expiry is evaluated lazily, there is no background job
 * - a terminal invite is never changed again
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class OrgInviteServiceImpl implements OrgInviteService {

    static final int SEARCH_LIMIT = 20;
    static final int SEARCH_MIN_QUERY_LENGTH = 2;

    private final OrgInviteRepository inviteRepository;
    private final OrgUnitRepository unitRepository;
    private final OrgMembershipRepository membershipRepository;
    private final UserRepository userRepository;
    private final PermissionResolver permissionResolver;
    private final OrgAuditRecorder auditRecorder;
    private final OrgProperties orgProperties;

    @Override
    @Transactional
    public InviteResponse sendInvite(CurrentActor actor, UUID unitId, SendInviteRequest request) {
        UUID inviteeId = request.getUserId();
        log.info("Sending invite: actor={}, unitId={}, invitee={}", actor.getUserId(), unitId, inviteeId);

        OrgUnit unit = unitRepository.findByIdForUpdate(unitId)
                .filter(OrgUnit::isActive)
                .orElseThrow(() -> ResourceNotFoundException.unitNotFound(unitId));
        permissionResolver.assertVisibleForMutation(actor, unit);
        permissionResolver.assertCoordinatorAuthority(actor, unit);

        userRepository.findById(inviteeId)
                .filter(User::isActive)
                .orElseThrow(() -> ResourceNotFoundException.userNotFound(inviteeId));

        if (membershipRepository.existsByOrgUnitIdAndUserIdAndStatus(unitId, inviteeId, MembershipStatus.ACTIVE)) {
            throw ConflictException.alreadyMember(inviteeId, unitId);
        }

        Instant now = Instant.now();
        inviteRepository.findByOrgUnitIdAndInvitedUserIdAndStatus(unitId, inviteeId, InviteStatus.PENDING)
                .ifPresent(existing -> {
                    if (!existing.isExpiredAt(now)) {
                        throw ConflictException.inviteExists(inviteeId, unitId);
                    }
                    // stale pending invite: close it so the new one fits the unique index
                    existing.expire();
                    inviteRepository.saveAndFlush(existing);
                    auditRecorder.record(actor.getUserId(), AuditAction.INVITE_EXPIRED, existing.getId(),
                            Map.of("orgUnitId", unitId));
                    log.info("Expired stale invite {} before re-inviting {}", existing.getId(), inviteeId);
                });

        OrgRole role = request.getRole() != null ? request.getRole() : OrgRole.MEMBER;
        OrgInvite invite = OrgInvite.builder()
                .orgUnitId(unitId)
                .invitedUserId(inviteeId)
                .invitedByUserId(actor.getUserId())
                .role(role)
                .message(request.getMessage())
                .createdAt(now)
                .expiresAt(now.plus(Duration.ofDays(orgProperties.getInviteExpirationDays())))
                .build();

        try {
            invite = inviteRepository.saveAndFlush(invite);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent invite for unitId={}, invitee={}", unitId, inviteeId);
            throw ConflictException.inviteExists(inviteeId, unitId);
        }

        auditRecorder.record(actor.getUserId(), AuditAction.INVITE_SENT, invite.getId(),
                Map.of("orgUnitId", unitId, "invitedUserId", inviteeId, "role", role));

        log.info("Invite sent: inviteId={}, unitId={}, role={}", invite.getId(), unitId, role);
        return InviteResponse.from(invite);
    }

    @Override
    @Transactional(noRollbackFor = InviteExpiredException.class)
    public InviteResponse respondToInvite(CurrentActor actor, UUID inviteId, boolean accept) {
        log.info("Responding to invite: actor={}, inviteId={}, accept={}", actor.getUserId(), inviteId, accept);

        OrgInvite invite = inviteRepository.findByIdForUpdate(inviteId)
                .orElseThrow(() -> ResourceNotFoundException.inviteNotFound(inviteId));

        if (!invite.getInvitedUserId().equals(actor.getUserId())) {
            log.warn("User {} tried to answer invite {} addressed to {}",
                    actor.getUserId(), inviteId, invite.getInvitedUserId());
            throw ForbiddenException.notInvitee(inviteId);
        }
        if (!invite.isPending()) {
            throw ConflictException.notPending(inviteId, invite.getStatus());
        }

        Instant now = Instant.now();
        if (invite.isExpiredAt(now)) {
            invite.expire();
            inviteRepository.save(invite);
            auditRecorder.record(actor.getUserId(), AuditAction.INVITE_EXPIRED, inviteId,
                    Map.of("orgUnitId", invite.getOrgUnitId()));
            log.warn("Invite {} expired at {}, response refused", inviteId, invite.getExpiresAt());
            throw new InviteExpiredException(inviteId);
        }

        UUID unitId = invite.getOrgUnitId();
        if (!accept) {
            invite.reject(now);
            invite = inviteRepository.save(invite);
            auditRecorder.record(actor.getUserId(), AuditAction.INVITE_REJECTED, inviteId,
                    Map.of("orgUnitId", unitId));
            log.info("Invite rejected: inviteId={}", inviteId);
            return InviteResponse.from(invite);
        }

        unitRepository.findByIdAndActiveTrue(unitId)
                .orElseThrow(() -> ResourceNotFoundException.unitNotFound(unitId));
        if (membershipRepository.existsByOrgUnitIdAndUserIdAndStatus(unitId, actor.getUserId(), MembershipStatus.ACTIVE)) {
            throw ConflictException.alreadyMember(actor.getUserId(), unitId);
        }

        OrgMembership membership = OrgMembership.builder()
                .userId(actor.getUserId())
                .orgUnitId(unitId)
                .role(invite.getRole())
                .inviteId(inviteId)
                .joinedAt(now)
                .build();
        try {
            membershipRepository.saveAndFlush(membership);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent join for unitId={}, userId={}", unitId, actor.getUserId());
            throw ConflictException.alreadyMember(actor.getUserId(), unitId);
        }

        invite.accept(now);
        invite = inviteRepository.save(invite);
        auditRecorder.record(actor.getUserId(), AuditAction.INVITE_ACCEPTED, inviteId,
                Map.of("orgUnitId", unitId, "membershipId", membership.getId(), "role", invite.getRole()));

        log.info("Invite accepted: inviteId={}, membershipId={}", inviteId, membership.getId());
        return InviteResponse.from(invite);
    }

    @Override
    @Transactional
    public InviteResponse cancelInvite(CurrentActor actor, UUID inviteId) {
        log.info("Cancelling invite: actor={}, inviteId={}", actor.getUserId(), inviteId);

        OrgInvite invite = inviteRepository.findByIdForUpdate(inviteId)
                .orElseThrow(() -> ResourceNotFoundException.inviteNotFound(inviteId));

        if (!invite.getInvitedByUserId().equals(actor.getUserId())) {
            OrgUnit unit = unitRepository.findById(invite.getOrgUnitId())
                    .orElseThrow(() -> ResourceNotFoundException.unitNotFound(invite.getOrgUnitId()));
            permissionResolver.assertVisibleForMutation(actor, unit);
            permissionResolver.assertCoordinatorAuthority(actor, unit);
        }
        if (!invite.isPending()) {
            throw ConflictException.notPending(inviteId, invite.getStatus());
        }

        invite.cancel();
        OrgInvite saved = inviteRepository.save(invite);
        auditRecorder.record(actor.getUserId(), AuditAction.INVITE_CANCELLED, inviteId,
                Map.of("orgUnitId", saved.getOrgUnitId()));

        log.info("Invite cancelled: inviteId={}", inviteId);
        return InviteResponse.from(saved);
    }

    @Override
    public List<InviteResponse> listUnitPendingInvites(CurrentActor actor, UUID unitId) {
        OrgUnit unit = loadActiveUnit(unitId);
        permissionResolver.assertCanView(actor, unit);
        permissionResolver.assertCoordinatorAuthority(actor, unit);

        return inviteRepository
                .findAllByOrgUnitIdAndStatusAndExpiresAtAfterOrderByCreatedAtDesc(unitId, InviteStatus.PENDING, Instant.now())
                .stream()
                .map(InviteResponse::from)
                .toList();
    }

    @Override
    public List<InviteResponse> listMyPendingInvites(CurrentActor actor) {
        List<OrgInvite> invites = inviteRepository
                .findAllByInvitedUserIdAndStatusAndExpiresAtAfterOrderByCreatedAtDesc(
                        actor.getUserId(), InviteStatus.PENDING, Instant.now());
        if (invites.isEmpty()) {
            return Collections.emptyList();
        }

        Set<UUID> unitIds = invites.stream().map(OrgInvite::getOrgUnitId).collect(Collectors.toSet());
        Map<UUID, OrgUnit> units = unitRepository.findAllById(unitIds).stream()
                .filter(OrgUnit::isActive)
                .collect(Collectors.toMap(OrgUnit::getId, Function.identity()));

        return invites.stream()
                .filter(invite -> units.containsKey(invite.getOrgUnitId()))
                .map(invite -> InviteResponse.from(invite, units.get(invite.getOrgUnitId())))
                .toList();
    }

    @Override
    public List<UserSummaryResponse> searchUsersForInvite(CurrentActor actor, UUID unitId, String query) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.length() < SEARCH_MIN_QUERY_LENGTH) {
            return Collections.emptyList();
        }

        OrgUnit unit = loadActiveUnit(unitId);
        permissionResolver.assertCanView(actor, unit);
        permissionResolver.assertCoordinatorAuthority(actor, unit);

        Set<UUID> excluded = new HashSet<>(
                membershipRepository.findUserIdsByOrgUnitIdAndStatus(unitId, MembershipStatus.ACTIVE));
        excluded.addAll(inviteRepository.findOpenInviteeIds(unitId, InviteStatus.PENDING, Instant.now()));

        String pattern = escapeLike(trimmed);
        PageRequest limit = PageRequest.of(0, SEARCH_LIMIT);
        List<User> users = excluded.isEmpty()
                ? userRepository.searchByName(pattern, UserStatus.ACTIVE, limit)
                : userRepository.searchByNameExcluding(pattern, UserStatus.ACTIVE, excluded, limit);

        return users.stream()
                .map(UserSummaryResponse::from)
                .toList();
    }

    static String escapeLike(String value) {
        return value.replace("!", "!!")
                .replace("%", "!%")
                .replace("_", "!_");
    }

    private OrgUnit loadActiveUnit(UUID unitId) {
        return unitRepository.findByIdAndActiveTrue(unitId)
                .orElseThrow(() -> ResourceNotFoundException.unitNotFound(unitId));
    }
}
