package com.example.org_membershipservice.service.impl;

import com.example.org_membershipservice.dto.response.MemberResponse;
import com.example.org_membershipservice.dto.response.MyMembershipResponse;
import com.example.org_membershipservice.entity.InviteStatus;
import com.example.org_membershipservice.entity.MembershipStatus;
import com.example.org_membershipservice.entity.OrgInvite;
import com.example.org_membershipservice.entity.OrgMembership;
import com.example.org_membershipservice.entity.OrgRole;
import com.example.org_membershipservice.entity.OrgUnit;
import com.example.org_membershipservice.entity.User;
import com.example.org_membershipservice.event.AuditAction;
import com.example.org_membershipservice.event.OrgAuditRecorder;
import com.example.org_membershipservice.exception.ConflictException;
import com.example.org_membershipservice.exception.ResourceNotFoundException;
import com.example.org_membershipservice.repository.OrgInviteRepository;
import com.example.org_membershipservice.repository.OrgMembershipRepository;
import com.example.org_membershipservice.repository.OrgUnitRepository;
import com.example.org_membershipservice.repository.UserRepository;
import com.example.org_membershipservice.security.CurrentActor;
import com.example.org_membershipservice.service.OrgMembershipService;
import com.example.org_membershipservice.service.PermissionResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Implementation of OrgMembershipService.
 * Business Rules:
 * - a unit never loses its last active COORDINATOR through a role change or removal
 * - the coordinator count is read while holding the unit row lock
 * - removal is a soft delete (REMOVED + leftAt)
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class OrgMembershipServiceImpl implements OrgMembershipService {

    private final OrgMembershipRepository membershipRepository;
    private final OrgUnitRepository unitRepository;
    private final OrgInviteRepository inviteRepository;
    private final UserRepository userRepository;
    private final PermissionResolver permissionResolver;
    private final OrgAuditRecorder auditRecorder;

    @Override
    @Transactional
    public MemberResponse updateRole(CurrentActor actor, UUID unitId, UUID targetUserId, OrgRole newRole) {
        log.info("Updating role: actor={}, unitId={}, target={}, newRole={}",
                actor.getUserId(), unitId, targetUserId, newRole);

        OrgUnit unit = lockActiveUnit(unitId);
        permissionResolver.assertVisibleForMutation(actor, unit);
        permissionResolver.assertCoordinatorAuthority(actor, unit);

        OrgMembership membership = findActiveMembership(unitId, targetUserId);

        OrgRole previousRole = membership.getRole();
        if (previousRole == newRole) {
            log.info("User {} already has role {} in unit {}", targetUserId, newRole, unitId);
            return toMemberResponse(membership);
        }

        if (previousRole == OrgRole.COORDINATOR) {
            guardLastCoordinator(unitId);
        }

        membership.changeRole(newRole);
        membership = membershipRepository.save(membership);
        auditRecorder.record(actor.getUserId(), AuditAction.MEMBER_ROLE_UPDATED, membership.getId(),
                Map.of("orgUnitId", unitId, "userId", targetUserId,
                        "fromRole", previousRole, "toRole", newRole));

        log.info("Role updated: unitId={}, userId={}, {} -> {}", unitId, targetUserId, previousRole, newRole);
        return toMemberResponse(membership);
    }

    @Override
    @Transactional
    public void removeMember(CurrentActor actor, UUID unitId, UUID targetUserId) {
        boolean selfRemoval = actor.getUserId().equals(targetUserId);
        log.info("Removing member: actor={}, unitId={}, target={}, self={}",
                actor.getUserId(), unitId, targetUserId, selfRemoval);

        OrgUnit unit = lockActiveUnit(unitId);
        permissionResolver.assertVisibleForMutation(actor, unit);
        if (!selfRemoval) {
            permissionResolver.assertCoordinatorAuthority(actor, unit);
        }

        OrgMembership membership = findActiveMembership(unitId, targetUserId);
        if (membership.isCoordinator()) {
            guardLastCoordinator(unitId);
        }

        membership.remove();
        membershipRepository.save(membership);
        auditRecorder.record(actor.getUserId(),
                selfRemoval ? AuditAction.MEMBER_LEFT : AuditAction.MEMBER_REMOVED,
                membership.getId(),
                Map.of("orgUnitId", unitId, "userId", targetUserId, "role", membership.getRole()));

        log.info("Member removed: unitId={}, userId={}", unitId, targetUserId);
    }

    @Override
    @Transactional
    public void leaveUnit(CurrentActor actor, UUID unitId) {
        removeMember(actor, unitId, actor.getUserId());
    }

    @Override
    public List<MemberResponse> listMembers(CurrentActor actor, UUID unitId) {
        log.info("Listing members of unit {}", unitId);

        OrgUnit unit = unitRepository.findByIdAndActiveTrue(unitId)
                .orElseThrow(() -> ResourceNotFoundException.unitNotFound(unitId));
        permissionResolver.assertCanView(actor, unit);

        List<OrgMembership> memberships = membershipRepository
                .findAllByOrgUnitIdAndStatusOrderByRoleAscJoinedAtAsc(unitId, MembershipStatus.ACTIVE);
        if (memberships.isEmpty()) {
            return Collections.emptyList();
        }

        Set<UUID> userIds = memberships.stream().map(OrgMembership::getUserId).collect(Collectors.toSet());
        Map<UUID, User> users = userRepository.findAllByIdIn(userIds).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));

        return memberships.stream()
                .map(m -> MemberResponse.from(m, users.get(m.getUserId())))
                .toList();
    }

    @Override
    public List<MyMembershipResponse> listMyMemberships(CurrentActor actor) {
        List<OrgMembership> memberships = membershipRepository
                .findAllByUserIdAndStatus(actor.getUserId(), MembershipStatus.ACTIVE);
        if (memberships.isEmpty()) {
            return Collections.emptyList();
        }

        Set<UUID> unitIds = memberships.stream().map(OrgMembership::getOrgUnitId).collect(Collectors.toSet());
        Map<UUID, OrgUnit> units = unitRepository.findAllById(unitIds).stream()
                .filter(OrgUnit::isActive)
                .collect(Collectors.toMap(OrgUnit::getId, Function.identity()));

        return memberships.stream()
                .filter(m -> units.containsKey(m.getOrgUnitId()))
                .map(m -> MyMembershipResponse.from(m, units.get(m.getOrgUnitId())))
                .sorted(Comparator.comparing(MyMembershipResponse::getOrgUnitName))
                .toList();
    }

    /**
     * Handle user deletion by auto-promoting the most senior member
     * wherever the user was the last coordinator.
     * If no other member exists the unit is simply left empty.
     */
    @Override
    @Transactional
    public void removeDeletedUser(UUID userId) {
        log.info("Cleaning up deleted user: userId={}", userId);

        List<OrgInvite> pendingInvites = inviteRepository.findAllByInvitedUserIdAndStatus(userId, InviteStatus.PENDING);
        pendingInvites.forEach(invite -> {
            invite.cancel();
            auditRecorder.record(null, AuditAction.INVITE_CANCELLED, invite.getId(),
                    Map.of("orgUnitId", invite.getOrgUnitId(), "reason", "user_deleted"));
        });
        inviteRepository.saveAll(pendingInvites);

        // stable lock order across concurrent cleanups
        List<OrgMembership> memberships = membershipRepository
                .findAllByUserIdAndStatus(userId, MembershipStatus.ACTIVE).stream()
                .sorted(Comparator.comparing(OrgMembership::getOrgUnitId))
                .toList();

        for (OrgMembership membership : memberships) {
            UUID unitId = membership.getOrgUnitId();
            unitRepository.findByIdForUpdate(unitId);

            if (membership.isCoordinator()
                    && membershipRepository.countByOrgUnitIdAndRoleAndStatus(
                            unitId, OrgRole.COORDINATOR, MembershipStatus.ACTIVE) <= 1) {
                promoteSuccessor(unitId, userId);
            }

            membership.remove();
            membershipRepository.save(membership);
            auditRecorder.record(null, AuditAction.MEMBER_REMOVED, membership.getId(),
                    Map.of("orgUnitId", unitId, "userId", userId, "reason", "user_deleted"));
        }

        userRepository.findById(userId).ifPresent(user -> {
            user.softDelete();
            userRepository.save(user);
        });

        log.info("Deleted user cleaned up: userId={}, cancelledInvites={}, removedMemberships={}",
                userId, pendingInvites.size(), memberships.size());
    }

    /**
     * Strategy: promote the member with the earliest joinedAt.
     */
    private void promoteSuccessor(UUID unitId, UUID leavingUserId) {
        Optional<OrgMembership> successor = membershipRepository
                .findAllByOrgUnitIdAndStatusOrderByRoleAscJoinedAtAsc(unitId, MembershipStatus.ACTIVE).stream()
                .filter(m -> !m.getUserId().equals(leavingUserId))
                .min(Comparator.comparing(OrgMembership::getJoinedAt));

        if (successor.isEmpty()) {
            log.warn("Unit {} left without members after user {} was deleted", unitId, leavingUserId);
            return;
        }

        OrgMembership promoted = successor.get();
        promoted.changeRole(OrgRole.COORDINATOR);
        membershipRepository.save(promoted);
        auditRecorder.record(null, AuditAction.MEMBER_AUTO_PROMOTED, promoted.getId(),
                Map.of("orgUnitId", unitId, "userId", promoted.getUserId(), "replacedUserId", leavingUserId));

        log.info("Auto-promoted user {} to COORDINATOR in unit {}", promoted.getUserId(), unitId);
    }

    /**
     * Must run while the unit row is locked.
     */
    private void guardLastCoordinator(UUID unitId) {
        long coordinators = membershipRepository.countByOrgUnitIdAndRoleAndStatus(
                unitId, OrgRole.COORDINATOR, MembershipStatus.ACTIVE);
        if (coordinators <= 1) {
            log.warn("Last coordinator guard hit: unitId={}, coordinators={}", unitId, coordinators);
            throw ConflictException.lastCoordinator(unitId);
        }
    }

    private OrgUnit lockActiveUnit(UUID unitId) {
        return unitRepository.findByIdForUpdate(unitId)
                .filter(OrgUnit::isActive)
                .orElseThrow(() -> ResourceNotFoundException.unitNotFound(unitId));
    }

    private OrgMembership findActiveMembership(UUID unitId, UUID userId) {
        return membershipRepository.findByOrgUnitIdAndUserIdAndStatus(unitId, userId, MembershipStatus.ACTIVE)
                .orElseThrow(() -> ResourceNotFoundException.memberNotFound(userId, unitId));
    }

    private MemberResponse toMemberResponse(OrgMembership membership) {
        User user = userRepository.findById(membership.getUserId()).orElse(null);
        return MemberResponse.from(membership, user);
    }
}
