package com.example.org_membershipservice.service;

import com.example.org_membershipservice.entity.MembershipStatus;
import com.example.org_membershipservice.entity.OrgRole;
import com.example.org_membershipservice.entity.OrgUnit;
import com.example.org_membershipservice.entity.OrgUnitType;
import com.example.org_membershipservice.exception.ForbiddenException;
import com.example.org_membershipservice.policy.HierarchyPolicy;
import com.example.org_membershipservice.repository.OrgMembershipRepository;
import com.example.org_membershipservice.security.CurrentActor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Combines membership, unit visibility and global roles into capabilities.
 *
 * Rules:
 * - admin: DEV or ADMIN global role
 * - view / view members: PUBLIC unit, or member, or admin
 * - invite / edit / manage members / create children: coordinator or admin
 *
 * The assert* methods raise PERMISSION_DENIED and are what the services call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PermissionResolver {

    private final OrgMembershipRepository membershipRepository;
    private final HierarchyPolicy hierarchyPolicy;

    public UnitPermissions resolve(CurrentActor actor, OrgUnit unit) {
        boolean admin = actor.isAdmin();
        boolean member = isMember(actor.getUserId(), unit.getId());
        boolean coordinator = member && isCoordinator(actor.getUserId(), unit.getId());
        boolean canView = !unit.isRestricted() || member || admin;
        boolean canManage = coordinator || admin;

        List<OrgUnitType> allowedChildTypes = canManage
                ? hierarchyPolicy.allowedChildTypes(unit.getType())
                : Collections.emptyList();

        return UnitPermissions.builder()
                .orgUnitId(unit.getId())
                .canView(canView)
                .canViewMembers(canView)
                .canInvite(canManage)
                .canCreateChild(!allowedChildTypes.isEmpty())
                .allowedChildTypes(allowedChildTypes)
                .canEdit(canManage)
                .canManageMembers(canManage)
                .coordinator(coordinator)
                .member(member)
                .admin(admin)
                .build();
    }

    public boolean isMember(UUID userId, UUID unitId) {
        return membershipRepository.existsByOrgUnitIdAndUserIdAndStatus(
                unitId, userId, MembershipStatus.ACTIVE);
    }

    public boolean isCoordinator(UUID userId, UUID unitId) {
        return membershipRepository.existsByOrgUnitIdAndUserIdAndRoleAndStatus(
                unitId, userId, OrgRole.COORDINATOR, MembershipStatus.ACTIVE);
    }

    /**
     * Coordinator of the unit, or holder of an elevated global role.
     */
    public boolean hasCoordinatorAuthority(CurrentActor actor, UUID unitId) {
        return actor.isAdmin() || isCoordinator(actor.getUserId(), unitId);
    }

    public boolean canView(CurrentActor actor, OrgUnit unit) {
        return !unit.isRestricted() || actor.isAdmin() || isMember(actor.getUserId(), unit.getId());
    }

    public void assertCanView(CurrentActor actor, OrgUnit unit) {
        if (!canView(actor, unit)) {
            log.warn("View denied: userId={}, unitId={}", actor.getUserId(), unit.getId());
            throw ForbiddenException.restrictedUnit(unit.getId());
        }
    }

    /**
     * Gate evaluated before any mutation on a unit: a RESTRICTED unit only
     * accepts mutations from its members and admins.
     */
    public void assertVisibleForMutation(CurrentActor actor, OrgUnit unit) {
        assertCanView(actor, unit);
    }

    public void assertCoordinatorAuthority(CurrentActor actor, OrgUnit unit) {
        if (!hasCoordinatorAuthority(actor, unit.getId())) {
            log.warn("Coordinator authority required: userId={}, unitId={}", actor.getUserId(), unit.getId());
            throw ForbiddenException.notCoordinator(unit.getId());
        }
    }
}
