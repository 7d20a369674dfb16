package com.example.org_membershipservice.service;

import com.example.org_membershipservice.entity.GlobalRole;
import com.example.org_membershipservice.entity.MembershipStatus;
import com.example.org_membershipservice.entity.OrgRole;
import com.example.org_membershipservice.entity.OrgUnit;
import com.example.org_membershipservice.entity.OrgUnitType;
import com.example.org_membershipservice.entity.Visibility;
import com.example.org_membershipservice.exception.ForbiddenException;
import com.example.org_membershipservice.policy.HierarchyPolicy;
import com.example.org_membershipservice.repository.OrgMembershipRepository;
import com.example.org_membershipservice.security.CurrentActor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PermissionResolverTest {

    @Mock
    private OrgMembershipRepository membershipRepository;

    private PermissionResolver resolver;

    private final UUID userId = UUID.randomUUID();
    private OrgUnit ministry;

    @BeforeEach
    void setUp() {
        resolver = new PermissionResolver(membershipRepository, new HierarchyPolicy());
        ministry = OrgUnit.builder()
                .id(UUID.randomUUID())
                .type(OrgUnitType.MINISTRY)
                .name("Music")
                .slug("music")
                .visibility(Visibility.RESTRICTED)
                .createdBy(UUID.randomUUID())
                .build();
    }

    @Test
    void restrictedUnit_nonMemberGetsNothing() {
        when(membershipRepository.existsByOrgUnitIdAndUserIdAndStatus(ministry.getId(), userId, MembershipStatus.ACTIVE))
                .thenReturn(false);

        UnitPermissions permissions = resolver.resolve(CurrentActor.of(userId), ministry);

        assertFalse(permissions.isCanView());
        assertFalse(permissions.isCanViewMembers());
        assertFalse(permissions.isCanInvite());
        assertFalse(permissions.isCanCreateChild());
        assertFalse(permissions.isCanEdit());
        assertFalse(permissions.isCanManageMembers());
        assertFalse(permissions.isCoordinator());
        assertFalse(permissions.isMember());
        assertTrue(permissions.getAllowedChildTypes().isEmpty());
        verify(membershipRepository, never()).existsByOrgUnitIdAndUserIdAndRoleAndStatus(any(), any(), any(), any());
    }

    @Test
    void plainMember_canViewButNotManage() {
        when(membershipRepository.existsByOrgUnitIdAndUserIdAndStatus(ministry.getId(), userId, MembershipStatus.ACTIVE))
                .thenReturn(true);
        when(membershipRepository.existsByOrgUnitIdAndUserIdAndRoleAndStatus(
                ministry.getId(), userId, OrgRole.COORDINATOR, MembershipStatus.ACTIVE))
                .thenReturn(false);

        UnitPermissions permissions = resolver.resolve(CurrentActor.of(userId), ministry);

        assertTrue(permissions.isCanView());
        assertTrue(permissions.isMember());
        assertFalse(permissions.isCanInvite());
        assertFalse(permissions.isCanEdit());
    }

    @Test
    void coordinator_managesAndCreatesAllowedChildren() {
        when(membershipRepository.existsByOrgUnitIdAndUserIdAndStatus(ministry.getId(), userId, MembershipStatus.ACTIVE))
                .thenReturn(true);
        when(membershipRepository.existsByOrgUnitIdAndUserIdAndRoleAndStatus(
                ministry.getId(), userId, OrgRole.COORDINATOR, MembershipStatus.ACTIVE))
                .thenReturn(true);

        UnitPermissions permissions = resolver.resolve(CurrentActor.of(userId), ministry);

        assertTrue(permissions.isCoordinator());
        assertTrue(permissions.isCanInvite());
        assertTrue(permissions.isCanManageMembers());
        assertTrue(permissions.isCanCreateChild());
        assertEquals(List.of(OrgUnitType.GROUP), permissions.getAllowedChildTypes());
        assertFalse(permissions.getAllowedChildTypes().contains(OrgUnitType.SECTOR));
    }

    @Test
    void admin_seesRestrictedUnitWithoutMembership() {
        when(membershipRepository.existsByOrgUnitIdAndUserIdAndStatus(ministry.getId(), userId, MembershipStatus.ACTIVE))
                .thenReturn(false);

        UnitPermissions permissions = resolver.resolve(CurrentActor.of(userId, GlobalRole.ADMIN), ministry);

        assertTrue(permissions.isAdmin());
        assertTrue(permissions.isCanView());
        assertTrue(permissions.isCanEdit());
        assertFalse(permissions.isMember());
    }

    @Test
    void groupUnit_neverOffersChildren() {
        OrgUnit group = OrgUnit.builder()
                .id(UUID.randomUUID())
                .type(OrgUnitType.GROUP)
                .name("Course")
                .slug("course")
                .createdBy(UUID.randomUUID())
                .build();

        UnitPermissions permissions = resolver.resolve(CurrentActor.of(userId, GlobalRole.DEV), group);

        assertTrue(permissions.isCanEdit());
        assertFalse(permissions.isCanCreateChild());
    }

    @Test
    void assertCanView_rejectsRestrictedUnitForOutsider() {
        ForbiddenException ex = assertThrows(ForbiddenException.class,
                () -> resolver.assertCanView(CurrentActor.of(userId), ministry));
        assertEquals(ForbiddenException.PERMISSION_DENIED, ex.getCode());
    }

    @Test
    void assertCoordinatorAuthority_skipsLookupForAdmins() {
        assertDoesNotThrow(() -> resolver.assertCoordinatorAuthority(CurrentActor.of(userId, GlobalRole.DEV), ministry));
        verifyNoInteractions(membershipRepository);
    }
}
