package com.example.org_membershipservice.service.impl;

import com.example.org_membershipservice.config.OrgProperties;
import com.example.org_membershipservice.dto.request.CreateOrgUnitRequest;
import com.example.org_membershipservice.dto.request.CreateRootUnitRequest;
import com.example.org_membershipservice.dto.request.SendInviteRequest;
import com.example.org_membershipservice.dto.response.InviteResponse;
import com.example.org_membershipservice.dto.response.OrgTreeNodeResponse;
import com.example.org_membershipservice.dto.response.OrgTreeResponse;
import com.example.org_membershipservice.dto.response.OrgUnitResponse;
import com.example.org_membershipservice.entity.GlobalRole;
import com.example.org_membershipservice.entity.GroupSubtype;
import com.example.org_membershipservice.entity.OrgRole;
import com.example.org_membershipservice.entity.User;
import com.example.org_membershipservice.entity.UserStatus;
import com.example.org_membershipservice.entity.Visibility;
import com.example.org_membershipservice.event.OrgAuditRecorder;
import com.example.org_membershipservice.exception.ForbiddenException;
import com.example.org_membershipservice.policy.HierarchyPolicy;
import com.example.org_membershipservice.policy.SlugAllocator;
import com.example.org_membershipservice.repository.UserRepository;
import com.example.org_membershipservice.security.CurrentActor;
import com.example.org_membershipservice.service.PermissionResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tree rendering: visibility pruning, inheritance through descendants,
 * depth bound and batched member counts.
 *
 * Layout:
 * Conselho -> Executiva -> Setor A (restricted) -> Ministerio A -> Grupo A
 *                       -> Setor B (restricted) -> Ministerio B
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({
    OrgTreeServiceImpl.class,
    OrgUnitServiceImpl.class,
    OrgInviteServiceImpl.class,
    PermissionResolver.class,
    HierarchyPolicy.class,
    SlugAllocator.class,
    OrgAuditRecorder.class,
    OrgProperties.class
})
class OrgTreeServiceImplTest {

    @Autowired
    private OrgTreeServiceImpl treeService;
    @Autowired
    private OrgUnitServiceImpl unitService;
    @Autowired
    private OrgInviteServiceImpl inviteService;
    @Autowired
    private UserRepository userRepository;
    @Autowired
    private OrgProperties orgProperties;

    private CurrentActor dev;
    private CurrentActor memberY;
    private CurrentActor outsider;

    private OrgUnitResponse root;
    private OrgUnitResponse executive;
    private OrgUnitResponse sectorA;
    private OrgUnitResponse sectorB;
    private OrgUnitResponse ministryA;

    @BeforeEach
    void setUp() {
        dev = CurrentActor.of(UUID.randomUUID(), GlobalRole.DEV);
        memberY = CurrentActor.of(seedUser("Yara").getId());
        outsider = CurrentActor.of(seedUser("Otto").getId());

        root = unitService.createRoot(dev, CreateRootUnitRequest.builder().name("Conselho").build());
        executive = unitService.createChild(dev, root.getId(), child("Executiva", Visibility.PUBLIC));
        sectorA = unitService.createChild(dev, executive.getId(), child("Setor A", Visibility.RESTRICTED));
        sectorB = unitService.createChild(dev, executive.getId(), child("Setor B", Visibility.RESTRICTED));
        ministryA = unitService.createChild(dev, sectorA.getId(), child("Ministerio A", Visibility.PUBLIC));
        unitService.createChild(dev, sectorB.getId(), child("Ministerio B", Visibility.PUBLIC));
        unitService.createChild(dev, ministryA.getId(), CreateOrgUnitRequest.builder()
                .name("Grupo A")
                .groupSubtype(GroupSubtype.DEEPENING)
                .build());

        InviteResponse invite = inviteService.sendInvite(dev, ministryA.getId(),
                SendInviteRequest.builder().userId(memberY.getUserId()).role(OrgRole.MEMBER).build());
        inviteService.respondToInvite(memberY, invite.getId(), true);
    }

    @AfterEach
    void restoreDepth() {
        orgProperties.setTreeMaxDepth(5);
    }

    @Test
    void memberOfDescendantTraversesRestrictedAncestor() {
        OrgTreeResponse tree = treeService.getTree(memberY, true);

        OrgTreeNodeResponse rootNode = single(tree.getRoots());
        OrgTreeNodeResponse executiveNode = single(rootNode.getChildren());
        OrgTreeNodeResponse sectorNode = single(executiveNode.getChildren());

        assertEquals(sectorA.getId(), sectorNode.getId());
        OrgTreeNodeResponse ministryNode = single(sectorNode.getChildren());
        assertEquals(ministryA.getId(), ministryNode.getId());
        assertEquals(2L, ministryNode.getMemberCount());
        assertEquals(4, ministryNode.getDepth());
        assertEquals(1, ministryNode.getChildren().size());
        assertEquals(5, ministryNode.getChildren().get(0).getDepth());
    }

    @Test
    void outsiderSeesOnlyPublicPath() {
        OrgTreeResponse tree = treeService.getTree(outsider, true);

        OrgTreeNodeResponse executiveNode = single(single(tree.getRoots()).getChildren());
        assertTrue(executiveNode.getChildren().isEmpty());
    }

    @Test
    void adminSeesEverythingWithOrWithoutFilter() {
        CurrentActor admin = CurrentActor.of(UUID.randomUUID(), GlobalRole.ADMIN);

        for (OrgTreeResponse tree : List.of(treeService.getTree(admin, true), treeService.getTree(admin, false))) {
            OrgTreeNodeResponse executiveNode = single(single(tree.getRoots()).getChildren());
            List<String> sectors = executiveNode.getChildren().stream().map(OrgTreeNodeResponse::getName).toList();
            assertEquals(List.of("Setor A", "Setor B"), sectors);
        }
    }

    @Test
    void outsiderCannotLiftPruningWithUnfilteredFlag() {
        OrgTreeResponse tree = treeService.getTree(outsider, false);

        OrgTreeNodeResponse executiveNode = single(single(tree.getRoots()).getChildren());
        assertTrue(executiveNode.getChildren().isEmpty());
    }

    @Test
    void unfilteredSubtreeStillHidesSiblingRestrictedBranches() {
        OrgTreeResponse tree = treeService.getSubtree(memberY, executive.getId(), false);

        List<UUID> sectors = single(tree.getRoots()).getChildren().stream()
                .map(OrgTreeNodeResponse::getId)
                .toList();
        assertEquals(List.of(sectorA.getId()), sectors);
    }

    @Test
    void depthIsBounded() {
        orgProperties.setTreeMaxDepth(3);

        OrgTreeResponse tree = treeService.getTree(dev, true);

        assertEquals(3, tree.getMaxDepth());
        OrgTreeNodeResponse executiveNode = single(single(tree.getRoots()).getChildren());
        assertEquals(2, executiveNode.getChildren().size());
        executiveNode.getChildren().forEach(sector -> assertTrue(sector.getChildren().isEmpty()));
    }

    @Test
    void subtreeOfRestrictedUnitRequiresLineage() {
        assertThrows(ForbiddenException.class, () -> treeService.getSubtree(memberY, sectorB.getId(), true));

        OrgTreeResponse subtree = treeService.getSubtree(memberY, sectorA.getId(), true);
        OrgTreeNodeResponse start = single(subtree.getRoots());
        assertEquals(sectorA.getId(), start.getId());
        assertEquals(1, start.getDepth());
    }

    @Test
    void deactivatedUnitsDisappear() {
        OrgUnitResponse lonely = unitService.createChild(dev, sectorB.getId(), child("Ministerio C", Visibility.PUBLIC));
        unitService.deactivateUnit(dev, lonely.getId());

        OrgTreeResponse tree = treeService.getSubtree(dev, sectorB.getId(), true);
        List<String> names = single(tree.getRoots()).getChildren().stream().map(OrgTreeNodeResponse::getName).toList();
        assertEquals(List.of("Ministerio B"), names);
    }

    @Test
    void ancestorsRunFromParentToRoot() {
        List<UUID> ancestors = treeService.getAncestors(memberY, ministryA.getId()).stream()
                .map(OrgUnitResponse::getId)
                .toList();

        assertEquals(List.of(sectorA.getId(), executive.getId(), root.getId()), ancestors);
        assertTrue(treeService.getAncestors(dev, root.getId()).isEmpty());
    }

    private static CreateOrgUnitRequest child(String name, Visibility visibility) {
        return CreateOrgUnitRequest.builder().name(name).visibility(visibility).build();
    }

    private static OrgTreeNodeResponse single(List<OrgTreeNodeResponse> nodes) {
        assertEquals(1, nodes.size(), "expected exactly one node");
        return nodes.get(0);
    }

    private User seedUser(String fullName) {
        UUID id = UUID.randomUUID();
        return userRepository.saveAndFlush(User.builder()
                .id(id)
                .email(id + "@example.com")
                .fullName(fullName)
                .status(UserStatus.ACTIVE)
                .build());
    }
}
