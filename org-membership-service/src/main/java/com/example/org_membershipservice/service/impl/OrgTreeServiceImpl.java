package com.example.org_membershipservice.service.impl;

import com.example.org_membershipservice.config.OrgProperties;
import com.example.org_membershipservice.dto.response.OrgTreeNodeResponse;
import com.example.org_membershipservice.dto.response.OrgTreeResponse;
import com.example.org_membershipservice.dto.response.OrgUnitResponse;
import com.example.org_membershipservice.entity.MembershipStatus;
import com.example.org_membershipservice.entity.OrgMembership;
import com.example.org_membershipservice.entity.OrgUnit;
import com.example.org_membershipservice.exception.ForbiddenException;
import com.example.org_membershipservice.exception.ResourceNotFoundException;
import com.example.org_membershipservice.repository.OrgMembershipRepository;
import com.example.org_membershipservice.repository.OrgMembershipRepository.UnitMemberCount;
import com.example.org_membershipservice.repository.OrgUnitRepository;
import com.example.org_membershipservice.security.CurrentActor;
import com.example.org_membershipservice.service.OrgTreeService;
import com.example.org_membershipservice.service.PermissionResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Implementation of OrgTreeService.
 *
 * The active forest is loaded with one query and indexed as a parent-id
 * adjacency map; member counts for the rendered nodes come from one grouped
 * count query. Nothing is fetched lazily while the tree is walked.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class OrgTreeServiceImpl implements OrgTreeService {

    private final OrgUnitRepository unitRepository;
    private final OrgMembershipRepository membershipRepository;
    private final PermissionResolver permissionResolver;
    private final OrgProperties orgProperties;

    @Override
    public OrgTreeResponse getTree(CurrentActor actor, boolean visibleOnly) {
        log.info("Building org tree: actor={}, visibleOnly={}", actor.getUserId(), visibleOnly);

        Forest forest = loadForest();
        TreeVisibility visibility = visibilityFor(actor, forest, visibleOnly);

        List<OrgUnit> roots = forest.childrenOf(null).stream()
                .filter(visibility::canTraverse)
                .toList();
        return render(forest, roots, visibility);
    }

    @Override
    public OrgTreeResponse getSubtree(CurrentActor actor, UUID unitId, boolean visibleOnly) {
        log.info("Building subtree: actor={}, unitId={}, visibleOnly={}", actor.getUserId(), unitId, visibleOnly);

        Forest forest = loadForest();
        OrgUnit start = forest.byId().get(unitId);
        if (start == null) {
            throw ResourceNotFoundException.unitNotFound(unitId);
        }

        TreeVisibility visibility = visibilityFor(actor, forest, visibleOnly);
        if (!visibility.canTraverse(start)) {
            throw ForbiddenException.restrictedUnit(unitId);
        }
        return render(forest, List.of(start), visibility);
    }

    @Override
    public List<OrgUnitResponse> getAncestors(CurrentActor actor, UUID unitId) {
        OrgUnit unit = unitRepository.findByIdAndActiveTrue(unitId)
                .orElseThrow(() -> ResourceNotFoundException.unitNotFound(unitId));
        permissionResolver.assertCanView(actor, unit);

        List<OrgUnitResponse> ancestors = new ArrayList<>();
        Set<UUID> seen = new HashSet<>();
        seen.add(unitId);
        UUID parentId = unit.getParentId();
        while (parentId != null && seen.add(parentId)) {
            OrgUnit parent = unitRepository.findById(parentId).orElse(null);
            if (parent == null) {
                log.warn("Dangling parent {} in ancestry of unit {}", parentId, unitId);
                break;
            }
            ancestors.add(OrgUnitResponse.from(parent));
            parentId = parent.getParentId();
        }
        return ancestors;
    }

    private Forest loadForest() {
        List<OrgUnit> units = unitRepository.findAllByActiveTrue();
        Map<UUID, OrgUnit> byId = units.stream()
                .collect(Collectors.toMap(OrgUnit::getId, Function.identity()));
        Map<UUID, List<OrgUnit>> children = new HashMap<>();
        for (OrgUnit unit : units) {
            children.computeIfAbsent(unit.getParentId(), k -> new ArrayList<>()).add(unit);
        }
        children.values().forEach(list -> list.sort(Comparator.comparing(OrgUnit::getName)));
        return new Forest(byId, children);
    }

    /**
     * A RESTRICTED unit is traversable by admins, by its members and by members
     * of any of its descendants. PUBLIC units are always traversable.
     * visibleOnly=false only widens the view for admins; everyone else always
     * gets the pruned tree.
     */
    private TreeVisibility visibilityFor(CurrentActor actor, Forest forest, boolean visibleOnly) {
        if (actor.isAdmin()) {
            return TreeVisibility.ALL;
        }
        if (!visibleOnly) {
            log.debug("Ignoring visibleOnly=false for non-admin actor {}", actor.getUserId());
        }
        Set<UUID> visible = new HashSet<>();
        List<OrgMembership> memberships = membershipRepository
                .findAllByUserIdAndStatus(actor.getUserId(), MembershipStatus.ACTIVE);
        for (OrgMembership membership : memberships) {
            UUID current = membership.getOrgUnitId();
            while (current != null && visible.add(current)) {
                OrgUnit unit = forest.byId().get(current);
                current = unit != null ? unit.getParentId() : null;
            }
        }
        return new TreeVisibility(visible);
    }

    private OrgTreeResponse render(Forest forest, List<OrgUnit> starts, TreeVisibility visibility) {
        int maxDepth = orgProperties.getTreeMaxDepth();

        Set<UUID> included = new LinkedHashSet<>();
        for (OrgUnit start : starts) {
            collect(forest, start, 1, maxDepth, visibility, included);
        }

        Map<UUID, Long> counts = included.isEmpty()
                ? Collections.emptyMap()
                : membershipRepository.countMembersByUnitIds(included, MembershipStatus.ACTIVE).stream()
                        .collect(Collectors.toMap(UnitMemberCount::getOrgUnitId, UnitMemberCount::getMemberCount));

        List<OrgTreeNodeResponse> nodes = starts.stream()
                .map(start -> build(forest, start, 1, included, counts))
                .toList();

        return OrgTreeResponse.builder()
                .roots(nodes)
                .maxDepth(maxDepth)
                .build();
    }

    private void collect(Forest forest, OrgUnit unit, int depth, int maxDepth,
                         TreeVisibility visibility, Set<UUID> included) {
        included.add(unit.getId());
        if (depth >= maxDepth) {
            return;
        }
        for (OrgUnit child : forest.childrenOf(unit.getId())) {
            if (visibility.canTraverse(child)) {
                collect(forest, child, depth + 1, maxDepth, visibility, included);
            }
        }
    }

    private OrgTreeNodeResponse build(Forest forest, OrgUnit unit, int depth,
                                      Set<UUID> included, Map<UUID, Long> counts) {
        OrgTreeNodeResponse node = OrgTreeNodeResponse.from(unit, counts.getOrDefault(unit.getId(), 0L), depth);
        for (OrgUnit child : forest.childrenOf(unit.getId())) {
            if (included.contains(child.getId())) {
                node.getChildren().add(build(forest, child, depth + 1, included, counts));
            }
        }
        return node;
    }

    private record Forest(Map<UUID, OrgUnit> byId, Map<UUID, List<OrgUnit>> children) {

        List<OrgUnit> childrenOf(UUID parentId) {
            return children.getOrDefault(parentId, Collections.emptyList());
        }
    }

    private record TreeVisibility(Set<UUID> memberLineage) {

        static final TreeVisibility ALL = new TreeVisibility(null);

        boolean canTraverse(OrgUnit unit) {
            return memberLineage == null || !unit.isRestricted() || memberLineage.contains(unit.getId());
        }
    }
}
