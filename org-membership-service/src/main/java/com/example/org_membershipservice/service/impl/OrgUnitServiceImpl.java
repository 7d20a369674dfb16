package com.example.org_membershipservice.service.impl;

import com.example.org_membershipservice.dto.request.CreateOrgUnitRequest;
import com.example.org_membershipservice.dto.request.CreateRootUnitRequest;
import com.example.org_membershipservice.dto.request.UpdateOrgUnitRequest;
import com.example.org_membershipservice.dto.response.OrgUnitResponse;
import com.example.org_membershipservice.dto.response.PermissionsResponse;
import com.example.org_membershipservice.entity.GlobalRole;
import com.example.org_membershipservice.entity.GroupSubtype;
import com.example.org_membershipservice.entity.InviteStatus;
import com.example.org_membershipservice.entity.OrgInvite;
import com.example.org_membershipservice.entity.OrgMembership;
import com.example.org_membershipservice.entity.OrgRole;
import com.example.org_membershipservice.entity.OrgUnit;
import com.example.org_membershipservice.entity.OrgUnitType;
import com.example.org_membershipservice.entity.User;
import com.example.org_membershipservice.entity.Visibility;
import com.example.org_membershipservice.event.AuditAction;
import com.example.org_membershipservice.event.OrgAuditRecorder;
import com.example.org_membershipservice.exception.ConflictException;
import com.example.org_membershipservice.exception.ForbiddenException;
import com.example.org_membershipservice.exception.ResourceNotFoundException;
import com.example.org_membershipservice.policy.HierarchyPolicy;
import com.example.org_membershipservice.policy.SlugAllocator;
import com.example.org_membershipservice.repository.OrgInviteRepository;
import com.example.org_membershipservice.repository.OrgMembershipRepository;
import com.example.org_membershipservice.repository.OrgUnitRepository;
import com.example.org_membershipservice.repository.UserRepository;
import com.example.org_membershipservice.security.CurrentActor;
import com.example.org_membershipservice.service.OrgUnitService;
import com.example.org_membershipservice.service.PermissionResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Implementation of OrgUnitService.
 * Business Rules:
 * - one active COUNCIL root (checked here, backed by a partial unique index)
 * - child types follow HierarchyPolicy
 * - slugs are allocated once and never change
 * - units are deactivated, never deleted
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class OrgUnitServiceImpl implements OrgUnitService {

    private final OrgUnitRepository unitRepository;
    private final OrgMembershipRepository membershipRepository;
    private final OrgInviteRepository inviteRepository;
    private final UserRepository userRepository;
    private final HierarchyPolicy hierarchyPolicy;
    private final SlugAllocator slugAllocator;
    private final PermissionResolver permissionResolver;
    private final OrgAuditRecorder auditRecorder;

    @Override
    @Transactional
    public OrgUnitResponse createRoot(CurrentActor actor, CreateRootUnitRequest request) {
        log.info("Creating root council: actor={}, name={}", actor.getUserId(), request.getName());

        hierarchyPolicy.validateChildCreation(actor.getGlobalRoles(), false, null, OrgUnitType.COUNCIL, null);

        if (unitRepository.existsByTypeAndParentIdIsNullAndActiveTrue(OrgUnitType.COUNCIL)) {
            log.warn("Root council already exists, refusing creation by {}", actor.getUserId());
            throw ConflictException.rootAlreadyExists();
        }

        OrgUnit root = persistUnit(actor, null, OrgUnitType.COUNCIL, null,
                request.getName(), request.getDescription(), request.getVisibility(),
                ConflictException::rootAlreadyExists);
        addCoordinators(root, actor.getUserId(), List.of());

        log.info("Root council created: id={}, slug={}", root.getId(), root.getSlug());
        return OrgUnitResponse.from(root);
    }

    @Override
    @Transactional
    public OrgUnitResponse createChild(CurrentActor actor, UUID parentId, CreateOrgUnitRequest request) {
        log.info("Creating child unit: actor={}, parentId={}, type={}",
                actor.getUserId(), parentId, request.getType());

        OrgUnit parent = lockActiveUnit(parentId);
        permissionResolver.assertVisibleForMutation(actor, parent);

        boolean coordinator = permissionResolver.hasCoordinatorAuthority(actor, parent.getId());
        if (request.getType() == null && !coordinator) {
            throw new ForbiddenException("Only coordinators of the parent unit can create child units");
        }
        OrgUnitType childType = request.getType() != null
                ? request.getType()
                : hierarchyPolicy.inferChildType(parent.getType(), request.getGroupSubtype());

        hierarchyPolicy.validateChildCreation(
                actor.getGlobalRoles(),
                coordinator,
                parent.getType(),
                childType,
                request.getGroupSubtype());

        OrgUnit child = persistUnit(actor, parent.getId(), childType, request.getGroupSubtype(),
                request.getName(), request.getDescription(), request.getVisibility(), null);
        int coordinators = addCoordinators(child, actor.getUserId(), request.getCoordinatorUserIds());

        log.info("Child unit created: id={}, type={}, parentId={}, coordinators={}",
                child.getId(), childType, parentId, coordinators);
        return OrgUnitResponse.from(child);
    }

    @Override
    public OrgUnitResponse getUnit(CurrentActor actor, UUID unitId) {
        OrgUnit unit = unitRepository.findByIdAndActiveTrue(unitId)
                .orElseThrow(() -> ResourceNotFoundException.unitNotFound(unitId));
        permissionResolver.assertCanView(actor, unit);
        return OrgUnitResponse.from(unit);
    }

    @Override
    @Transactional
    public OrgUnitResponse updateUnit(CurrentActor actor, UUID unitId, UpdateOrgUnitRequest request) {
        log.info("Updating unit: actor={}, unitId={}", actor.getUserId(), unitId);

        OrgUnit unit = lockActiveUnit(unitId);
        permissionResolver.assertVisibleForMutation(actor, unit);
        permissionResolver.assertCoordinatorAuthority(actor, unit);

        List<String> changed = new ArrayList<>();
        if (request.getName() != null && !request.getName().trim().equals(unit.getName())) {
            unit.setName(request.getName().trim());
            changed.add("name");
        }
        if (request.getDescription() != null && !request.getDescription().equals(unit.getDescription())) {
            unit.setDescription(request.getDescription());
            changed.add("description");
        }
        if (request.getVisibility() != null && request.getVisibility() != unit.getVisibility()) {
            unit.setVisibility(request.getVisibility());
            changed.add("visibility");
        }

        if (changed.isEmpty()) {
            log.info("Unit {} unchanged", unitId);
            return OrgUnitResponse.from(unit);
        }

        unit = unitRepository.save(unit);
        auditRecorder.record(actor.getUserId(), AuditAction.ORG_UNIT_UPDATED, unitId,
                Map.of("fields", String.join(",", changed)));

        log.info("Unit updated: unitId={}, fields={}", unitId, changed);
        return OrgUnitResponse.from(unit);
    }

    @Override
    @Transactional
    public void deactivateUnit(CurrentActor actor, UUID unitId) {
        log.info("Deactivating unit: actor={}, unitId={}", actor.getUserId(), unitId);

        OrgUnit unit = lockActiveUnit(unitId);
        permissionResolver.assertVisibleForMutation(actor, unit);
        if (unit.isRoot()) {
            if (!actor.hasRole(GlobalRole.DEV)) {
                throw ForbiddenException.roleRequired(GlobalRole.DEV.name());
            }
        } else {
            permissionResolver.assertCoordinatorAuthority(actor, unit);
        }

        if (unitRepository.existsByParentIdAndActiveTrue(unitId)) {
            log.warn("Unit {} still has active children, deactivation refused", unitId);
            throw ConflictException.unitHasActiveChildren(unitId);
        }

        List<OrgInvite> pending = inviteRepository.findAllByOrgUnitIdAndStatus(unitId, InviteStatus.PENDING);
        pending.forEach(invite -> {
            invite.cancel();
            auditRecorder.record(actor.getUserId(), AuditAction.INVITE_CANCELLED, invite.getId(),
                    Map.of("orgUnitId", unitId, "reason", "unit_deactivated"));
        });
        inviteRepository.saveAll(pending);

        unit.deactivate();
        unitRepository.save(unit);
        auditRecorder.record(actor.getUserId(), AuditAction.ORG_UNIT_DEACTIVATED, unitId,
                Map.of("type", unit.getType()));

        log.info("Unit deactivated: unitId={}, cancelledInvites={}", unitId, pending.size());
    }

    @Override
    public PermissionsResponse getPermissions(CurrentActor actor, UUID unitId) {
        OrgUnit unit = unitRepository.findByIdAndActiveTrue(unitId)
                .orElseThrow(() -> ResourceNotFoundException.unitNotFound(unitId));
        return PermissionsResponse.from(permissionResolver.resolve(actor, unit));
    }

    private OrgUnit lockActiveUnit(UUID unitId) {
        return unitRepository.findByIdForUpdate(unitId)
                .filter(OrgUnit::isActive)
                .orElseThrow(() -> ResourceNotFoundException.unitNotFound(unitId));
    }

    /**
     * Allocate the slug, insert the unit and flush so unique indexes are checked now.
     */
    private OrgUnit persistUnit(CurrentActor actor,
                                UUID parentId,
                                OrgUnitType type,
                                GroupSubtype groupSubtype,
                                String name,
                                String description,
                                Visibility visibility,
                                Supplier<ConflictException> onConflict) {
        String trimmedName = name.trim();
        String slug = slugAllocator.allocate(trimmedName, unitRepository::existsBySlug);

        OrgUnit unit = OrgUnit.builder()
                .type(type)
                .groupSubtype(groupSubtype)
                .name(trimmedName)
                .slug(slug)
                .description(description)
                .parentId(parentId)
                .visibility(visibility != null ? visibility : Visibility.PUBLIC)
                .createdBy(actor.getUserId())
                .build();

        try {
            unit = unitRepository.saveAndFlush(unit);
        } catch (DataIntegrityViolationException e) {
            log.warn("Unit insert rejected by a unique index: slug={}, type={}", slug, type);
            throw onConflict != null ? onConflict.get() : ConflictException.slugUnavailable(slug);
        }

        auditRecorder.record(actor.getUserId(), AuditAction.ORG_UNIT_CREATED, unit.getId(),
                metadata(type, parentId, groupSubtype));
        return unit;
    }

    private static Map<String, Object> metadata(OrgUnitType type, UUID parentId, GroupSubtype groupSubtype) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("type", type);
        metadata.put("parentId", parentId);
        metadata.put("groupSubtype", groupSubtype);
        return metadata;
    }

    /**
     * The creator always becomes coordinator. Extra ids are deduplicated and
     * unknown or inactive users are skipped without failing the request.
     *
     * @return number of coordinator memberships created
     */
    private int addCoordinators(OrgUnit unit, UUID creatorId, List<UUID> extraCoordinatorIds) {
        Set<UUID> coordinatorIds = new LinkedHashSet<>();
        coordinatorIds.add(creatorId);

        if (extraCoordinatorIds != null) {
            for (UUID userId : extraCoordinatorIds) {
                if (userId == null || coordinatorIds.contains(userId)) {
                    continue;
                }
                boolean known = userRepository.findById(userId)
                        .filter(User::isActive)
                        .isPresent();
                if (!known) {
                    log.info("Skipping unknown coordinator {} for unit {}", userId, unit.getId());
                    continue;
                }
                coordinatorIds.add(userId);
            }
        }

        List<OrgMembership> memberships = coordinatorIds.stream()
                .map(userId -> OrgMembership.builder()
                        .userId(userId)
                        .orgUnitId(unit.getId())
                        .role(OrgRole.COORDINATOR)
                        .build())
                .toList();
        membershipRepository.saveAll(memberships);
        return memberships.size();
    }
}
