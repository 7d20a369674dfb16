package com.example.org_membershipservice.policy;

import com.example.org_membershipservice.entity.GlobalRole;
import com.example.org_membershipservice.entity.GroupSubtype;
import com.example.org_membershipservice.entity.OrgUnitType;
import com.example.org_membershipservice.exception.BadRequestException;
import com.example.org_membershipservice.exception.ForbiddenException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed parent to child rules of the org tree.
 *
 * COUNCIL -> EXECUTIVE_COUNCIL -> SECTOR -> {MINISTRY, GROUP}, MINISTRY -> GROUP.
 * GROUP is a leaf. COUNCIL has no parent and is created by DEV only.
 *
 * Stateless: callers pass in everything the decision depends on.
 */
@Component
public class HierarchyPolicy {

    private static final Map<OrgUnitType, List<OrgUnitType>> ALLOWED_CHILDREN = new EnumMap<>(OrgUnitType.class);

    static {
        ALLOWED_CHILDREN.put(OrgUnitType.COUNCIL, List.of(OrgUnitType.EXECUTIVE_COUNCIL));
        ALLOWED_CHILDREN.put(OrgUnitType.EXECUTIVE_COUNCIL, List.of(OrgUnitType.SECTOR));
        ALLOWED_CHILDREN.put(OrgUnitType.SECTOR, List.of(OrgUnitType.MINISTRY, OrgUnitType.GROUP));
        ALLOWED_CHILDREN.put(OrgUnitType.MINISTRY, List.of(OrgUnitType.GROUP));
        ALLOWED_CHILDREN.put(OrgUnitType.GROUP, Collections.emptyList());
    }

    enum Verdict {
        ALLOWED,
        PERMISSION_DENIED,
        INVALID_HIERARCHY,
        INVALID_FIELD
    }

    /**
     * Child types a unit of the given type may hold, in preference order.
     */
    public List<OrgUnitType> allowedChildTypes(OrgUnitType parentType) {
        return ALLOWED_CHILDREN.getOrDefault(parentType, Collections.emptyList());
    }

    public boolean isAllowedChild(OrgUnitType parentType, OrgUnitType childType) {
        return allowedChildTypes(parentType).contains(childType);
    }

    /**
     * @param parentType null when no parent is named (root creation)
     */
    public boolean canCreateChild(Set<GlobalRole> actorGlobalRoles,
                                  boolean actorIsCoordinatorOfParent,
                                  OrgUnitType parentType,
                                  OrgUnitType childType,
                                  GroupSubtype groupSubtype) {
        return evaluate(actorGlobalRoles, actorIsCoordinatorOfParent, parentType, childType, groupSubtype)
                == Verdict.ALLOWED;
    }

    /**
     * Same decision as {@link #canCreateChild}, raised as the matching business error.
     */
    public void validateChildCreation(Set<GlobalRole> actorGlobalRoles,
                                      boolean actorIsCoordinatorOfParent,
                                      OrgUnitType parentType,
                                      OrgUnitType childType,
                                      GroupSubtype groupSubtype) {
        Verdict verdict = evaluate(actorGlobalRoles, actorIsCoordinatorOfParent,
                parentType, childType, groupSubtype);
        switch (verdict) {
            case ALLOWED -> { }
            case PERMISSION_DENIED -> throw childType == OrgUnitType.COUNCIL
                    ? ForbiddenException.roleRequired(GlobalRole.DEV.name())
                    : new ForbiddenException(
                            String.format("Only coordinators of the parent unit can create a %s", childType));
            case INVALID_HIERARCHY -> throw BadRequestException.invalidHierarchy(parentType, childType);
            case INVALID_FIELD -> throw groupSubtype == null
                    ? BadRequestException.invalidField("groupSubtype", "required when type is GROUP")
                    : BadRequestException.invalidField("groupSubtype", "only allowed when type is GROUP");
        }
    }

    /**
     * Child type when the caller did not name one: GROUP when a subtype is given,
     * otherwise the parent's first allowed child type.
     */
    public OrgUnitType inferChildType(OrgUnitType parentType, GroupSubtype groupSubtype) {
        List<OrgUnitType> allowed = allowedChildTypes(parentType);
        if (allowed.isEmpty()) {
            throw new BadRequestException("INVALID_HIERARCHY",
                    String.format("A %s cannot have child units", parentType));
        }
        if (groupSubtype != null) {
            return OrgUnitType.GROUP;
        }
        return allowed.get(0);
    }

    Verdict evaluate(Set<GlobalRole> actorGlobalRoles,
                     boolean actorIsCoordinatorOfParent,
                     OrgUnitType parentType,
                     OrgUnitType childType,
                     GroupSubtype groupSubtype) {
        if (childType == OrgUnitType.COUNCIL) {
            if (parentType != null || !actorGlobalRoles.contains(GlobalRole.DEV)) {
                return Verdict.PERMISSION_DENIED;
            }
            return groupSubtype == null ? Verdict.ALLOWED : Verdict.INVALID_FIELD;
        }
        if (parentType == null) {
            return Verdict.INVALID_HIERARCHY;
        }
        if (!actorIsCoordinatorOfParent) {
            return Verdict.PERMISSION_DENIED;
        }
        if (!isAllowedChild(parentType, childType)) {
            return Verdict.INVALID_HIERARCHY;
        }
        boolean isGroup = childType == OrgUnitType.GROUP;
        if (isGroup != (groupSubtype != null)) {
            return Verdict.INVALID_FIELD;
        }
        return Verdict.ALLOWED;
    }
}
