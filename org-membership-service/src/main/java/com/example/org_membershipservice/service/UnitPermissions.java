package com.example.org_membershipservice.service;

import com.example.org_membershipservice.entity.OrgUnitType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Capability set of one actor on one unit.
 */
@Value
@Builder
public class UnitPermissions {

    UUID orgUnitId;
    boolean canView;
    boolean canViewMembers;
    boolean canInvite;
    boolean canCreateChild;
    List<OrgUnitType> allowedChildTypes;
    boolean canEdit;
    boolean canManageMembers;
    boolean coordinator;
    boolean member;
    boolean admin;
}
