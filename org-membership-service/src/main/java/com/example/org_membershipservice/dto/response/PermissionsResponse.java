package com.example.org_membershipservice.dto.response;

import com.example.org_membershipservice.entity.OrgUnitType;
import com.example.org_membershipservice.service.UnitPermissions;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Capabilities of the caller on a unit, used by clients to show or hide actions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PermissionsResponse {

    private UUID orgUnitId;
    private boolean canView;
    private boolean canViewMembers;
    private boolean canInvite;
    private boolean canCreateChild;
    private List<OrgUnitType> allowedChildTypes;
    private boolean canEdit;
    private boolean canManageMembers;

    @JsonProperty("isCoordinator")
    private boolean coordinator;

    @JsonProperty("isMember")
    private boolean member;

    @JsonProperty("isAdmin")
    private boolean admin;

    public static PermissionsResponse from(UnitPermissions permissions) {
        return PermissionsResponse.builder()
                .orgUnitId(permissions.getOrgUnitId())
                .canView(permissions.isCanView())
                .canViewMembers(permissions.isCanViewMembers())
                .canInvite(permissions.isCanInvite())
                .canCreateChild(permissions.isCanCreateChild())
                .allowedChildTypes(permissions.getAllowedChildTypes())
                .canEdit(permissions.isCanEdit())
                .canManageMembers(permissions.isCanManageMembers())
                .coordinator(permissions.isCoordinator())
                .member(permissions.isMember())
                .admin(permissions.isAdmin())
                .build();
    }
}
