package com.example.org_membershipservice.service;

import com.example.org_membershipservice.dto.request.CreateOrgUnitRequest;
import com.example.org_membershipservice.dto.request.CreateRootUnitRequest;
import com.example.org_membershipservice.dto.request.UpdateOrgUnitRequest;
import com.example.org_membershipservice.dto.response.OrgUnitResponse;
import com.example.org_membershipservice.dto.response.PermissionsResponse;
import com.example.org_membershipservice.security.CurrentActor;

import java.util.UUID;

/**
 * Service interface for org unit lifecycle.
 */
public interface OrgUnitService {

    /**
     * Create the root council. Requires DEV; fails ALREADY_EXISTS when an active root exists.
     * The creator becomes its first coordinator.
     */
    OrgUnitResponse createRoot(CurrentActor actor, CreateRootUnitRequest request);

    /**
     * Create a child unit under an active parent.
     * The creator and any known extra coordinators become coordinators of the new unit.
     */
    OrgUnitResponse createChild(CurrentActor actor, UUID parentId, CreateOrgUnitRequest request);

    OrgUnitResponse getUnit(CurrentActor actor, UUID unitId);

    /**
     * Update name, description or visibility. The slug never changes.
     */
    OrgUnitResponse updateUnit(CurrentActor actor, UUID unitId, UpdateOrgUnitRequest request);

    /**
     * Soft delete a unit without active children. Its pending invites are cancelled.
     */
    void deactivateUnit(CurrentActor actor, UUID unitId);

    PermissionsResponse getPermissions(CurrentActor actor, UUID unitId);
}
