package com.example.org_membershipservice.service;

import com.example.org_membershipservice.dto.response.OrgTreeResponse;
import com.example.org_membershipservice.dto.response.OrgUnitResponse;
import com.example.org_membershipservice.security.CurrentActor;

import java.util.List;
import java.util.UUID;

/**
 * Read-side assembly of the org tree.
 */
public interface OrgTreeService {

    /**
     * Tree from the root, depth-bounded.
     * @param visibleOnly prune units the actor cannot see; false is honoured for admins only
     */
    OrgTreeResponse getTree(CurrentActor actor, boolean visibleOnly);

    OrgTreeResponse getSubtree(CurrentActor actor, UUID unitId, boolean visibleOnly);

    /**
     * Parent chain, immediate parent first, root last.
     */
    List<OrgUnitResponse> getAncestors(CurrentActor actor, UUID unitId);
}
