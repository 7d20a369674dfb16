package com.example.org_membershipservice.service;

import com.example.org_membershipservice.dto.response.MemberResponse;
import com.example.org_membershipservice.dto.response.MyMembershipResponse;
import com.example.org_membershipservice.entity.OrgRole;
import com.example.org_membershipservice.security.CurrentActor;

import java.util.List;
import java.util.UUID;

/**
 * Service interface for membership management.
 * Every operation keeps at least one active coordinator on the unit.
 */
public interface OrgMembershipService {

    MemberResponse updateRole(CurrentActor actor, UUID unitId, UUID targetUserId, OrgRole newRole);

    /**
     * Remove a member. Targeting oneself is "leave" and needs no coordinator rights.
     */
    void removeMember(CurrentActor actor, UUID unitId, UUID targetUserId);

    void leaveUnit(CurrentActor actor, UUID unitId);

    List<MemberResponse> listMembers(CurrentActor actor, UUID unitId);

    List<MyMembershipResponse> listMyMemberships(CurrentActor actor);

    /**
     * Clean up after a user was deleted in identity-service.
     * Idempotent: a second call for the same user changes nothing.
     */
    void removeDeletedUser(UUID userId);
}
