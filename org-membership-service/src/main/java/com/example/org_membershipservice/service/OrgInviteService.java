package com.example.org_membershipservice.service;

import com.example.org_membershipservice.dto.request.SendInviteRequest;
import com.example.org_membershipservice.dto.response.InviteResponse;
import com.example.org_membershipservice.dto.response.UserSummaryResponse;
import com.example.org_membershipservice.security.CurrentActor;

import java.util.List;
import java.util.UUID;

/**
 * Service interface for the invite workflow.
 */
public interface OrgInviteService {

    InviteResponse sendInvite(CurrentActor actor, UUID unitId, SendInviteRequest request);

    /**
     * Accept or reject a pending invite addressed to the actor.
     * An invite past its expiry is moved to EXPIRED and INVITE_EXPIRED is raised.
     */
    InviteResponse respondToInvite(CurrentActor actor, UUID inviteId, boolean accept);

    /**
     * Withdraw a pending invite. Allowed for the inviter and the unit's coordinators.
     */
    InviteResponse cancelInvite(CurrentActor actor, UUID inviteId);

    List<InviteResponse> listUnitPendingInvites(CurrentActor actor, UUID unitId);

    List<InviteResponse> listMyPendingInvites(CurrentActor actor);

    /**
     * Active users matching the query who are neither members nor already invited.
     * Queries shorter than 2 characters return an empty list.
     */
    List<UserSummaryResponse> searchUsersForInvite(CurrentActor actor, UUID unitId, String query);
}
