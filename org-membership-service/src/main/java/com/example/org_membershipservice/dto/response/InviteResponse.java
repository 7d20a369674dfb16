package com.example.org_membershipservice.dto.response;

import com.example.org_membershipservice.entity.InviteStatus;
import com.example.org_membershipservice.entity.OrgInvite;
import com.example.org_membershipservice.entity.OrgRole;
import com.example.org_membershipservice.entity.OrgUnit;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InviteResponse {

    private UUID id;
    private UUID orgUnitId;
    private String orgUnitName;
    private UUID invitedUserId;
    private UUID invitedByUserId;
    private OrgRole role;
    private InviteStatus status;
    private String message;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant respondedAt;

    public static InviteResponse from(OrgInvite invite) {
        return InviteResponse.builder()
                .id(invite.getId())
                .orgUnitId(invite.getOrgUnitId())
                .invitedUserId(invite.getInvitedUserId())
                .invitedByUserId(invite.getInvitedByUserId())
                .role(invite.getRole())
                .status(invite.getStatus())
                .message(invite.getMessage())
                .createdAt(invite.getCreatedAt())
                .expiresAt(invite.getExpiresAt())
                .respondedAt(invite.getRespondedAt())
                .build();
    }

    /**
     * Variant for the invitee's inbox, which also shows the unit name.
     */
    public static InviteResponse from(OrgInvite invite, OrgUnit unit) {
        InviteResponse response = from(invite);
        if (unit != null) {
            response.setOrgUnitName(unit.getName());
        }
        return response;
    }
}
