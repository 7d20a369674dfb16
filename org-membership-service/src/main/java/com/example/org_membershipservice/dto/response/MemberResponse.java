package com.example.org_membershipservice.dto.response;

import com.example.org_membershipservice.entity.MembershipStatus;
import com.example.org_membershipservice.entity.OrgMembership;
import com.example.org_membershipservice.entity.OrgRole;
import com.example.org_membershipservice.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for a unit member.
 * fullName is null when the user is missing from the local replica.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberResponse {

    private UUID membershipId;
    private UUID userId;
    private String fullName;
    private UUID orgUnitId;
    private OrgRole role;
    private MembershipStatus status;
    private Instant joinedAt;
    private Instant leftAt;

    public static MemberResponse from(OrgMembership membership, User user) {
        return MemberResponse.builder()
                .membershipId(membership.getId())
                .userId(membership.getUserId())
                .fullName(user != null ? user.getFullName() : null)
                .orgUnitId(membership.getOrgUnitId())
                .role(membership.getRole())
                .status(membership.getStatus())
                .joinedAt(membership.getJoinedAt())
                .leftAt(membership.getLeftAt())
                .build();
    }
}
