package com.example.org_membershipservice.dto.response;

import com.example.org_membershipservice.entity.OrgMembership;
import com.example.org_membershipservice.entity.OrgRole;
import com.example.org_membershipservice.entity.OrgUnit;
import com.example.org_membershipservice.entity.OrgUnitType;
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
public class MyMembershipResponse {

    private UUID membershipId;
    private UUID orgUnitId;
    private String orgUnitName;
    private String orgUnitSlug;
    private OrgUnitType orgUnitType;
    private OrgRole role;
    private Instant joinedAt;

    public static MyMembershipResponse from(OrgMembership membership, OrgUnit unit) {
        return MyMembershipResponse.builder()
                .membershipId(membership.getId())
                .orgUnitId(unit.getId())
                .orgUnitName(unit.getName())
                .orgUnitSlug(unit.getSlug())
                .orgUnitType(unit.getType())
                .role(membership.getRole())
                .joinedAt(membership.getJoinedAt())
                .build();
    }
}
