package com.example.org_membershipservice.dto.response;

import com.example.org_membershipservice.entity.GroupSubtype;
import com.example.org_membershipservice.entity.OrgUnit;
import com.example.org_membershipservice.entity.OrgUnitType;
import com.example.org_membershipservice.entity.Visibility;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One node of a rendered tree. memberCount is counted at query time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrgTreeNodeResponse {

    private UUID id;
    private OrgUnitType type;
    private GroupSubtype groupSubtype;
    private String name;
    private String slug;
    private Visibility visibility;
    private long memberCount;
    private int depth;

    @Builder.Default
    private List<OrgTreeNodeResponse> children = new ArrayList<>();

    public static OrgTreeNodeResponse from(OrgUnit unit, long memberCount, int depth) {
        return OrgTreeNodeResponse.builder()
                .id(unit.getId())
                .type(unit.getType())
                .groupSubtype(unit.getGroupSubtype())
                .name(unit.getName())
                .slug(unit.getSlug())
                .visibility(unit.getVisibility())
                .memberCount(memberCount)
                .depth(depth)
                .build();
    }
}
