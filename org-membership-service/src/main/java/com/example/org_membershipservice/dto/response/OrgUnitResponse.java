package com.example.org_membershipservice.dto.response;

import com.example.org_membershipservice.entity.GroupSubtype;
import com.example.org_membershipservice.entity.OrgUnit;
import com.example.org_membershipservice.entity.OrgUnitType;
import com.example.org_membershipservice.entity.Visibility;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Unit descriptor returned by create, read and update endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrgUnitResponse {

    private UUID id;
    private OrgUnitType type;
    private GroupSubtype groupSubtype;
    private String name;
    private String slug;
    private String description;
    private UUID parentId;
    private Visibility visibility;
    private boolean active;
    private UUID createdBy;
    private Instant createdAt;
    private Instant updatedAt;

    public static OrgUnitResponse from(OrgUnit unit) {
        return OrgUnitResponse.builder()
                .id(unit.getId())
                .type(unit.getType())
                .groupSubtype(unit.getGroupSubtype())
                .name(unit.getName())
                .slug(unit.getSlug())
                .description(unit.getDescription())
                .parentId(unit.getParentId())
                .visibility(unit.getVisibility())
                .active(unit.isActive())
                .createdBy(unit.getCreatedBy())
                .createdAt(unit.getCreatedAt())
                .updatedAt(unit.getUpdatedAt())
                .build();
    }
}
