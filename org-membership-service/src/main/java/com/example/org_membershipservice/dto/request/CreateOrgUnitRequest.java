package com.example.org_membershipservice.dto.request;

import com.example.org_membershipservice.entity.GroupSubtype;
import com.example.org_membershipservice.entity.OrgUnitType;
import com.example.org_membershipservice.entity.Visibility;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Request body for creating a child unit.
 * type is optional: when omitted it is inferred from the parent and groupSubtype.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrgUnitRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name must not exceed 200 characters")
    private String name;

    @Size(max = 2000, message = "Description must not exceed 2000 characters")
    private String description;

    private Visibility visibility;

    private OrgUnitType type;

    private GroupSubtype groupSubtype;

    /**
     * Extra coordinators besides the creator. Unknown ids are skipped.
     */
    private List<UUID> coordinatorUserIds;
}
