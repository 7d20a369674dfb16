package com.example.org_membershipservice.dto.request;

import com.example.org_membershipservice.entity.Visibility;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update; null fields are left unchanged. The slug is never updated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateOrgUnitRequest {

    @Size(min = 1, max = 200, message = "Name must be between 1 and 200 characters")
    @Pattern(regexp = ".*\\S.*", message = "Name must not be blank")
    private String name;

    @Size(max = 2000, message = "Description must not exceed 2000 characters")
    private String description;

    private Visibility visibility;
}
