package com.example.org_membershipservice.dto.request;

import com.example.org_membershipservice.entity.OrgRole;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendInviteRequest {

    @NotNull(message = "User ID is required")
    private UUID userId;

    /**
     * Proposed role, MEMBER when omitted.
     */
    private OrgRole role;

    @Size(max = 1000, message = "Message must not exceed 1000 characters")
    private String message;
}
