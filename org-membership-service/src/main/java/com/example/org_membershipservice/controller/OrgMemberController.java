package com.example.org_membershipservice.controller;

import com.example.org_membershipservice.dto.request.UpdateRoleRequest;
import com.example.org_membershipservice.dto.response.MemberResponse;
import com.example.org_membershipservice.dto.response.MyMembershipResponse;
import com.example.org_membershipservice.security.CurrentUser;
import com.example.org_membershipservice.service.OrgMembershipService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Controller for unit members.
 * DELETE on oneself is the same as POST /leave.
 */
@RestController
@RequestMapping("/org")
@RequiredArgsConstructor
@Slf4j
public class OrgMemberController {

    private final OrgMembershipService membershipService;

    @GetMapping("/units/{unitId}/members")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<MemberResponse>> listMembers(
            @PathVariable UUID unitId,
            @AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(membershipService.listMembers(currentUser.toActor(), unitId));
    }

    @PutMapping("/units/{unitId}/members/{userId}/role")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<MemberResponse> updateRole(
            @PathVariable UUID unitId,
            @PathVariable UUID userId,
            @Valid @RequestBody UpdateRoleRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        log.info("Setting role {} for user {} in unit {}", request.getRole(), userId, unitId);
        MemberResponse response = membershipService.updateRole(
                currentUser.toActor(), unitId, userId, request.getRole());
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/units/{unitId}/members/{userId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> removeMember(
            @PathVariable UUID unitId,
            @PathVariable UUID userId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        log.info("Removing user {} from unit {}", userId, unitId);
        membershipService.removeMember(currentUser.toActor(), unitId, userId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/units/{unitId}/leave")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> leaveUnit(
            @PathVariable UUID unitId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        log.info("User {} leaving unit {}", currentUser.getUserId(), unitId);
        membershipService.leaveUnit(currentUser.toActor(), unitId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/my/memberships")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<MyMembershipResponse>> listMyMemberships(
            @AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(membershipService.listMyMemberships(currentUser.toActor()));
    }
}
