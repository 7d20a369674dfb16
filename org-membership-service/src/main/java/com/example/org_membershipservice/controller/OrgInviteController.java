package com.example.org_membershipservice.controller;

import com.example.org_membershipservice.dto.request.SendInviteRequest;
import com.example.org_membershipservice.dto.response.InviteResponse;
import com.example.org_membershipservice.dto.response.UserSummaryResponse;
import com.example.org_membershipservice.security.CurrentUser;
import com.example.org_membershipservice.service.OrgInviteService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Controller for the invite workflow.
 * Coordinators send and list invites; the invitee accepts or rejects.
 */
@RestController
@RequestMapping("/org")
@RequiredArgsConstructor
@Slf4j
public class OrgInviteController {

    private final OrgInviteService inviteService;

    @PostMapping("/units/{unitId}/invites")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<InviteResponse> sendInvite(
            @PathVariable UUID unitId,
            @Valid @RequestBody SendInviteRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        log.info("Inviting user {} to unit {}", request.getUserId(), unitId);
        InviteResponse response = inviteService.sendInvite(currentUser.toActor(), unitId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/units/{unitId}/invites/pending")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<InviteResponse>> listUnitPendingInvites(
            @PathVariable UUID unitId,
            @AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(inviteService.listUnitPendingInvites(currentUser.toActor(), unitId));
    }

    @GetMapping("/units/{unitId}/search-users")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<UserSummaryResponse>> searchUsers(
            @PathVariable UUID unitId,
            @RequestParam("q") String query,
            @AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(inviteService.searchUsersForInvite(currentUser.toActor(), unitId, query));
    }

    @PostMapping("/invites/{inviteId}/accept")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<InviteResponse> acceptInvite(
            @PathVariable UUID inviteId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        log.info("User {} accepting invite {}", currentUser.getUserId(), inviteId);
        return ResponseEntity.ok(inviteService.respondToInvite(currentUser.toActor(), inviteId, true));
    }

    @PostMapping("/invites/{inviteId}/reject")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<InviteResponse> rejectInvite(
            @PathVariable UUID inviteId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        log.info("User {} rejecting invite {}", currentUser.getUserId(), inviteId);
        return ResponseEntity.ok(inviteService.respondToInvite(currentUser.toActor(), inviteId, false));
    }

    @DeleteMapping("/invites/{inviteId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<InviteResponse> cancelInvite(
            @PathVariable UUID inviteId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        log.info("User {} cancelling invite {}", currentUser.getUserId(), inviteId);
        return ResponseEntity.ok(inviteService.cancelInvite(currentUser.toActor(), inviteId));
    }

    @GetMapping("/my/invites")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<InviteResponse>> listMyInvites(@AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(inviteService.listMyPendingInvites(currentUser.toActor()));
    }
}
