package com.example.org_membershipservice.controller;

import com.example.org_membershipservice.dto.request.CreateOrgUnitRequest;
import com.example.org_membershipservice.dto.request.CreateRootUnitRequest;
import com.example.org_membershipservice.dto.request.UpdateOrgUnitRequest;
import com.example.org_membershipservice.dto.response.OrgTreeResponse;
import com.example.org_membershipservice.dto.response.OrgUnitResponse;
import com.example.org_membershipservice.dto.response.PermissionsResponse;
import com.example.org_membershipservice.security.CurrentUser;
import com.example.org_membershipservice.service.OrgTreeService;
import com.example.org_membershipservice.service.OrgUnitService;
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
 * Controller for org units and the tree.
 *
 * Authorization beyond "authenticated" is decided per unit by the services:
 * - POST /org/units/root: DEV
 * - POST /org/units/{parentId}/children: coordinator of the parent
 * - PATCH, DELETE /org/units/{unitId}: coordinator (root deactivation: DEV)
 */
@RestController
@RequestMapping("/org")
@RequiredArgsConstructor
@Slf4j
public class OrgUnitController {

    private final OrgUnitService unitService;
    private final OrgTreeService treeService;

    @GetMapping("/tree")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrgTreeResponse> getTree(
            @RequestParam(defaultValue = "true") boolean visibleOnly,
            @AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(treeService.getTree(currentUser.toActor(), visibleOnly));
    }

    @PostMapping("/units/root")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrgUnitResponse> createRoot(
            @Valid @RequestBody CreateRootUnitRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        log.info("Creating root council by {}", currentUser.getUserId());
        OrgUnitResponse response = unitService.createRoot(currentUser.toActor(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/units/{parentId}/children")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrgUnitResponse> createChild(
            @PathVariable UUID parentId,
            @Valid @RequestBody CreateOrgUnitRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        log.info("Creating child of unit {} by {}", parentId, currentUser.getUserId());
        OrgUnitResponse response = unitService.createChild(currentUser.toActor(), parentId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/units/{unitId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrgUnitResponse> getUnit(
            @PathVariable UUID unitId,
            @AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(unitService.getUnit(currentUser.toActor(), unitId));
    }

    @PatchMapping("/units/{unitId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrgUnitResponse> updateUnit(
            @PathVariable UUID unitId,
            @Valid @RequestBody UpdateOrgUnitRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        log.info("Updating unit {} by {}", unitId, currentUser.getUserId());
        return ResponseEntity.ok(unitService.updateUnit(currentUser.toActor(), unitId, request));
    }

    @DeleteMapping("/units/{unitId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> deactivateUnit(
            @PathVariable UUID unitId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        log.info("Deactivating unit {} by {}", unitId, currentUser.getUserId());
        unitService.deactivateUnit(currentUser.toActor(), unitId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Capability set of the caller on the unit. Never 403: a restricted unit
     * simply reports canView=false.
     */
    @GetMapping("/units/{unitId}/permissions")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PermissionsResponse> getPermissions(
            @PathVariable UUID unitId,
            @AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(unitService.getPermissions(currentUser.toActor(), unitId));
    }

    @GetMapping("/units/{unitId}/ancestors")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<OrgUnitResponse>> getAncestors(
            @PathVariable UUID unitId,
            @AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(treeService.getAncestors(currentUser.toActor(), unitId));
    }

    @GetMapping("/units/{unitId}/tree")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OrgTreeResponse> getSubtree(
            @PathVariable UUID unitId,
            @RequestParam(defaultValue = "true") boolean visibleOnly,
            @AuthenticationPrincipal CurrentUser currentUser) {
        return ResponseEntity.ok(treeService.getSubtree(currentUser.toActor(), unitId, visibleOnly));
    }
}
