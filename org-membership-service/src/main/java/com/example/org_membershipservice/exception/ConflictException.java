package com.example.org_membershipservice.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Exception for conflict errors (HTTP 409).
 * Used for business rule violations.
 */
public class ConflictException extends BaseException {

    public ConflictException(String code, String message) {
        super(code, message, HttpStatus.CONFLICT);
    }

    public static ConflictException rootAlreadyExists() {
        return new ConflictException(
            "ALREADY_EXISTS",
            "An active root council already exists"
        );
    }

    /**
     * No free slug left, or a unique index rejected the unit.
     */
    public static ConflictException slugUnavailable(String baseSlug) {
        return new ConflictException(
            "ALREADY_EXISTS",
            String.format("No free slug available for %s", baseSlug)
        );
    }

    public static ConflictException alreadyMember(UUID userId, UUID unitId) {
        return new ConflictException(
            "ALREADY_MEMBER",
            String.format("User %s is already a member of unit %s", userId, unitId)
        );
    }

    public static ConflictException inviteExists(UUID userId, UUID unitId) {
        return new ConflictException(
            "INVITE_EXISTS",
            String.format("User %s already has a pending invite to unit %s", userId, unitId)
        );
    }

    public static ConflictException notPending(UUID inviteId, Object status) {
        return new ConflictException(
            "NOT_PENDING",
            String.format("Invite %s is already %s", inviteId, status)
        );
    }

    /**
     * The unit would be left without an active coordinator.
     */
    public static ConflictException lastCoordinator(UUID unitId) {
        return new ConflictException(
            "LAST_COORDINATOR",
            String.format("Unit %s must keep at least one coordinator", unitId)
        );
    }

    public static ConflictException unitHasActiveChildren(UUID unitId) {
        return new ConflictException(
            "UNIT_HAS_ACTIVE_CHILDREN",
            String.format("Unit %s still has active child units", unitId)
        );
    }
}
