package com.example.org_membershipservice.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Exception for forbidden access (HTTP 403).
 * User is authenticated but lacks permission.
 */
public class ForbiddenException extends BaseException {

    public static final String PERMISSION_DENIED = "PERMISSION_DENIED";

    public ForbiddenException(String code, String message) {
        super(code, message, HttpStatus.FORBIDDEN);
    }

    public ForbiddenException(String message) {
        super(PERMISSION_DENIED, message, HttpStatus.FORBIDDEN);
    }

    public static ForbiddenException insufficientPermission() {
        return new ForbiddenException("You do not have permission to perform this action");
    }

    /**
     * Actor is not an active coordinator of the unit.
     */
    public static ForbiddenException notCoordinator(UUID unitId) {
        return new ForbiddenException(
            String.format("Only coordinators of unit %s can perform this action", unitId)
        );
    }

    /**
     * Restricted unit, actor is neither member nor admin.
     */
    public static ForbiddenException restrictedUnit(UUID unitId) {
        return new ForbiddenException(
            String.format("Unit %s is restricted to its members", unitId)
        );
    }

    public static ForbiddenException roleRequired(String requiredRole) {
        return new ForbiddenException(
            String.format("This action requires %s role", requiredRole)
        );
    }

    public static ForbiddenException notInvitee(UUID inviteId) {
        return new ForbiddenException(
            String.format("Invite %s is addressed to another user", inviteId)
        );
    }
}
