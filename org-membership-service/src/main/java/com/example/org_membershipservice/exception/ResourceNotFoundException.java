package com.example.org_membershipservice.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Exception for resource not found errors (HTTP 404).
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    public static ResourceNotFoundException unitNotFound(UUID unitId) {
        return new ResourceNotFoundException(
            "ORG_UNIT_NOT_FOUND",
            String.format("Org unit with ID %s not found", unitId)
        );
    }

    public static ResourceNotFoundException userNotFound(UUID userId) {
        return new ResourceNotFoundException(
            "USER_NOT_FOUND",
            String.format("User with ID %s not found", userId)
        );
    }

    public static ResourceNotFoundException inviteNotFound(UUID inviteId) {
        return new ResourceNotFoundException(
            "INVITE_NOT_FOUND",
            String.format("Invite with ID %s not found", inviteId)
        );
    }

    /**
     * User has no active membership in the unit.
     */
    public static ResourceNotFoundException memberNotFound(UUID userId, UUID unitId) {
        return new ResourceNotFoundException(
            "MEMBER_NOT_FOUND",
            String.format("User %s is not a member of unit %s", userId, unitId)
        );
    }
}
