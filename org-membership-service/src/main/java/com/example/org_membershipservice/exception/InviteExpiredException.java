package com.example.org_membershipservice.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Invite was answered after its expiry (HTTP 410).
 * Declared as noRollbackFor on the respond operation so the EXPIRED
 * transition is committed while the caller still receives the error.
 */
public class InviteExpiredException extends BaseException {

    public InviteExpiredException(UUID inviteId) {
        super("INVITE_EXPIRED",
            String.format("Invite %s has expired", inviteId),
            HttpStatus.GONE);
    }
}
