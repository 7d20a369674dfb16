package com.example.org_membershipservice.entity;

/**
 * Invite lifecycle. PENDING is the only non-terminal state.
 */
public enum InviteStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    EXPIRED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
