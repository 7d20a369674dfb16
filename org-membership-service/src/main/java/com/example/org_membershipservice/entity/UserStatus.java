package com.example.org_membershipservice.entity;

/**
 * Status of a replicated user account.
 * Only ACTIVE users can be invited.
 */
public enum UserStatus {
    ACTIVE,
    INACTIVE
}
