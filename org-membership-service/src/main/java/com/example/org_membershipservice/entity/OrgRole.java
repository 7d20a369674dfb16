package com.example.org_membershipservice.entity;

/**
 * Unit-level roles (different from global roles).
 * Stored on each membership row.
 */
public enum OrgRole {
    COORDINATOR,
    MEMBER
}
