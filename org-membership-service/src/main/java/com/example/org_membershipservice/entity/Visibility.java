package com.example.org_membershipservice.entity;

/**
 * Whether non-members may see a unit and its members.
 */
public enum Visibility {
    PUBLIC,
    RESTRICTED
}
