package com.example.org_membershipservice.entity;

/**
 * Level of a unit in the organizational tree.
 * Council is the single root; Group is always a leaf.
 */
public enum OrgUnitType {
    COUNCIL,
    EXECUTIVE_COUNCIL,
    SECTOR,
    MINISTRY,
    GROUP
}
