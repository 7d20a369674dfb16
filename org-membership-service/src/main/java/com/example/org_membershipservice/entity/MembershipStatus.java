package com.example.org_membershipservice.entity;

public enum MembershipStatus {
    ACTIVE,
    REMOVED
}
