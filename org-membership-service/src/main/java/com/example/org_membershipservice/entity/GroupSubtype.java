package com.example.org_membershipservice.entity;

/**
 * Kind of a GROUP unit. Only valid when the unit type is GROUP.
 */
public enum GroupSubtype {
    WELCOMING,
    DEEPENING,
    VOCATIONAL,
    COUPLES,
    COURSE,
    PROJECT
}
