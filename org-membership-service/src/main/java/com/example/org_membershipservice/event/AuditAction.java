package com.example.org_membershipservice.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Audit actions emitted by the engine, with the entity type each one targets.
 */
@Getter
@RequiredArgsConstructor
public enum AuditAction {
    ORG_UNIT_CREATED("org_unit_created", "org_unit"),
    ORG_UNIT_UPDATED("org_unit_updated", "org_unit"),
    ORG_UNIT_DEACTIVATED("org_unit_deactivated", "org_unit"),
    INVITE_SENT("invite_sent", "org_invite"),
    INVITE_ACCEPTED("invite_accepted", "org_invite"),
    INVITE_REJECTED("invite_rejected", "org_invite"),
    INVITE_EXPIRED("invite_expired", "org_invite"),
    INVITE_CANCELLED("invite_cancelled", "org_invite"),
    MEMBER_ROLE_UPDATED("member_role_updated", "org_membership"),
    MEMBER_REMOVED("member_removed", "org_membership"),
    MEMBER_LEFT("member_left", "org_membership"),
    MEMBER_AUTO_PROMOTED("member_auto_promoted", "org_membership");

    private final String code;
    private final String entityType;
}
