package com.example.common.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Org Audit Event
 *
 * Published by: Org Membership Service after a mutation commits.
 * Topic: {@code org.audit}, keyed by entityId.
 *
 * Metadata only carries ids, roles and types. Personal fields never appear here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrgAuditEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private String eventId;

    /**
     * Acting user, or null when the system acted (e.g. user cleanup)
     */
    private UUID actorUserId;

    /**
     * Snake-case action name, e.g. {@code invite_sent}
     */
    private String action;

    /**
     * org_unit, org_invite or org_membership
     */
    private String entityType;

    private UUID entityId;

    private Map<String, String> metadata;

    private Instant occurredAt;
}
