package com.example.org_membershipservice.event;

import com.example.common.events.OrgAuditEvent;

/**
 * Outbound sink for committed audit events. Fire-and-forget: failures are logged, never thrown.
 */
public interface AuditEventPublisher {

    void publish(OrgAuditEvent event);
}
