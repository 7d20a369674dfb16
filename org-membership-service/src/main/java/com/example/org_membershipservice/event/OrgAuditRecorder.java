package com.example.org_membershipservice.event;

import com.example.common.events.OrgAuditEvent;
import com.example.org_membershipservice.config.OrgProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Records audit events from inside service transactions.
 *
 * Events go through Spring's ApplicationEventPublisher and are only forwarded
 * once the transaction commits (see AuditEventListener).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrgAuditRecorder {

    private final ApplicationEventPublisher eventPublisher;
    private final OrgProperties orgProperties;

    /**
     * @param actorUserId null for system-initiated changes
     * @param metadata ids, roles and types only; null values are dropped
     */
    public void record(UUID actorUserId, AuditAction action, UUID entityId, Map<String, ?> metadata) {
        if (!orgProperties.isAuditEnabled()) {
            return;
        }
        Map<String, String> flat = new LinkedHashMap<>();
        metadata.forEach((key, value) -> {
            if (value != null) {
                flat.put(key, value.toString());
            }
        });

        OrgAuditEvent event = OrgAuditEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .actorUserId(actorUserId)
                .action(action.getCode())
                .entityType(action.getEntityType())
                .entityId(entityId)
                .metadata(flat)
                .occurredAt(Instant.now())
                .build();

        log.debug("Audit event recorded: action={}, entityId={}", event.getAction(), entityId);
        eventPublisher.publishEvent(event);
    }

    public void record(UUID actorUserId, AuditAction action, UUID entityId) {
        record(actorUserId, action, entityId, Map.of());
    }
}
