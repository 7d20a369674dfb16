package com.example.org_membershipservice.event;

import com.example.common.events.OrgAuditEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes committed audit events on {@code org.audit}, keyed by entity id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true")
public class KafkaAuditEventPublisher implements AuditEventPublisher {

    static final String ORG_AUDIT_TOPIC = "org.audit";

    private final KafkaTemplate<String, OrgAuditEvent> auditKafkaTemplate;

    @Override
    public void publish(OrgAuditEvent event) {
        String key = event.getEntityId() != null ? event.getEntityId().toString() : null;
        log.info("Publishing OrgAuditEvent: action={}, entityId={}", event.getAction(), key);

        try {
            auditKafkaTemplate.send(ORG_AUDIT_TOPIC, key, event)
                    .whenComplete((result, ex) -> {
                        if (ex == null) {
                            log.debug("OrgAuditEvent published: eventId={}", event.getEventId());
                        } else {
                            log.error("Failed to publish OrgAuditEvent: eventId={}", event.getEventId(), ex);
                        }
                    });
        } catch (Exception e) {
            // the mutation is already committed, audit delivery failure is only logged
            log.error("Error publishing OrgAuditEvent: eventId={}", event.getEventId(), e);
        }
    }
}
