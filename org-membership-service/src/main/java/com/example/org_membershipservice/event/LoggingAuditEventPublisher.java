package com.example.org_membershipservice.event;

import com.example.common.events.OrgAuditEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Audit sink used when Kafka is disabled: the event only goes to the log.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingAuditEventPublisher implements AuditEventPublisher {

    @Override
    public void publish(OrgAuditEvent event) {
        log.info("AUDIT action={}, entityType={}, entityId={}, actor={}, metadata={}",
                event.getAction(), event.getEntityType(), event.getEntityId(),
                event.getActorUserId(), event.getMetadata());
    }
}
