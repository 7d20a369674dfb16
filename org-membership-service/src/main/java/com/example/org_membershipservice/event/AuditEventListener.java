package com.example.org_membershipservice.event;

import com.example.common.events.OrgAuditEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards audit events once the surrounding transaction has committed.
 * A rolled-back request emits nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditEventListener {

    private final AuditEventPublisher auditEventPublisher;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onAuditEvent(OrgAuditEvent event) {
        auditEventPublisher.publish(event);
    }
}
