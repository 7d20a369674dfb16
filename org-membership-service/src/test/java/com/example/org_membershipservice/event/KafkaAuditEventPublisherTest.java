package com.example.org_membershipservice.event;

import com.example.common.events.OrgAuditEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KafkaAuditEventPublisherTest {

    @Mock
    private KafkaTemplate<String, OrgAuditEvent> auditKafkaTemplate;

    @InjectMocks
    private KafkaAuditEventPublisher publisher;

    @Test
    void publish_sendsToAuditTopicKeyedByEntity() {
        OrgAuditEvent event = event();
        CompletableFuture<SendResult<String, OrgAuditEvent>> future = new CompletableFuture<>();
        when(auditKafkaTemplate.send(KafkaAuditEventPublisher.ORG_AUDIT_TOPIC, event.getEntityId().toString(), event))
                .thenReturn(future);

        publisher.publish(event);
        future.completeExceptionally(new IllegalStateException("broker down"));

        verify(auditKafkaTemplate).send(KafkaAuditEventPublisher.ORG_AUDIT_TOPIC, event.getEntityId().toString(), event);
    }

    @Test
    void publish_swallowsSynchronousSendFailure() {
        when(auditKafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("no producer"));

        assertDoesNotThrow(() -> publisher.publish(event()));
    }

    private static OrgAuditEvent event() {
        return OrgAuditEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .action("invite_sent")
                .entityType("org_invite")
                .entityId(UUID.randomUUID())
                .metadata(Map.of("role", "MEMBER"))
                .occurredAt(Instant.now())
                .build();
    }
}
